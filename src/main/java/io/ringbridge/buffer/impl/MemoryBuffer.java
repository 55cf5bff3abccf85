package io.ringbridge.buffer.impl;

import io.ringbridge.buffer.Buffer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded in-memory FIFO buffer.
 * <p>
 * A single lock guards the deque so that a batch {@link #push(List)} lands contiguously even when
 * several acknowledgers requeue at the same time.
 *
 * @param <T> the item type
 */
public final class MemoryBuffer<T> implements Buffer<T> {
    private final ArrayDeque<T> items = new ArrayDeque<>();
    private final Lock lock = new ReentrantLock();

    public MemoryBuffer() {
    }

    public MemoryBuffer(final List<T> initial) {
        push(initial);
    }

    @Override
    public void push(final List<T> batch) {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) return;

        lock.lock();
        try {
            for (final T item : batch) {
                items.addLast(Objects.requireNonNull(item, "item"));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<T> pop(final int maxCount) {
        if (maxCount < 0) {
            throw new IllegalArgumentException("maxCount must be >= 0");
        }
        if (maxCount == 0) return Collections.emptyList();

        lock.lock();
        try {
            final int n = Math.min(maxCount, items.size());
            if (n == 0) return Collections.emptyList();

            final List<T> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                out.add(items.pollFirst());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }
}
