package io.ringbridge.buffer;

import java.util.List;

/**
 * FIFO item store that producers pull from and acknowledgers push back into.
 * <p>
 * Implementations must be safe under concurrent {@link #push(List)} and {@link #pop(int)} callers.
 *
 * @param <T> the item type
 */
public interface Buffer<T> {

    /**
     * Appends {@code items} to the tail of the buffer, in list order.
     */
    void push(List<T> items);

    /**
     * Removes and returns up to {@code maxCount} items from the head of the buffer.
     *
     * @param maxCount upper bound on the number of returned items, must be &ge; 0
     * @return between 0 and {@code maxCount} items in FIFO order, never {@code null}
     */
    List<T> pop(int maxCount);

    /** Number of items currently held. */
    int size();
}
