package io.ringbridge.ack;

import io.ringbridge.buffer.RecordingBuffer;
import io.ringbridge.config.InvalidConfigurationException;
import io.ringbridge.core.model.AckToken;
import io.ringbridge.core.model.Message;
import io.ringbridge.registry.AckRegistry;
import io.ringbridge.registry.UnregisteredProducerException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class BufferAcknowledgerTest {

    private final AckRegistry registry = new AckRegistry();
    private final RecordingBuffer<String> buffer = new RecordingBuffer<>();
    private final BufferAcknowledger<String> acknowledger = new BufferAcknowledger<>(registry);

    private Message<String> message(final String data) {
        return new Message<>(data, new AckToken<>(acknowledger, "orders", Map.of()));
    }

    private Message<String> message(final String data, final FailurePolicy override) {
        return message(data).configureAck(Map.of(AckToken.ON_FAILURE, override));
    }

    private void register(final FailurePolicy policy) {
        registry.register("orders", new AckConfig<>(buffer, policy));
    }

    @Test
    void discardDefaultNeverTouchesTheBuffer() {
        register(FailurePolicy.DISCARD);

        acknowledger.ack("orders",
                List.of(message("m1"), message("m2")),
                List.of(message("m3"), message("m4"), message("m5")));

        assertTrue(buffer.pushes().isEmpty());
        assertEquals(0, buffer.size());
    }

    @Test
    void requeueDefaultPushesFailedPayloadsOnceInOrder() {
        register(FailurePolicy.REQUEUE);

        acknowledger.ack("orders",
                List.of(message("m1"), message("m2")),
                List.of(message("m3"), message("m4"), message("m5")));

        assertEquals(List.of(List.of("m3", "m4", "m5")), buffer.pushes());
        assertEquals(List.of("m3", "m4", "m5"), buffer.drain());
    }

    @Test
    void successfulMessagesAreNeverRequeued() {
        register(FailurePolicy.REQUEUE);

        acknowledger.ack("orders", List.of(message("m1"), message("m2")), List.of());

        assertTrue(buffer.pushes().isEmpty());
    }

    @Test
    void requeueOverrideWinsOverDiscardDefault() {
        register(FailurePolicy.DISCARD);

        acknowledger.ack("orders", List.of(), List.of(
                message("a"),
                message("b", FailurePolicy.REQUEUE),
                message("c"),
                message("d", FailurePolicy.REQUEUE)));

        assertEquals(List.of(List.of("b", "d")), buffer.pushes());
    }

    @Test
    void discardOverrideWinsOverRequeueDefault() {
        register(FailurePolicy.REQUEUE);

        acknowledger.ack("orders", List.of(), List.of(
                message("a"),
                message("b", FailurePolicy.DISCARD),
                message("c")));

        assertEquals(List.of(List.of("a", "c")), buffer.pushes());
    }

    @Test
    void payloadIsRequeuedUnchanged() {
        final RecordingBuffer<Object> objects = new RecordingBuffer<>();
        registry.register("objects", new AckConfig<>(objects, FailurePolicy.REQUEUE));
        final BufferAcknowledger<Object> ack = new BufferAcknowledger<>(registry);
        final Object payload = new Object();

        ack.ack("objects", List.of(), List.of(new Message<>(payload, new AckToken<>(ack, "objects", Map.of()))));

        assertSame(payload, objects.drain().get(0));
    }

    @Test
    void ackingTwiceRequeuesTwice() {
        register(FailurePolicy.REQUEUE);
        final List<Message<String>> failed = List.of(message("x"), message("y"));

        acknowledger.ack("orders", List.of(), failed);
        acknowledger.ack("orders", List.of(), failed);

        assertEquals(2, buffer.pushes().size());
        assertEquals(List.of("x", "y", "x", "y"), buffer.drain());
    }

    @Test
    void ackForUnregisteredProducerFails() {
        assertThrows(UnregisteredProducerException.class,
                () -> acknowledger.ack("orders", List.of(), List.of(message("a"))));
    }

    @Test
    void bufferFailurePropagates() {
        register(FailurePolicy.REQUEUE);
        buffer.failWith(new IllegalStateException("buffer down"));

        final IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> acknowledger.ack("orders", List.of(), List.of(message("a"))));
        assertEquals("buffer down", e.getMessage());
    }

    @Test
    void configureMergesWithOptionsWinning() {
        final Map<String, Object> merged = acknowledger.configure("orders",
                Map.of("trace", "t-1", AckToken.ON_FAILURE, "discard"),
                Map.of(AckToken.ON_FAILURE, FailurePolicy.REQUEUE, "attempt", 2));

        assertEquals(Map.of(
                "trace", "t-1",
                AckToken.ON_FAILURE, FailurePolicy.REQUEUE,
                "attempt", 2), merged);
    }

    @Test
    void configureDoesNotTouchTheRegistry() {
        acknowledger.configure("orders", Map.of(), Map.of(AckToken.ON_FAILURE, "requeue"));

        assertFalse(registry.contains("orders"));
    }

    @Test
    void configureRejectsUnknownPolicy() {
        final InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> acknowledger.configure("orders", Map.of(), Map.of(AckToken.ON_FAILURE, "retry")));
        assertEquals(AckToken.ON_FAILURE, e.getKey());
    }
}
