package io.ringbridge.producer;

import io.ringbridge.ack.BufferAcknowledger;
import io.ringbridge.buffer.RecordingBuffer;
import io.ringbridge.core.model.Message;
import io.ringbridge.registry.AckRegistry;
import io.ringbridge.telemetry.FetchEvent;
import io.ringbridge.telemetry.Telemetry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class DemandResolverTest {

    private final RecordingBuffer<String> buffer = new RecordingBuffer<>();
    private final List<FetchEvent> events = new ArrayList<>();
    private final DemandResolver<String> resolver = new DemandResolver<>(
            new BufferAcknowledger<>(new AckRegistry()),
            Telemetry.noop().attach("test", events::add));

    private ProducerState<String> state(final long pending) {
        return new ProducerState<>("orders", buffer, pending, Duration.ofMillis(100));
    }

    @Test
    void emptyBufferAccumulatesDemand() {
        final Resolution<String> r = resolver.resolve(5, state(2));

        assertTrue(r.messages().isEmpty());
        assertEquals(7, r.state().pendingDemand());
    }

    @Test
    void fullBufferSatisfiesAllDemand() {
        buffer.fill("a", "b", "c", "d", "e", "f", "g", "h");

        final Resolution<String> r = resolver.resolve(4, state(3));

        assertEquals(List.of("a", "b", "c", "d", "e", "f", "g"), r.messages().stream().map(Message::data).toList());
        assertEquals(0, r.state().pendingDemand());
        assertEquals(1, buffer.size());
    }

    @Test
    void neverAsksTheBufferForMoreThanTheTotal() {
        buffer.fill("a", "b", "c");

        resolver.resolve(2, state(0));

        assertEquals(List.of(2), buffer.pops());
        assertEquals(1, buffer.size());
    }

    @Test
    void signalThenTickScenario() {
        buffer.fill("a", "b", "c");
        final Resolution<String> first = resolver.resolve(10, state(0));

        assertEquals(3, first.messages().size());
        assertEquals(7, first.state().pendingDemand());

        buffer.fill("d", "e", "f", "g");
        final Resolution<String> tick = resolver.resolve(0, first.state());

        assertEquals(List.of("d", "e", "f", "g"), tick.messages().stream().map(Message::data).toList());
        assertEquals(3, tick.state().pendingDemand());
    }

    @Test
    void messagesCarryProducerIdentityAndNoOverrides() {
        buffer.fill("a");

        final Message<String> m = resolver.resolve(1, state(0)).messages().get(0);

        assertEquals("orders", m.ackToken().ackRef());
        assertTrue(m.ackToken().ackData().isEmpty());
        assertInstanceOf(BufferAcknowledger.class, m.ackToken().acknowledger());
        assertFalse(m.isFailed());
    }

    @Test
    void cumulativeMessagesNeverExceedCumulativeDemand() {
        final Random random = new Random(42);
        ProducerState<String> s = state(0);
        long requested = 0;
        long produced = 0;

        for (int i = 0; i < 500; i++) {
            final int arriving = random.nextInt(6);
            for (int j = 0; j < arriving; j++) {
                buffer.fill("item-" + i + "-" + j);
            }
            final long demand = random.nextInt(4);
            requested += demand;

            final Resolution<String> r = resolver.resolve(demand, s);
            produced += r.messages().size();
            s = r.state();

            assertTrue(produced <= requested, "produced " + produced + " > requested " + requested);
            assertEquals(requested - produced, s.pendingDemand());
        }
    }

    @Test
    void zeroDemandStillEmitsPairedEventsWithoutPopping() {
        buffer.fill("a");

        final Resolution<String> r = resolver.resolve(0, state(0));

        assertTrue(r.messages().isEmpty());
        assertTrue(buffer.pops().isEmpty());
        assertEquals(List.of(FetchEvent.START, FetchEvent.STOP), events.stream().map(FetchEvent::name).toList());
    }

    @Test
    void eventsReportTotalDemandAndProducedCount() {
        buffer.fill("a", "b");

        resolver.resolve(3, state(2));

        final FetchEvent.Start start = (FetchEvent.Start) events.get(0);
        final FetchEvent.Stop stop = (FetchEvent.Stop) events.get(1);
        assertEquals("orders", start.producer());
        assertEquals(5, start.demand());
        assertEquals(5, stop.demand());
        assertEquals(2, stop.producedCount());
        assertNull(stop.error());
        assertFalse(stop.duration().isNegative());
    }

    @Test
    void rejectsNegativeDemand() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(-1, state(0)));
        assertTrue(events.isEmpty());
    }

    @Test
    void bufferFailurePropagatesAfterStopEvent() {
        buffer.failWith(new IllegalStateException("buffer down"));

        assertThrows(IllegalStateException.class, () -> resolver.resolve(1, state(0)));

        assertEquals(2, events.size());
        final FetchEvent.Stop stop = (FetchEvent.Stop) events.get(1);
        assertEquals(0, stop.producedCount());
        assertEquals("buffer down", stop.error().getMessage());
    }

    @Test
    void overfillingBufferIsTreatedAsFailure() {
        buffer.fill("a", "b");
        buffer.overfill(2);

        assertThrows(IllegalStateException.class, () -> resolver.resolve(2, state(0)));
    }

    @Test
    void pendingDemandCannotGoNegative() {
        assertThrows(IllegalArgumentException.class, () -> state(-1));
    }
}
