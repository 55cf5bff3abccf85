package io.ringbridge.telemetry;

/**
 * Receives fetch events on the producer's thread. Keep it fast.
 */
@FunctionalInterface
public interface TelemetryHandler {
    void handle(FetchEvent event);
}
