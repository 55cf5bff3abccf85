package io.ringbridge.telemetry;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes every fetch event to the log at DEBUG.
 */
@Slf4j
public final class LoggingTelemetryHandler implements TelemetryHandler {

    @Override
    public void handle(final FetchEvent event) {
        if (!log.isDebugEnabled()) return;

        if (event instanceof FetchEvent.Stop stop) {
            if (stop.error() != null) {
                log.debug("{} producer={} demand={} failed after {}us: {}", stop.name(), stop.producer(),
                        stop.demand(), stop.duration().toNanos() / 1_000, stop.error().toString());
            } else {
                log.debug("{} producer={} demand={} produced={} in {}us", stop.name(), stop.producer(),
                        stop.demand(), stop.producedCount(), stop.duration().toNanos() / 1_000);
            }
        } else {
            log.debug("{} producer={} demand={}", event.name(), event.producer(), event.demand());
        }
    }
}
