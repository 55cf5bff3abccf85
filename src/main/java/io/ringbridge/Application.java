package io.ringbridge;

import io.ringbridge.buffer.impl.MemoryBuffer;
import io.ringbridge.config.impl.BridgeConfig;
import io.ringbridge.config.type.ConfigLoader;
import io.ringbridge.host.Pipeline;
import io.ringbridge.registry.AckRegistry;
import io.ringbridge.telemetry.LoggingTelemetryHandler;
import io.ringbridge.telemetry.Telemetry;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Pipes stdin lines through a memory buffer into a processing pipeline.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length > 1) {
            System.err.println("Usage: java -jar ringbridge.jar [bridge.yaml]");
            System.exit(1);
        }

        /* Load settings, or run on defaults */
        final BridgeConfig cfg = args.length == 1 ? ConfigLoader.load(args[0]) : BridgeConfig.defaults();

        final MemoryBuffer<String> buffer = new MemoryBuffer<>();
        final Telemetry telemetry = Telemetry.noop().attach("log", new LoggingTelemetryHandler());

        final Pipeline<String> pipeline = Pipeline.start(
                ConfigLoader.producerConfig(cfg, buffer),
                message -> {
                    log.info("Processed: {}", message.data());
                    return message;
                },
                cfg.getConcurrency(),
                cfg.getMaxDemand(),
                telemetry,
                AckRegistry.global());

        Runtime.getRuntime().addShutdownHook(new Thread(pipeline::close, "pipeline-shutdown"));

        long pushed = 0;
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) continue;
                buffer.push(List.of(line));
                pushed++;
            }
        }

        log.info("Input closed after {} lines, waiting for the pipeline to drain", pushed);
        final long sleepMillis = cfg.getResolvePendingTimeout().toMillis();
        while ((buffer.size() > 0 || pipeline.inFlight() > 0) && pipeline.getProducer().isRunning()) {
            Thread.sleep(sleepMillis);
        }

        pipeline.close();
        log.info("Done: {}", Map.of("succeeded", pipeline.succeededCount(), "failed", pipeline.failedCount()));
    }
}
