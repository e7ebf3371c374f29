package com.flightsentinel.service;

import com.flightsentinel.core.config.DetectorConfig;
import com.flightsentinel.core.config.DetectorConfigLoader;
import com.flightsentinel.core.ingest.DetectionEngine;
import com.flightsentinel.core.ingest.IngestionLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for the Flight Sentinel detector.
 *
 * <h3>Lifecycle</h3>
 *
 * <pre>
 *   load ServiceConfig (env) and DetectorConfig (YAML)
 *     → reset anomaly store
 *     → start health server
 *     → run IngestionLoop on the "ingestion-loop" thread
 *     → on SIGINT / SIGTERM: stop loop, wait for the current cycle, exit 0
 * </pre>
 *
 * @since 1.0.0
 */
public final class DetectorService {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorService.class);

    private DetectorService() {
        // entry-point class; not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        ServiceConfig serviceConfig = ServiceConfig.fromEnvironment();
        LOG.info("Starting Flight Sentinel with config: {}", serviceConfig);

        DetectorConfig detectorConfig = loadDetectorConfig(serviceConfig);

        DetectionEngine engine = DetectionEngine.create(detectorConfig, Clock.systemUTC());
        engine.start();

        IngestionLoop loop = new IngestionLoop(engine,
                Duration.ofMillis(detectorConfig.getPollIntervalMs()),
                Duration.ofMillis(detectorConfig.getBackoffIntervalMs()));

        HealthServer healthServer = new HealthServer(engine::stats);
        if (serviceConfig.isHealthEnabled()) {
            healthServer.start(serviceConfig.getHealthPort());
        }

        Thread loopThread = new Thread(loop, "ingestion-loop");
        Runtime.getRuntime().addShutdownHook(new Thread(
                () -> shutdown(loop, loopThread, healthServer, serviceConfig.getShutdownTimeoutMs()),
                "detector-shutdown"));

        loopThread.start();
        loopThread.join();
        LOG.info("Flight Sentinel stopped: {}", engine.stats());
    }

    /**
     * Resolve the YAML configuration and apply environment path overrides.
     */
    static DetectorConfig loadDetectorConfig(ServiceConfig serviceConfig) {
        String path = serviceConfig.getDetectorConfigPath();
        DetectorConfig config = (path != null && !path.isBlank())
                ? DetectorConfigLoader.fromFile(path)
                : DetectorConfigLoader.load();

        if (!serviceConfig.getTelemetryPathOverride().isBlank()) {
            config.setTelemetryPath(serviceConfig.getTelemetryPathOverride());
        }
        if (!serviceConfig.getAnomaliesPathOverride().isBlank()) {
            config.setAnomaliesPath(serviceConfig.getAnomaliesPathOverride());
        }
        config.validate();
        return config;
    }

    private static void shutdown(IngestionLoop loop, Thread loopThread, HealthServer healthServer,
            long timeoutMs) {
        loop.stop();
        try {
            loopThread.join(timeoutMs);
            if (loopThread.isAlive()) {
                LOG.warn("Ingestion loop did not stop within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            healthServer.stop();
        }
    }
}
