package com.flightsentinel.service;

import java.util.Objects;

/**
 * Typed, immutable process-level configuration for the detector service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable from a container spec or a shell. Detection
 * tuning lives in the YAML file named by {@code DETECTOR_CONFIG_PATH}; the
 * two path overrides here take precedence over that file.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    private final String detectorConfigPath;
    private final String telemetryPathOverride;
    private final String anomaliesPathOverride;
    private final boolean healthEnabled;
    private final int healthPort;
    private final long shutdownTimeoutMs;

    private ServiceConfig(Builder b) {
        this.detectorConfigPath = b.detectorConfigPath;
        this.telemetryPathOverride = b.telemetryPathOverride;
        this.anomaliesPathOverride = b.anomaliesPathOverride;
        this.healthEnabled = b.healthEnabled;
        this.healthPort = b.healthPort;
        this.shutdownTimeoutMs = b.shutdownTimeoutMs;
    }

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric env-var cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .detectorConfigPath(env("DETECTOR_CONFIG_PATH", ""))
                    .telemetryPathOverride(env("TELEMETRY_PATH", ""))
                    .anomaliesPathOverride(env("ANOMALIES_PATH", ""))
                    .healthEnabled(Boolean.parseBoolean(env("HEALTH_ENABLED", "true")))
                    .healthPort(Integer.parseInt(env("HEALTH_PORT", "8080")))
                    .shutdownTimeoutMs(Long.parseLong(env("SHUTDOWN_TIMEOUT_MS", "10000")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return YAML path, or blank to fall back to the classpath
     */
    public String getDetectorConfigPath() {
        return detectorConfigPath;
    }

    public String getTelemetryPathOverride() {
        return telemetryPathOverride;
    }

    public String getAnomaliesPathOverride() {
        return anomaliesPathOverride;
    }

    public boolean isHealthEnabled() {
        return healthEnabled;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     */
    public static class Builder {
        private String detectorConfigPath = "";
        private String telemetryPathOverride = "";
        private String anomaliesPathOverride = "";
        private boolean healthEnabled = true;
        private int healthPort = 8080;
        private long shutdownTimeoutMs = 10_000;

        public Builder detectorConfigPath(String v) {
            this.detectorConfigPath = v;
            return this;
        }

        public Builder telemetryPathOverride(String v) {
            this.telemetryPathOverride = v;
            return this;
        }

        public Builder anomaliesPathOverride(String v) {
            this.anomaliesPathOverride = v;
            return this;
        }

        public Builder healthEnabled(boolean v) {
            this.healthEnabled = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder shutdownTimeoutMs(long v) {
            this.shutdownTimeoutMs = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(detectorConfigPath, "detectorConfigPath required");
            Objects.requireNonNull(telemetryPathOverride, "telemetryPathOverride required");
            Objects.requireNonNull(anomaliesPathOverride, "anomaliesPathOverride required");

            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (shutdownTimeoutMs < 0) {
                throw new IllegalArgumentException(
                        "shutdownTimeoutMs must be >= 0, got: " + shutdownTimeoutMs);
            }
            return new ServiceConfig(this);
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "detectorConfigPath='" + detectorConfigPath + '\'' +
                ", telemetryPathOverride='" + telemetryPathOverride + '\'' +
                ", anomaliesPathOverride='" + anomaliesPathOverride + '\'' +
                ", healthEnabled=" + healthEnabled +
                ", healthPort=" + healthPort +
                ", shutdownTimeoutMs=" + shutdownTimeoutMs +
                '}';
    }
}
