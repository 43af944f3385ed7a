package com.seriessentinel.service;

/**
 * Typed, immutable runtime configuration for the Series Sentinel processes.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable via container env vars or a shell environment.
 * Detection defaults (contamination, thresholds, forest shape) are not part
 * of this object; they live in the YAML file named by
 * {@link #getDetectionConfigPath()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    private final int detectionPort;
    private final int relayPort;
    private final int workerThreads;
    private final String detectionConfigPath;

    private ServiceConfig(Builder b) {
        this.detectionPort = b.detectionPort;
        this.relayPort = b.relayPort;
        this.workerThreads = b.workerThreads;
        this.detectionConfigPath = b.detectionConfigPath;
    }

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .detectionPort(parseIntEnv("DETECTION_PORT", "8000"))
                    .relayPort(parseIntEnv("RELAY_PORT", "8080"))
                    .workerThreads(parseIntEnv("HTTP_WORKER_THREADS", "4"))
                    .detectionConfigPath(env("DETECTION_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public int getDetectionPort() {
        return detectionPort;
    }

    public int getRelayPort() {
        return relayPort;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public String getDetectionConfigPath() {
        return detectionConfigPath;
    }

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} checks that ports are in [0, 65535] (0 binds an
     * ephemeral port) and that at least one worker thread is configured.
     * </p>
     */
    public static class Builder {
        private int detectionPort = 8000;
        private int relayPort = 8080;
        private int workerThreads = 4;
        private String detectionConfigPath = "";

        public Builder detectionPort(int v) {
            this.detectionPort = v;
            return this;
        }

        public Builder relayPort(int v) {
            this.relayPort = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder detectionConfigPath(String v) {
            this.detectionConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            requirePort(detectionPort, "detectionPort");
            requirePort(relayPort, "relayPort");
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            if (detectionConfigPath == null) {
                detectionConfigPath = "";
            }
            return new ServiceConfig(this);
        }

        private static void requirePort(int port, String name) {
            if (port < 0 || port > 65_535) {
                throw new IllegalArgumentException(name + " must be in [0, 65535], got: " + port);
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "detectionPort=" + detectionPort +
                ", relayPort=" + relayPort +
                ", workerThreads=" + workerThreads +
                ", detectionConfigPath='" + detectionConfigPath + '\'' +
                '}';
    }
}
