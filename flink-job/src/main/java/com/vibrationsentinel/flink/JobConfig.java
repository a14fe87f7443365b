package com.vibrationsentinel.flink;

import java.io.Serializable;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration object for the Vibration Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults.
 * This makes the job fully configurable via Kubernetes Deployment env vars,
 * Docker {@code -e} flags, or a shell environment. Pipeline tuning (windows,
 * weights, thresholds) lives in {@code pipeline.yml}, located through
 * {@code PIPELINE_CONFIG_PATH}.
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
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String sampleTopic;
    private final String feedbackTopic;
    private final String resultTopic;
    private final String driftTopic;
    private final String rulTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final long maxOutOfOrdernessMs;

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------
    private final String pipelineConfigPath;
    private final String modelDir;
    private final int detectorThreads;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.sampleTopic = b.sampleTopic;
        this.feedbackTopic = b.feedbackTopic;
        this.resultTopic = b.resultTopic;
        this.driftTopic = b.driftTopic;
        this.rulTopic = b.rulTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.maxOutOfOrdernessMs = b.maxOutOfOrdernessMs;
        this.pipelineConfigPath = b.pipelineConfigPath;
        this.modelDir = b.modelDir;
        this.detectorThreads = b.detectorThreads;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .sampleTopic(env("KAFKA_SAMPLE_TOPIC", "vibration-samples"))
                    .feedbackTopic(env("KAFKA_FEEDBACK_TOPIC", "operator-feedback"))
                    .resultTopic(env("KAFKA_RESULT_TOPIC", "ensemble-results"))
                    .driftTopic(env("KAFKA_DRIFT_TOPIC", "drift-events"))
                    .rulTopic(env("KAFKA_RUL_TOPIC", "rul-estimates"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "vibration-sentinel"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .maxOutOfOrdernessMs(parseLongEnv("MAX_OUT_OF_ORDERNESS_MS", "1000"))
                    .pipelineConfigPath(env("PIPELINE_CONFIG_PATH", ""))
                    .modelDir(env("MODEL_DIR", "/opt/vibration-sentinel/models"))
                    .detectorThreads(parseIntEnv("DETECTOR_THREADS", "4"))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * @return new Properties instance configured for consumption
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    /**
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getSampleTopic() {
        return sampleTopic;
    }

    public String getFeedbackTopic() {
        return feedbackTopic;
    }

    public String getResultTopic() {
        return resultTopic;
    }

    public String getDriftTopic() {
        return driftTopic;
    }

    public String getRulTopic() {
        return rulTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public long getMaxOutOfOrdernessMs() {
        return maxOutOfOrdernessMs;
    }

    public String getPipelineConfigPath() {
        return pipelineConfigPath;
    }

    public String getModelDir() {
        return modelDir;
    }

    public int getDetectorThreads() {
        return detectorThreads;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, port in
     * [1, 65535], non-blank topic names and model directory).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String sampleTopic = "vibration-samples";
        private String feedbackTopic = "operator-feedback";
        private String resultTopic = "ensemble-results";
        private String driftTopic = "drift-events";
        private String rulTopic = "rul-estimates";
        private String kafkaGroupId = "vibration-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private long maxOutOfOrdernessMs = 1_000;
        private String pipelineConfigPath = "";
        private String modelDir = "/opt/vibration-sentinel/models";
        private int detectorThreads = 4;
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder sampleTopic(String v) {
            this.sampleTopic = v;
            return this;
        }

        public Builder feedbackTopic(String v) {
            this.feedbackTopic = v;
            return this;
        }

        public Builder resultTopic(String v) {
            this.resultTopic = v;
            return this;
        }

        public Builder driftTopic(String v) {
            this.driftTopic = v;
            return this;
        }

        public Builder rulTopic(String v) {
            this.rulTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder maxOutOfOrdernessMs(long v) {
            this.maxOutOfOrdernessMs = v;
            return this;
        }

        public Builder pipelineConfigPath(String v) {
            this.pipelineConfigPath = v;
            return this;
        }

        public Builder modelDir(String v) {
            this.modelDir = v;
            return this;
        }

        public Builder detectorThreads(int v) {
            this.detectorThreads = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(sampleTopic, "sampleTopic");
            requireNonBlank(feedbackTopic, "feedbackTopic");
            requireNonBlank(resultTopic, "resultTopic");
            requireNonBlank(driftTopic, "driftTopic");
            requireNonBlank(rulTopic, "rulTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(modelDir, "modelDir");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (maxOutOfOrdernessMs < 0) {
                throw new IllegalArgumentException(
                        "maxOutOfOrdernessMs must be >= 0, got: " + maxOutOfOrdernessMs);
            }
            if (detectorThreads < 1) {
                throw new IllegalArgumentException("detectorThreads must be >= 1, got: " + detectorThreads);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", sampleTopic='" + sampleTopic + '\'' +
                ", feedbackTopic='" + feedbackTopic + '\'' +
                ", resultTopic='" + resultTopic + '\'' +
                ", driftTopic='" + driftTopic + '\'' +
                ", rulTopic='" + rulTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", pipelineConfigPath='" + pipelineConfigPath + '\'' +
                ", modelDir='" + modelDir + '\'' +
                ", detectorThreads=" + detectorThreads +
                ", healthPort=" + healthPort +
                '}';
    }
}
