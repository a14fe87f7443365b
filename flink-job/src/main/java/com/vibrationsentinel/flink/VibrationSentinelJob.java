package com.vibrationsentinel.flink;

import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.config.PipelineConfigLoader;
import com.vibrationsentinel.core.ensemble.EnsembleScorer;
import com.vibrationsentinel.core.model.DriftEvent;
import com.vibrationsentinel.core.model.EnsembleResult;
import com.vibrationsentinel.core.model.Feedback;
import com.vibrationsentinel.core.model.RulEstimate;
import com.vibrationsentinel.core.pipeline.PipelineComponents;
import com.vibrationsentinel.core.registry.FileModelRegistry;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Main entry point for the Vibration Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (samples topic)  → SampleRecord ─┐
 *                                          ├→ key by assetId → AssetPipelineFunction
 *   Kafka (feedback topic) → Feedback ─────┘
 *       → EnsembleResult → Kafka (results topic)
 *       → DriftEvent     → Kafka (drift topic)
 *       → RulEstimate    → Kafka (RUL topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job wiring is resolved from environment variables via {@link JobConfig};
 * pipeline tuning comes from {@code pipeline.yml} via
 * {@link PipelineConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps the per-asset window buffers, feature
 * history and adaptive cuts consistent with the consumed offsets.
 * </p>
 *
 * @since 1.0.0
 */
public final class VibrationSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(VibrationSentinelJob.class);

        private VibrationSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Vibration Sentinel with config: {}", config);

                PipelineConfig pipelineConfig = loadPipelineConfig(config);
                LOG.info("Pipeline configuration: {}", pipelineConfig);

                // 2. Load the published models so readiness reflects them
                ExecutorService startupExecutor = EnsembleScorer.newDetectorExecutor(1);
                PipelineComponents startup = PipelineComponents.create(pipelineConfig,
                                new FileModelRegistry(Paths.get(config.getModelDir())), startupExecutor);
                LOG.info("Ensemble at startup: {}", startup.getScorer().health());

                // 3. Start health server (liveness and readiness) with shutdown hook
                HealthServer healthServer = new HealthServer(startup.getScorer());
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        healthServer.stop();
                        startupExecutor.shutdownNow();
                }, "health-shutdown"));

                // 4. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 5. Build pipeline
                buildPipeline(env, config, pipelineConfig);

                // 6. Execute
                env.execute("Vibration Sentinel - Predictive Maintenance");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the Kafka → Flink → Kafka topology.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        PipelineConfig pipelineConfig) {
                KafkaSource<SampleRecord> sampleSource = KafkaSource.<SampleRecord>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getSampleTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setProperties(config.kafkaConsumerProperties())
                                .setValueOnlyDeserializer(new SampleDeserializationSchema())
                                .build();

                KafkaSource<Feedback> feedbackSource = KafkaSource.<Feedback>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getFeedbackTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setProperties(config.kafkaConsumerProperties())
                                .setValueOnlyDeserializer(new FeedbackDeserializationSchema())
                                .build();

                DataStream<SampleRecord> samples = env.fromSource(
                                sampleSource,
                                WatermarkStrategy.<SampleRecord>forBoundedOutOfOrderness(
                                                Duration.ofMillis(config.getMaxOutOfOrdernessMs()))
                                                .withTimestampAssigner((r, ts) -> r.getTimestamp().toEpochMilli())
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-samples-source")
                                .filter(Objects::nonNull) // drop deserialization failures
                                .name("valid-samples");

                DataStream<Feedback> feedback = env.fromSource(
                                feedbackSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-feedback-source")
                                .filter(Objects::nonNull)
                                .name("valid-feedback");

                SingleOutputStreamOperator<EnsembleResult> results = samples
                                .keyBy(SampleRecord::getAssetId)
                                .connect(feedback.keyBy(Feedback::getAssetId))
                                .process(new AssetPipelineFunction(pipelineConfig, config.getModelDir(),
                                                config.getDetectorThreads()))
                                .name("asset-pipeline");

                results.sinkTo(sink(config, config.getResultTopic(), new JsonSerializationSchema<EnsembleResult>()))
                                .name("kafka-results-sink");

                DataStream<DriftEvent> driftEvents = results.getSideOutput(AssetPipelineFunction.DRIFT_EVENTS);
                driftEvents.sinkTo(sink(config, config.getDriftTopic(), new JsonSerializationSchema<DriftEvent>()))
                                .name("kafka-drift-sink");

                DataStream<RulEstimate> rulEstimates = results.getSideOutput(AssetPipelineFunction.RUL_ESTIMATES);
                rulEstimates.sinkTo(sink(config, config.getRulTopic(), new JsonSerializationSchema<RulEstimate>()))
                                .name("kafka-rul-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static <T> KafkaSink<T> sink(JobConfig config, String topic, JsonSerializationSchema<T> schema) {
                return KafkaSink.<T>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<T>builder()
                                                                .setTopic(topic)
                                                                .setValueSerializationSchema(schema)
                                                                .build())
                                .build();
        }

        static PipelineConfig loadPipelineConfig(JobConfig config) {
                String path = config.getPipelineConfigPath();
                if (path != null && !path.isBlank()) {
                        return PipelineConfigLoader.fromFile(path);
                }
                return PipelineConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // Retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
