package com.vibrationsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    // ---------------------------------------------------------------
    // Defaults
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Builder defaults describe a local single-slot deployment")
    void defaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getSampleTopic()).isEqualTo("vibration-samples");
        assertThat(config.getFeedbackTopic()).isEqualTo("operator-feedback");
        assertThat(config.getResultTopic()).isEqualTo("ensemble-results");
        assertThat(config.getDriftTopic()).isEqualTo("drift-events");
        assertThat(config.getRulTopic()).isEqualTo("rul-estimates");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getMaxOutOfOrdernessMs()).isEqualTo(1_000);
        assertThat(config.getDetectorThreads()).isEqualTo(4);
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Kafka properties carry the bootstrap servers and group id")
    void kafkaProperties() {
        JobConfig config = new JobConfig.Builder()
                .kafkaBootstrapServers("broker:29092")
                .kafkaGroupId("plant-3")
                .build();

        Properties consumer = config.kafkaConsumerProperties();
        assertThat(consumer.getProperty("bootstrap.servers")).isEqualTo("broker:29092");
        assertThat(consumer.getProperty("group.id")).isEqualTo("plant-3");

        Properties producer = config.kafkaProducerProperties();
        assertThat(producer.getProperty("bootstrap.servers")).isEqualTo("broker:29092");
        assertThat(producer.getProperty("group.id")).isNull();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Blank topic names are rejected")
    void blankTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder().driftTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("driftTopic");
    }

    @Test
    @DisplayName("Out-of-range numeric settings are rejected")
    void numericRanges() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().detectorThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("detectorThreads");
        assertThatThrownBy(() -> new JobConfig.Builder().maxOutOfOrdernessMs(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxOutOfOrdernessMs");
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }

    @Test
    @DisplayName("A model directory is required")
    void modelDirRequired() {
        assertThatThrownBy(() -> new JobConfig.Builder().modelDir("").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("modelDir");
    }
}
