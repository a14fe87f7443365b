package com.vibrationsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SampleDeserializationSchema}.
 */
class SampleDeserializationSchemaTest {

    private final SampleDeserializationSchema schema = new SampleDeserializationSchema();

    @Test
    @DisplayName("Valid sample is parsed with an ISO-8601 timestamp")
    void validSample() throws IOException {
        SampleRecord record = schema.deserialize(json(
                "{\"assetId\":\"pump-7\",\"timestamp\":\"2024-01-01T00:00:00.00005Z\",\"amplitude\":0.0132}"));

        assertThat(record).isNotNull();
        assertThat(record.getAssetId()).isEqualTo("pump-7");
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00.00005Z"));
        assertThat(record.getAmplitude()).isEqualTo(0.0132);
        assertThat(record.toRawSample().getAmplitude()).isEqualTo(0.0132);
    }

    @Test
    @DisplayName("Unknown fields are ignored")
    void unknownFields() throws IOException {
        SampleRecord record = schema.deserialize(json(
                "{\"assetId\":\"fan-1\",\"timestamp\":\"2024-01-01T00:00:00Z\",\"amplitude\":1.5,\"axis\":\"x\"}"));

        assertThat(record).isNotNull();
        assertThat(record.getAssetId()).isEqualTo("fan-1");
    }

    @Test
    @DisplayName("Malformed JSON is dropped")
    void malformed() throws IOException {
        assertThat(schema.deserialize(json("{not json"))).isNull();
    }

    @Test
    @DisplayName("Records missing an asset id or timestamp are dropped")
    void incomplete() throws IOException {
        assertThat(schema.deserialize(json("{\"timestamp\":\"2024-01-01T00:00:00Z\",\"amplitude\":1.0}"))).isNull();
        assertThat(schema.deserialize(json("{\"assetId\":\" \",\"timestamp\":\"2024-01-01T00:00:00Z\"}"))).isNull();
        assertThat(schema.deserialize(json("{\"assetId\":\"pump-7\",\"amplitude\":1.0}"))).isNull();
    }

    @Test
    @DisplayName("Empty and null payloads are dropped")
    void empty() throws IOException {
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static byte[] json(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
