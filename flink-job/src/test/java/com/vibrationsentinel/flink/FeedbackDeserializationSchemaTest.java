package com.vibrationsentinel.flink;

import com.vibrationsentinel.core.model.Feedback;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FeedbackDeserializationSchema}.
 */
class FeedbackDeserializationSchemaTest {

    private final FeedbackDeserializationSchema schema = new FeedbackDeserializationSchema();

    @Test
    @DisplayName("Complete confirmation is parsed as-is")
    void complete() throws IOException {
        Feedback feedback = schema.deserialize(json("{\"feedbackId\":\"fb-1\",\"assetId\":\"pump-7\","
                + "\"predictedAlertId\":\"r-42\",\"confirmedAnomaly\":true,"
                + "\"timestamp\":\"2024-03-01T12:00:00Z\"}"));

        assertThat(feedback).isNotNull();
        assertThat(feedback.getFeedbackId()).isEqualTo("fb-1");
        assertThat(feedback.getPredictedAlertId()).isEqualTo("r-42");
        assertThat(feedback.isConfirmedAnomaly()).isTrue();
        assertThat(feedback.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Test
    @DisplayName("Missing timestamp is filled with the ingestion time")
    void missingTimestamp() throws IOException {
        Instant before = Instant.now();
        Feedback feedback = schema.deserialize(json("{\"feedbackId\":\"fb-2\",\"assetId\":\"pump-7\","
                + "\"predictedAlertId\":\"r-43\",\"confirmedAnomaly\":false}"));

        assertThat(feedback).isNotNull();
        assertThat(feedback.getTimestamp()).isAfterOrEqualTo(before);
    }

    @Test
    @DisplayName("Confirmations without ids are dropped")
    void missingIds() throws IOException {
        assertThat(schema.deserialize(json(
                "{\"assetId\":\"pump-7\",\"predictedAlertId\":\"r-1\",\"confirmedAnomaly\":true}"))).isNull();
        assertThat(schema.deserialize(json(
                "{\"feedbackId\":\"fb-3\",\"assetId\":\"pump-7\",\"confirmedAnomaly\":true}"))).isNull();
        assertThat(schema.deserialize(json(
                "{\"feedbackId\":\"fb-3\",\"predictedAlertId\":\"r-1\",\"confirmedAnomaly\":true}"))).isNull();
    }

    @Test
    @DisplayName("Malformed JSON is dropped")
    void malformed() throws IOException {
        assertThat(schema.deserialize(json("[1,2,3"))).isNull();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static byte[] json(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
