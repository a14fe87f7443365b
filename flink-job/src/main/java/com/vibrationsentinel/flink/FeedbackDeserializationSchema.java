package com.vibrationsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vibrationsentinel.core.model.Feedback;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;

/**
 * Flink {@link DeserializationSchema} for operator confirmations.
 * <p>
 * A confirmation must name its asset, its own id and the result it refers
 * to; anything else is logged and dropped. A missing timestamp is filled
 * with the ingestion time.
 * </p>
 */
public class FeedbackDeserializationSchema implements DeserializationSchema<Feedback> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(FeedbackDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public Feedback deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        Feedback feedback;
        try {
            feedback = objectMapper().readValue(message, Feedback.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize feedback, skipping: {}", e.getMessage());
            return null;
        }
        if (isBlank(feedback.getAssetId()) || isBlank(feedback.getFeedbackId())
                || isBlank(feedback.getPredictedAlertId())) {
            LOG.warn("Dropping incomplete feedback: {}", feedback);
            return null;
        }
        if (feedback.getTimestamp() == null) {
            feedback.setTimestamp(Instant.now());
        }
        return feedback;
    }

    @Override
    public boolean isEndOfStream(Feedback nextElement) {
        return false;
    }

    @Override
    public TypeInformation<Feedback> getProducedType() {
        return TypeInformation.of(Feedback.class);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
