package com.vibrationsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into a
 * {@link SampleRecord}.
 * <p>
 * Malformed messages, and records without an asset id, a timestamp or a
 * finite amplitude, are logged and dropped (returns {@code null}) so that a
 * single bad record does not crash the entire pipeline.
 * </p>
 */
public class SampleDeserializationSchema implements DeserializationSchema<SampleRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SampleDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public SampleRecord deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        SampleRecord record;
        try {
            record = objectMapper().readValue(message, SampleRecord.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize sample, skipping: {}", e.getMessage());
            return null;
        }
        if (record.getAssetId() == null || record.getAssetId().isBlank() || record.getTimestamp() == null
                || !Double.isFinite(record.getAmplitude())) {
            LOG.warn("Dropping incomplete sample: {}", record);
            return null;
        }
        return record;
    }

    @Override
    public boolean isEndOfStream(SampleRecord nextElement) {
        return false;
    }

    @Override
    public TypeInformation<SampleRecord> getProducedType() {
        return TypeInformation.of(SampleRecord.class);
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
