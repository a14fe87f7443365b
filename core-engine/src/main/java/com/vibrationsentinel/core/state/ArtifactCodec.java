package com.vibrationsentinel.core.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vibrationsentinel.core.error.StateCorruptionException;
import com.vibrationsentinel.core.error.VibrationSentinelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes persisted artifacts as {@link VersionedArtifact} JSON.
 *
 * <h3>Failure semantics</h3>
 * <ul>
 * <li>Malformed JSON, a wrong kind, an unsupported schema version, or a
 * payload whose invariants fail on construction all raise
 * {@link StateCorruptionException}.</li>
 * <li>I/O failures raise {@link IllegalStateException}.</li>
 * </ul>
 *
 * <p>
 * Instances are thread-safe; the underlying {@link ObjectMapper} is only
 * configured in the constructor.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArtifactCodec {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactCodec.class);

    /** Schema version written by this codec. */
    public static final int CURRENT_SCHEMA_VERSION = 1;

    private final ObjectMapper mapper;

    public ArtifactCodec() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * @param kind    artifact kind tag
     * @param payload object to persist
     * @return JSON text of the envelope
     */
    public String encode(String kind, Object payload) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        JsonNode tree = mapper.valueToTree(payload);
        try {
            return mapper.writeValueAsString(new VersionedArtifact(CURRENT_SCHEMA_VERSION, kind, tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize artifact of kind '" + kind + "'", e);
        }
    }

    /**
     * @param json         envelope JSON
     * @param expectedKind kind the caller expects
     * @param type         payload type
     * @return the decoded payload
     * @throws StateCorruptionException if the artifact cannot be trusted
     */
    public <T> T decode(String json, String expectedKind, Class<T> type) {
        Objects.requireNonNull(json, "json must not be null");
        VersionedArtifact artifact;
        try {
            artifact = mapper.readValue(json, VersionedArtifact.class);
        } catch (JsonProcessingException e) {
            throw new StateCorruptionException("Artifact is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (artifact.getKind() == null || !artifact.getKind().equals(expectedKind)) {
            throw new StateCorruptionException("Expected artifact kind '" + expectedKind
                    + "' but found '" + artifact.getKind() + "'");
        }
        if (artifact.getSchemaVersion() != CURRENT_SCHEMA_VERSION) {
            throw new StateCorruptionException("Unsupported schema version " + artifact.getSchemaVersion()
                    + " for kind '" + expectedKind + "' (supported: " + CURRENT_SCHEMA_VERSION + ")");
        }
        if (artifact.getPayload() == null || artifact.getPayload().isNull()) {
            throw new StateCorruptionException("Artifact of kind '" + expectedKind + "' has no payload");
        }
        try {
            return mapper.treeToValue(artifact.getPayload(), type);
        } catch (JsonProcessingException e) {
            if (e.getCause() instanceof VibrationSentinelException cause) {
                throw cause;
            }
            throw new StateCorruptionException("Invalid '" + expectedKind + "' payload: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new StateCorruptionException("Invalid '" + expectedKind + "' payload: " + e.getMessage(), e);
        }
    }

    public void write(Path path, String kind, Object payload) {
        Objects.requireNonNull(path, "path must not be null");
        String json = encode(kind, payload);
        try {
            Files.writeString(path, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write artifact: " + path, e);
        }
        LOG.debug("Wrote {} artifact to {}", kind, path);
    }

    public <T> T read(Path path, String expectedKind, Class<T> type) {
        Objects.requireNonNull(path, "path must not be null");
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read artifact: " + path, e);
        }
        return decode(json, expectedKind, type);
    }
}
