package com.vibrationsentinel.core.state;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Envelope for every persisted artifact: a schema version, a kind tag and
 * the kind-specific JSON payload.
 *
 * <p>
 * Mutable POJO with a no-arg constructor for Jackson.
 * </p>
 */
public class VersionedArtifact {

    private int schemaVersion;
    private String kind;
    private JsonNode payload;

    public VersionedArtifact() {
    }

    public VersionedArtifact(int schemaVersion, String kind, JsonNode payload) {
        this.schemaVersion = schemaVersion;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(int schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }

    @Override
    public String toString() {
        return "VersionedArtifact{kind='" + kind + "', schemaVersion=" + schemaVersion + '}';
    }
}
