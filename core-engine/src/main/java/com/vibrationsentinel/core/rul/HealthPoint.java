package com.vibrationsentinel.core.rul;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Health observation {@code 1 - composite} at one point in time.
 */
public final class HealthPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double health;

    @JsonCreator
    public HealthPoint(@JsonProperty("timestamp") Instant timestamp, @JsonProperty("health") double health) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.health = health;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getHealth() {
        return health;
    }

    @Override
    public String toString() {
        return "HealthPoint{" + timestamp + ", " + health + '}';
    }
}
