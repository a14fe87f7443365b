package com.vibrationsentinel.core.rul;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded, time-ordered buffer of {@link HealthPoint}s for one asset.
 * Not thread-safe; owned by a single pipeline.
 */
public final class HealthHistory implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int capacity;
    private final ArrayDeque<HealthPoint> points = new ArrayDeque<>();

    public HealthHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    public void add(HealthPoint point) {
        points.addLast(point);
        while (points.size() > capacity) {
            points.pollFirst();
        }
    }

    public int size() {
        return points.size();
    }

    public List<HealthPoint> snapshot() {
        return new ArrayList<>(points);
    }
}
