package com.vibrationsentinel.flink;

import com.vibrationsentinel.core.model.RawSample;

import java.io.Serializable;
import java.time.Instant;

/**
 * Wire form of one accelerometer reading on the samples topic.
 *
 * <pre>
 * {"assetId":"pump-7","timestamp":"2024-01-01T00:00:00.00005Z","amplitude":0.0132}
 * </pre>
 */
public class SampleRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private String assetId;
    private Instant timestamp;
    private double amplitude;

    /** No-arg constructor required by Jackson. */
    public SampleRecord() {
    }

    public SampleRecord(String assetId, Instant timestamp, double amplitude) {
        this.assetId = assetId;
        this.timestamp = timestamp;
        this.amplitude = amplitude;
    }

    /**
     * @return the reading without its routing key
     */
    public RawSample toRawSample() {
        return new RawSample(timestamp, amplitude);
    }

    public String getAssetId() {
        return assetId;
    }

    public void setAssetId(String assetId) {
        this.assetId = assetId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public double getAmplitude() {
        return amplitude;
    }

    public void setAmplitude(double amplitude) {
        this.amplitude = amplitude;
    }

    @Override
    public String toString() {
        return "SampleRecord{assetId='" + assetId + "', timestamp=" + timestamp + ", amplitude=" + amplitude + '}';
    }
}
