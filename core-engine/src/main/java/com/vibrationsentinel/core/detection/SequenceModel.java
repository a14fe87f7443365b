package com.vibrationsentinel.core.detection;

/**
 * Model that maps a fixed-length sequence of feature vectors to an anomaly
 * probability.
 */
public interface SequenceModel {

    /**
     * @return number of timesteps the model consumes
     */
    int sequenceLength();

    /**
     * @param sequence {@code [sequenceLength][features]}, oldest first
     * @return probability in {@code [0, 1]}
     */
    double predict(double[][] sequence);
}
