package com.vibrationsentinel.core.support;

import com.vibrationsentinel.core.model.FeatureSchema;
import com.vibrationsentinel.core.model.FeatureVector;
import com.vibrationsentinel.core.model.Window;

import java.time.Instant;
import java.util.Arrays;
import java.util.Random;

/**
 * Synthetic signals and vectors for tests.
 */
public final class Signals {

    public static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private Signals() {
    }

    public static double[] sine(int n, double sampleRate, double frequency, double amplitude) {
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = amplitude * Math.sin(2.0 * Math.PI * frequency * i / sampleRate);
        }
        return x;
    }

    public static double[] noise(int n, double sigma, long seed) {
        Random random = new Random(seed);
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = sigma * random.nextGaussian();
        }
        return x;
    }

    public static Window window(double[] samples, double sampleRate) {
        return new Window(0, T0, samples.length / 2, sampleRate, samples);
    }

    /**
     * @return a vector over the default schema with every feature set to
     *         {@code value}
     */
    public static FeatureVector constantVector(double value, long sequence) {
        double[] v = new double[FeatureSchema.DEFAULT.size()];
        Arrays.fill(v, value);
        return new FeatureVector(FeatureSchema.DEFAULT, v, T0.plusSeconds(sequence), sequence);
    }

    /**
     * @return a vector over the default schema drawn from N(mean, 1)
     */
    public static FeatureVector gaussianVector(Random random, double mean, long sequence) {
        double[] v = new double[FeatureSchema.DEFAULT.size()];
        for (int i = 0; i < v.length; i++) {
            v[i] = mean + random.nextGaussian();
        }
        return new FeatureVector(FeatureSchema.DEFAULT, v, T0.plusSeconds(sequence), sequence);
    }
}
