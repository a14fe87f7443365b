package com.vibrationsentinel.core.detection;

import com.vibrationsentinel.core.error.ComputationException;
import com.vibrationsentinel.core.model.FeatureSchema;

import java.util.Objects;
import java.util.Optional;

/**
 * Scores by reconstruction mean squared error, rescaled through a
 * {@link PercentileScaler} fit on healthy errors.
 *
 * @since 1.0.0
 */
public final class ReconstructionDetector implements AnomalyDetector {

    public static final String NAME = "reconstruction";

    private final FeatureLayout layout;
    private final ReconstructionModel model;
    private final PercentileScaler scaler;

    /**
     * Detector for a model trained on {@link FeatureSchema#DEFAULT}.
     */
    public ReconstructionDetector(ReconstructionModel model, PercentileScaler scaler) {
        this(FeatureLayout.of(FeatureSchema.DEFAULT), model, scaler);
    }

    /**
     * @throws IllegalArgumentException if the layout and the model input
     *                                  sizes differ
     */
    public ReconstructionDetector(FeatureLayout layout, ReconstructionModel model, PercentileScaler scaler) {
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.scaler = Objects.requireNonNull(scaler, "scaler must not be null");
        if (layout.size() != model.inputSize()) {
            throw new IllegalArgumentException("Autoencoder expects " + model.inputSize()
                    + " inputs but its layout names " + layout.size());
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Optional<FeatureLayout> inputLayout() {
        return Optional.of(layout);
    }

    @Override
    public double score(DetectorInput input) {
        double error = reconstructionError(layout.arrange(input.current()));
        if (!Double.isFinite(error)) {
            throw new ComputationException("Reconstruction error is not finite: " + error);
        }
        return scaler.scale(error);
    }

    /**
     * @return mean squared difference between {@code x} and its
     *         reconstruction
     */
    public double reconstructionError(double[] x) {
        double[] r = model.reconstruct(x);
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            double d = x[i] - r[i];
            sum += d * d;
        }
        return sum / x.length;
    }
}
