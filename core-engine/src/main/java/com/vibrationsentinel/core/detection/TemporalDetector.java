package com.vibrationsentinel.core.detection;

import com.vibrationsentinel.core.error.ComputationException;
import com.vibrationsentinel.core.error.InsufficientHistoryException;
import com.vibrationsentinel.core.model.FeatureSchema;
import com.vibrationsentinel.core.model.FeatureVector;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores the trajectory of the last {@code K} normalized vectors with a
 * {@link SequenceModel}. The model output is already a probability, so no
 * rescaling is applied.
 *
 * @since 1.0.0
 */
public final class TemporalDetector implements AnomalyDetector {

    public static final String NAME = "temporal";

    private final FeatureLayout layout;
    private final SequenceModel model;

    /**
     * Detector for a model trained on {@link FeatureSchema#DEFAULT}.
     */
    public TemporalDetector(SequenceModel model) {
        this(FeatureLayout.of(FeatureSchema.DEFAULT), model);
    }

    public TemporalDetector(FeatureLayout layout, SequenceModel model) {
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
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

    public int requiredHistory() {
        return model.sequenceLength();
    }

    /**
     * @throws InsufficientHistoryException if fewer than
     *                                      {@link #requiredHistory()} vectors
     *                                      are buffered
     */
    @Override
    public double score(DetectorInput input) {
        int k = model.sequenceLength();
        if (input.history().size() < k) {
            throw new InsufficientHistoryException(input.history().size(), k);
        }
        List<FeatureVector> window = input.lastN(k);
        double[][] sequence = new double[k][];
        for (int t = 0; t < k; t++) {
            sequence[t] = layout.arrange(window.get(t));
        }
        double p = model.predict(sequence);
        if (!Double.isFinite(p)) {
            throw new ComputationException("Sequence model output is not finite: " + p);
        }
        return Math.max(0.0, Math.min(1.0, p));
    }
}
