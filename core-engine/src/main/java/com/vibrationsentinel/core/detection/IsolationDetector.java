package com.vibrationsentinel.core.detection;

import com.vibrationsentinel.core.model.FeatureSchema;

import java.util.Objects;
import java.util.Optional;

/**
 * Scores with an isolation forest: points isolated by short paths score
 * high. The raw isolation score is rescaled through a
 * {@link PercentileScaler} fit on healthy data.
 *
 * @since 1.0.0
 */
public final class IsolationDetector implements AnomalyDetector {

    public static final String NAME = "isolation";

    private final FeatureLayout layout;
    private final IsolationForestModel forest;
    private final PercentileScaler scaler;

    /**
     * Detector for a forest grown on {@link FeatureSchema#DEFAULT}.
     */
    public IsolationDetector(IsolationForestModel forest, PercentileScaler scaler) {
        this(FeatureLayout.of(FeatureSchema.DEFAULT), forest, scaler);
    }

    /**
     * @throws IllegalArgumentException if a tree splits on a feature the
     *                                  layout does not name
     */
    public IsolationDetector(FeatureLayout layout, IsolationForestModel forest, PercentileScaler scaler) {
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        this.forest = Objects.requireNonNull(forest, "forest must not be null");
        this.scaler = Objects.requireNonNull(scaler, "scaler must not be null");
        if (forest.maxFeatureIndex() >= layout.size()) {
            throw new IllegalArgumentException("Forest splits on feature " + forest.maxFeatureIndex()
                    + " but its layout names " + layout.size());
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
        return scaler.scale(forest.anomalyScore(layout.arrange(input.current())));
    }
}
