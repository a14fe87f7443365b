package com.vibrationsentinel.core.error;

/**
 * A feature of a single window is not finite. Aborts that window only.
 */
public class FeatureComputationException extends ComputationException {

    private static final long serialVersionUID = 1L;

    private final String featureName;

    public FeatureComputationException(String featureName, double value) {
        super("Feature '" + featureName + "' is not finite: " + value);
        this.featureName = featureName;
    }

    public String getFeatureName() {
        return featureName;
    }
}
