package com.vibrationsentinel.core.model;

/**
 * Severity assigned to a composite anomaly score.
 */
public enum AlertLevel {
    NORMAL,
    WARNING,
    CRITICAL;

    /**
     * Classify a composite score against a pair of cuts.
     *
     * @param composite   composite score in [0,1]
     * @param warningCut  lower bound of WARNING
     * @param criticalCut lower bound of CRITICAL; must exceed
     *                    {@code warningCut}
     * @return the alert level
     */
    public static AlertLevel classify(double composite, double warningCut, double criticalCut) {
        if (composite >= criticalCut) {
            return CRITICAL;
        }
        if (composite >= warningCut) {
            return WARNING;
        }
        return NORMAL;
    }
}
