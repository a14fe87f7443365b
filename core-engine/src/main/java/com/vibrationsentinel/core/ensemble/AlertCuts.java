package com.vibrationsentinel.core.ensemble;

import java.io.Serializable;
import java.util.Objects;

/**
 * Pair of decision boundaries on the composite score.
 * {@code criticalCut > warningCut} always holds.
 */
public final class AlertCuts implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Cuts used until enough operator feedback exists. */
    public static final AlertCuts BOOTSTRAP = new AlertCuts(0.3, 0.7, false);

    private final double warningCut;
    private final double criticalCut;
    private final boolean adaptive;

    /**
     * @throws IllegalArgumentException unless
     *                                  {@code 0 <= warningCut < criticalCut <= 1}
     */
    public AlertCuts(double warningCut, double criticalCut, boolean adaptive) {
        if (!(warningCut >= 0.0 && criticalCut <= 1.0 && criticalCut > warningCut)) {
            throw new IllegalArgumentException("Cuts must satisfy 0 <= warning < critical <= 1, got warning="
                    + warningCut + ", critical=" + criticalCut);
        }
        this.warningCut = warningCut;
        this.criticalCut = criticalCut;
        this.adaptive = adaptive;
    }

    public double getWarningCut() {
        return warningCut;
    }

    public double getCriticalCut() {
        return criticalCut;
    }

    public boolean isAdaptive() {
        return adaptive;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AlertCuts that)) {
            return false;
        }
        return Double.compare(warningCut, that.warningCut) == 0
                && Double.compare(criticalCut, that.criticalCut) == 0
                && adaptive == that.adaptive;
    }

    @Override
    public int hashCode() {
        return Objects.hash(warningCut, criticalCut, adaptive);
    }

    @Override
    public String toString() {
        return "AlertCuts{warning=" + warningCut + ", critical=" + criticalCut
                + (adaptive ? ", adaptive" : ", bootstrap") + '}';
    }
}
