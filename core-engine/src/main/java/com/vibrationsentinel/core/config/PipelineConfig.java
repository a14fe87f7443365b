package com.vibrationsentinel.core.config;

import com.vibrationsentinel.core.ensemble.FallbackPolicy;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Top-level POJO for the pipeline YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * windowing:
 *   windowSize: 1024
 *   hopSize: 512
 *   sampleRate: 20000.0
 * features:
 *   crestFactorCeiling: 100.0
 *   bandEdgesHz: [0.0, 1000.0, 2000.0, 5000.0, 10000.0]
 * detectors:
 *   sequenceLength: 100
 * ensemble:
 *   weights: {reconstruction: 0.4, isolation: 0.3, temporal: 0.3}
 *   detectorTimeoutMs: 250
 *   detectorFallback: SKIP
 *   unavailableFallback: SKIP
 * threshold:
 *   bootstrapWarningCut: 0.3
 *   bootstrapCriticalCut: 0.7
 *   gridSteps: 50
 *   targetFalsePositiveRate: 0.05
 *   criticalFalsePositiveRate: 0.01
 *   minFeedback: 20
 *   feedbackWindowDays: 7
 * drift:
 *   checkInterval: 100
 *   threshold: 0.2
 *   consecutiveChecks: 2
 *   timeoutMs: 500
 * rul:
 *   minPoints: 10
 *   maxHistory: 1000
 *   failureThreshold: 0.2
 *   trendModel: LINEAR
 *   confidenceZ: 1.96
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private Windowing windowing = new Windowing();
    private Features features = new Features();
    private Detectors detectors = new Detectors();
    private Ensemble ensemble = new Ensemble();
    private Threshold threshold = new Threshold();
    private Drift drift = new Drift();
    private Rul rul = new Rul();

    /**
     * Validate every section, collecting all errors.
     *
     * @throws IllegalStateException if any value is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        windowing.validate(errors);
        features.validate(errors);
        detectors.validate(errors);
        ensemble.validate(errors);
        threshold.validate(errors);
        drift.validate(errors);
        rul.validate(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public Windowing getWindowing() {
        return windowing;
    }

    public void setWindowing(Windowing windowing) {
        this.windowing = windowing != null ? windowing : new Windowing();
    }

    public Features getFeatures() {
        return features;
    }

    public void setFeatures(Features features) {
        this.features = features != null ? features : new Features();
    }

    public Detectors getDetectors() {
        return detectors;
    }

    public void setDetectors(Detectors detectors) {
        this.detectors = detectors != null ? detectors : new Detectors();
    }

    public Ensemble getEnsemble() {
        return ensemble;
    }

    public void setEnsemble(Ensemble ensemble) {
        this.ensemble = ensemble != null ? ensemble : new Ensemble();
    }

    public Threshold getThreshold() {
        return threshold;
    }

    public void setThreshold(Threshold threshold) {
        this.threshold = threshold != null ? threshold : new Threshold();
    }

    public Drift getDrift() {
        return drift;
    }

    public void setDrift(Drift drift) {
        this.drift = drift != null ? drift : new Drift();
    }

    public Rul getRul() {
        return rul;
    }

    public void setRul(Rul rul) {
        this.rul = rul != null ? rul : new Rul();
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "windowing=" + windowing.windowSize + '/' + windowing.hopSize +
                ", weights=" + ensemble.weights +
                ", cuts=" + threshold.bootstrapWarningCut + '/' + threshold.bootstrapCriticalCut +
                ", drift=" + drift.threshold +
                ", rul=" + rul.trendModel +
                '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** Window slicing. */
    public static class Windowing implements Serializable {
        private static final long serialVersionUID = 1L;

        private int windowSize = 1024;
        private int hopSize = 512;
        private double sampleRate = 20_000.0;

        void validate(List<String> errors) {
            if (windowSize < 8) {
                errors.add("windowing.windowSize must be >= 8, got: " + windowSize);
            }
            if (hopSize < 1 || hopSize > windowSize) {
                errors.add("windowing.hopSize must be in [1, windowSize], got: " + hopSize);
            }
            if (!(sampleRate > 0)) {
                errors.add("windowing.sampleRate must be > 0, got: " + sampleRate);
            }
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public int getHopSize() {
            return hopSize;
        }

        public void setHopSize(int hopSize) {
            this.hopSize = hopSize;
        }

        public double getSampleRate() {
            return sampleRate;
        }

        public void setSampleRate(double sampleRate) {
            this.sampleRate = sampleRate;
        }
    }

    /** Feature extraction. */
    public static class Features implements Serializable {
        private static final long serialVersionUID = 1L;

        private double crestFactorCeiling = 100.0;
        private List<Number> bandEdgesHz = new ArrayList<>(List.<Number>of(0.0, 1_000.0, 2_000.0, 5_000.0, 10_000.0));

        void validate(List<String> errors) {
            if (!(crestFactorCeiling > 0)) {
                errors.add("features.crestFactorCeiling must be > 0, got: " + crestFactorCeiling);
            }
            if (bandEdgesHz == null || bandEdgesHz.size() != 5) {
                errors.add("features.bandEdgesHz must list exactly 5 edges (4 bands)");
                return;
            }
            double[] edges = bandEdges();
            for (int i = 1; i < edges.length; i++) {
                if (!(edges[i] > edges[i - 1])) {
                    errors.add("features.bandEdgesHz must be strictly increasing: " + bandEdgesHz);
                    return;
                }
            }
        }

        /**
         * @return band edges as a primitive array
         */
        public double[] bandEdges() {
            double[] edges = new double[bandEdgesHz.size()];
            for (int i = 0; i < edges.length; i++) {
                edges[i] = bandEdgesHz.get(i).doubleValue();
            }
            return edges;
        }

        public double getCrestFactorCeiling() {
            return crestFactorCeiling;
        }

        public void setCrestFactorCeiling(double crestFactorCeiling) {
            this.crestFactorCeiling = crestFactorCeiling;
        }

        public List<Number> getBandEdgesHz() {
            return Collections.unmodifiableList(bandEdgesHz);
        }

        public void setBandEdgesHz(List<Number> bandEdgesHz) {
            this.bandEdgesHz = bandEdgesHz != null ? new ArrayList<>(bandEdgesHz) : null;
        }
    }

    /** Detector adapters. */
    public static class Detectors implements Serializable {
        private static final long serialVersionUID = 1L;

        private int sequenceLength = 100;

        void validate(List<String> errors) {
            if (sequenceLength < 1) {
                errors.add("detectors.sequenceLength must be >= 1, got: " + sequenceLength);
            }
        }

        public int getSequenceLength() {
            return sequenceLength;
        }

        public void setSequenceLength(int sequenceLength) {
            this.sequenceLength = sequenceLength;
        }
    }

    /** Ensemble combination and per-detector timeouts. */
    public static class Ensemble implements Serializable {
        private static final long serialVersionUID = 1L;

        private Map<String, Number> weights = defaultWeights();
        private long detectorTimeoutMs = 250;
        private FallbackPolicy detectorFallback = FallbackPolicy.SKIP;
        private FallbackPolicy unavailableFallback = FallbackPolicy.SKIP;

        private static Map<String, Number> defaultWeights() {
            Map<String, Number> w = new LinkedHashMap<>();
            w.put("reconstruction", 0.4);
            w.put("isolation", 0.3);
            w.put("temporal", 0.3);
            return w;
        }

        void validate(List<String> errors) {
            if (weights == null || weights.isEmpty()) {
                errors.add("ensemble.weights must not be empty");
            } else {
                double sum = 0.0;
                for (Map.Entry<String, Number> e : weights.entrySet()) {
                    double w = e.getValue() == null ? Double.NaN : e.getValue().doubleValue();
                    if (!Double.isFinite(w) || w < 0) {
                        errors.add("ensemble.weights['" + e.getKey() + "'] must be finite and >= 0");
                    } else {
                        sum += w;
                    }
                }
                if (!(sum > 0)) {
                    errors.add("ensemble.weights must not all be zero");
                }
            }
            if (detectorTimeoutMs < 1) {
                errors.add("ensemble.detectorTimeoutMs must be >= 1, got: " + detectorTimeoutMs);
            }
            if (detectorFallback == null || unavailableFallback == null) {
                errors.add("ensemble fallback policies must not be null");
            }
        }

        /**
         * @return weights converted to {@code double}, in declaration order
         */
        public Map<String, Double> weightMap() {
            Map<String, Double> w = new LinkedHashMap<>();
            weights.forEach((k, v) -> w.put(k, v.doubleValue()));
            return w;
        }

        public Map<String, Number> getWeights() {
            return Collections.unmodifiableMap(weights);
        }

        public void setWeights(Map<String, Number> weights) {
            this.weights = weights != null ? new LinkedHashMap<>(weights) : null;
        }

        public long getDetectorTimeoutMs() {
            return detectorTimeoutMs;
        }

        public void setDetectorTimeoutMs(long detectorTimeoutMs) {
            this.detectorTimeoutMs = detectorTimeoutMs;
        }

        public FallbackPolicy getDetectorFallback() {
            return detectorFallback;
        }

        public void setDetectorFallback(FallbackPolicy detectorFallback) {
            this.detectorFallback = detectorFallback;
        }

        public FallbackPolicy getUnavailableFallback() {
            return unavailableFallback;
        }

        public void setUnavailableFallback(FallbackPolicy unavailableFallback) {
            this.unavailableFallback = unavailableFallback;
        }
    }

    /** Adaptive alert cuts. */
    public static class Threshold implements Serializable {
        private static final long serialVersionUID = 1L;

        private double bootstrapWarningCut = 0.3;
        private double bootstrapCriticalCut = 0.7;
        private int gridSteps = 50;
        private double targetFalsePositiveRate = 0.05;
        private double criticalFalsePositiveRate = 0.01;
        private int minFeedback = 20;
        private int feedbackWindowDays = 7;
        private int maxTrackedPredictions = 10_000;

        void validate(List<String> errors) {
            if (!(bootstrapWarningCut > 0 && bootstrapCriticalCut < 1
                    && bootstrapCriticalCut > bootstrapWarningCut)) {
                errors.add("threshold bootstrap cuts must satisfy 0 < warning < critical < 1, got: "
                        + bootstrapWarningCut + '/' + bootstrapCriticalCut);
            }
            if (gridSteps < 2) {
                errors.add("threshold.gridSteps must be >= 2, got: " + gridSteps);
            }
            if (!(targetFalsePositiveRate >= 0 && targetFalsePositiveRate <= 1)) {
                errors.add("threshold.targetFalsePositiveRate must be in [0,1]");
            }
            if (!(criticalFalsePositiveRate >= 0 && criticalFalsePositiveRate <= 1)) {
                errors.add("threshold.criticalFalsePositiveRate must be in [0,1]");
            }
            if (minFeedback < 2) {
                errors.add("threshold.minFeedback must be >= 2, got: " + minFeedback);
            }
            if (feedbackWindowDays < 1) {
                errors.add("threshold.feedbackWindowDays must be >= 1, got: " + feedbackWindowDays);
            }
            if (maxTrackedPredictions < 1) {
                errors.add("threshold.maxTrackedPredictions must be >= 1, got: " + maxTrackedPredictions);
            }
        }

        public double getBootstrapWarningCut() {
            return bootstrapWarningCut;
        }

        public void setBootstrapWarningCut(double bootstrapWarningCut) {
            this.bootstrapWarningCut = bootstrapWarningCut;
        }

        public double getBootstrapCriticalCut() {
            return bootstrapCriticalCut;
        }

        public void setBootstrapCriticalCut(double bootstrapCriticalCut) {
            this.bootstrapCriticalCut = bootstrapCriticalCut;
        }

        public int getGridSteps() {
            return gridSteps;
        }

        public void setGridSteps(int gridSteps) {
            this.gridSteps = gridSteps;
        }

        public double getTargetFalsePositiveRate() {
            return targetFalsePositiveRate;
        }

        public void setTargetFalsePositiveRate(double targetFalsePositiveRate) {
            this.targetFalsePositiveRate = targetFalsePositiveRate;
        }

        public double getCriticalFalsePositiveRate() {
            return criticalFalsePositiveRate;
        }

        public void setCriticalFalsePositiveRate(double criticalFalsePositiveRate) {
            this.criticalFalsePositiveRate = criticalFalsePositiveRate;
        }

        public int getMinFeedback() {
            return minFeedback;
        }

        public void setMinFeedback(int minFeedback) {
            this.minFeedback = minFeedback;
        }

        public int getFeedbackWindowDays() {
            return feedbackWindowDays;
        }

        public void setFeedbackWindowDays(int feedbackWindowDays) {
            this.feedbackWindowDays = feedbackWindowDays;
        }

        public int getMaxTrackedPredictions() {
            return maxTrackedPredictions;
        }

        public void setMaxTrackedPredictions(int maxTrackedPredictions) {
            this.maxTrackedPredictions = maxTrackedPredictions;
        }
    }

    /** Drift monitoring. */
    public static class Drift implements Serializable {
        private static final long serialVersionUID = 1L;

        private int checkInterval = 100;
        private double threshold = 0.2;
        private int consecutiveChecks = 2;
        private long timeoutMs = 500;
        private FallbackPolicy fallback = FallbackPolicy.SKIP;

        void validate(List<String> errors) {
            if (checkInterval < 1) {
                errors.add("drift.checkInterval must be >= 1, got: " + checkInterval);
            }
            if (!(threshold > 0)) {
                errors.add("drift.threshold must be > 0, got: " + threshold);
            }
            if (consecutiveChecks < 1) {
                errors.add("drift.consecutiveChecks must be >= 1, got: " + consecutiveChecks);
            }
            if (timeoutMs < 1) {
                errors.add("drift.timeoutMs must be >= 1, got: " + timeoutMs);
            }
            if (fallback == null) {
                errors.add("drift.fallback must not be null");
            }
        }

        public int getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(int checkInterval) {
            this.checkInterval = checkInterval;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getConsecutiveChecks() {
            return consecutiveChecks;
        }

        public void setConsecutiveChecks(int consecutiveChecks) {
            this.consecutiveChecks = consecutiveChecks;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public FallbackPolicy getFallback() {
            return fallback;
        }

        public void setFallback(FallbackPolicy fallback) {
            this.fallback = fallback;
        }
    }

    /** Remaining-useful-life projection. */
    public static class Rul implements Serializable {
        private static final long serialVersionUID = 1L;

        private int minPoints = 10;
        private int maxHistory = 1_000;
        private double failureThreshold = 0.2;
        private String trendModel = "LINEAR";
        private double confidenceZ = 1.96;

        void validate(List<String> errors) {
            if (minPoints < 3) {
                errors.add("rul.minPoints must be >= 3, got: " + minPoints);
            }
            if (maxHistory < minPoints) {
                errors.add("rul.maxHistory must be >= rul.minPoints, got: " + maxHistory);
            }
            if (!(failureThreshold > 0 && failureThreshold < 1)) {
                errors.add("rul.failureThreshold must be in (0,1), got: " + failureThreshold);
            }
            if (!"LINEAR".equals(trendModel) && !"EXPONENTIAL".equals(trendModel)) {
                errors.add("rul.trendModel must be LINEAR or EXPONENTIAL, got: " + trendModel);
            }
            if (!(confidenceZ > 0)) {
                errors.add("rul.confidenceZ must be > 0, got: " + confidenceZ);
            }
        }

        public int getMinPoints() {
            return minPoints;
        }

        public void setMinPoints(int minPoints) {
            this.minPoints = minPoints;
        }

        public int getMaxHistory() {
            return maxHistory;
        }

        public void setMaxHistory(int maxHistory) {
            this.maxHistory = maxHistory;
        }

        public double getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(double failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public String getTrendModel() {
            return trendModel;
        }

        public void setTrendModel(String trendModel) {
            this.trendModel = trendModel != null ? trendModel.toUpperCase(Locale.ROOT) : null;
        }

        public double getConfidenceZ() {
            return confidenceZ;
        }

        public void setConfidenceZ(double confidenceZ) {
            this.confidenceZ = confidenceZ;
        }
    }
}
