package com.vibrationsentinel.core.calibration;

import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.ensemble.AlertCuts;
import com.vibrationsentinel.core.model.EnsembleResult;
import com.vibrationsentinel.core.model.Feedback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-asset alert cuts recalibrated from operator feedback.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 * <li>Starts from the bootstrap cuts.</li>
 * <li>Every emitted result is remembered through
 * {@link #recordPrediction(EnsembleResult)} so later feedback can be
 * joined to its composite score.</li>
 * <li>Once {@code minFeedback} labeled pairs inside the rolling window exist,
 * including at least one confirmed anomaly and one confirmed normal, each
 * new confirmation runs a grid search for the (warning, critical) pair that
 * maximizes {@code recall(warning) + recall(critical)} while keeping the
 * false-positive rate at each cut under its target. Ties go to the higher
 * cuts.</li>
 * <li>If no pair is feasible the previous cuts stay in force.</li>
 * </ol>
 *
 * <p>
 * All entry points are {@code synchronized}: one writer per asset, and
 * readers always see a consistent pair of cuts.
 * </p>
 *
 * @since 1.0.0
 */
public final class AdaptiveThreshold {

    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveThreshold.class);

    private static final double TIE_EPSILON = 1e-12;

    private final String assetId;
    private final PipelineConfig.Threshold config;
    private final Clock clock;
    private final Duration window;
    private final ThresholdState state;

    /**
     * @param state previously persisted state, or {@code null} to start from
     *              the bootstrap cuts
     * @throws com.vibrationsentinel.core.error.StateCorruptionException if
     *         {@code state} fails its invariants
     */
    public AdaptiveThreshold(String assetId, PipelineConfig.Threshold config, ThresholdState state, Clock clock) {
        this.assetId = Objects.requireNonNull(assetId, "assetId must not be null");
        this.config = Objects.requireNonNull(config, "Threshold config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.window = Duration.ofDays(config.getFeedbackWindowDays());
        if (state == null) {
            this.state = new ThresholdState(config.getBootstrapWarningCut(), config.getBootstrapCriticalCut());
        } else {
            state.checkInvariants();
            this.state = state.copy();
        }
    }

    public String getAssetId() {
        return assetId;
    }

    /**
     * @return the cuts to classify the next result against
     */
    public synchronized AlertCuts currentCuts() {
        return new AlertCuts(state.getWarningCut(), state.getCriticalCut(), state.isAdaptive());
    }

    /**
     * @return a deep copy of the current state, safe to persist
     */
    public synchronized ThresholdState snapshot() {
        return state.copy();
    }

    /**
     * Remember an emitted result so feedback quoting its id can be joined.
     */
    public synchronized void recordPrediction(EnsembleResult result) {
        Objects.requireNonNull(result, "result must not be null");
        Map<String, ThresholdState.TrackedPrediction> predictions = state.getPredictions();
        predictions.put(result.getResultId(),
                new ThresholdState.TrackedPrediction(result.getCompositeScore(), result.getTimestamp()));
        Iterator<String> eldest = predictions.keySet().iterator();
        while (predictions.size() > config.getMaxTrackedPredictions() && eldest.hasNext()) {
            eldest.next();
            eldest.remove();
        }
    }

    /**
     * Apply one operator confirmation. Re-delivering a feedback id already
     * applied has no effect.
     *
     * @param feedback the confirmation; its {@code feedbackId} is required
     * @return {@code true} if the cuts changed
     * @throws IllegalArgumentException if the feedback has no id
     */
    public synchronized boolean onFeedback(Feedback feedback) {
        Objects.requireNonNull(feedback, "feedback must not be null");
        if (feedback.getFeedbackId() == null || feedback.getFeedbackId().isBlank()) {
            throw new IllegalArgumentException("Feedback must carry a feedbackId");
        }
        Instant now = clock.instant();
        evict(now);

        if (state.getSeenFeedbackIds().containsKey(feedback.getFeedbackId())) {
            LOG.debug("Ignoring duplicate feedback '{}' for asset '{}'", feedback.getFeedbackId(), assetId);
            return false;
        }
        ThresholdState.TrackedPrediction prediction = state.getPredictions().get(feedback.getPredictedAlertId());
        if (prediction == null) {
            LOG.warn("Feedback '{}' refers to unknown or expired result '{}' for asset '{}'",
                    feedback.getFeedbackId(), feedback.getPredictedAlertId(), assetId);
            return false;
        }

        Instant at = feedback.getTimestamp() != null ? feedback.getTimestamp() : now;
        state.getFeedback().add(new ThresholdState.LabeledOutcome(feedback.getFeedbackId(),
                feedback.getPredictedAlertId(), prediction.getScore(), feedback.isConfirmedAnomaly(), at));
        state.getSeenFeedbackIds().put(feedback.getFeedbackId(), at);

        List<ThresholdState.LabeledOutcome> labeled = state.getFeedback();
        int positives = 0;
        for (ThresholdState.LabeledOutcome o : labeled) {
            if (o.isAnomaly()) {
                positives++;
            }
        }
        int negatives = labeled.size() - positives;

        boolean changed = false;
        if (labeled.size() >= config.getMinFeedback() && positives > 0 && negatives > 0) {
            changed = recalibrate(now);
        }
        state.setRollingFalsePositiveRate(falsePositiveRate(labeled, state.getWarningCut()));
        state.setRollingTruePositiveRate(recall(labeled, state.getWarningCut()));
        return changed;
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    private boolean recalibrate(Instant now) {
        List<ThresholdState.LabeledOutcome> labeled = state.getFeedback();
        int steps = config.getGridSteps();
        double[] candidates = new double[steps];
        double[] fpr = new double[steps];
        double[] tpr = new double[steps];
        for (int i = 0; i < steps; i++) {
            candidates[i] = (double) i / (steps - 1);
            fpr[i] = falsePositiveRate(labeled, candidates[i]);
            tpr[i] = recall(labeled, candidates[i]);
        }

        int bestW = -1;
        int bestC = -1;
        double bestObjective = Double.NEGATIVE_INFINITY;
        for (int w = 0; w < steps; w++) {
            if (fpr[w] > config.getTargetFalsePositiveRate()) {
                continue;
            }
            for (int c = w + 1; c < steps; c++) {
                if (fpr[c] > config.getCriticalFalsePositiveRate()) {
                    continue;
                }
                double objective = tpr[w] + tpr[c];
                // ascending scan, so >= within epsilon keeps the higher pair
                if (objective > bestObjective - TIE_EPSILON) {
                    bestObjective = Math.max(bestObjective, objective);
                    bestW = w;
                    bestC = c;
                }
            }
        }

        if (bestW < 0) {
            LOG.warn("No feasible cuts for asset '{}' within FPR targets {}/{}, keeping {}/{}", assetId,
                    config.getTargetFalsePositiveRate(), config.getCriticalFalsePositiveRate(),
                    state.getWarningCut(), state.getCriticalCut());
            return false;
        }
        double warning = candidates[bestW];
        double critical = candidates[bestC];
        if (!(critical > warning)) {
            LOG.warn("Rejected cut update for asset '{}': critical {} <= warning {}", assetId, critical, warning);
            return false;
        }
        if (state.isAdaptive() && warning == state.getWarningCut() && critical == state.getCriticalCut()) {
            return false;
        }
        state.setWarningCut(warning);
        state.setCriticalCut(critical);
        state.setAdaptive(true);
        state.setLastUpdated(now);
        LOG.info("Recalibrated cuts for asset '{}' to warning={} critical={} from {} labeled outcomes",
                assetId, warning, critical, labeled.size());
        return true;
    }

    private void evict(Instant now) {
        Instant horizon = now.minus(window);
        state.getFeedback().removeIf(o -> o.getTimestamp() != null && o.getTimestamp().isBefore(horizon));
        state.getSeenFeedbackIds().values().removeIf(t -> t != null && t.isBefore(horizon));
        state.getPredictions().values().removeIf(p -> p.getTimestamp() != null && p.getTimestamp().isBefore(horizon));
    }

    static double falsePositiveRate(List<ThresholdState.LabeledOutcome> labeled, double cut) {
        int negatives = 0;
        int flagged = 0;
        for (ThresholdState.LabeledOutcome o : labeled) {
            if (!o.isAnomaly()) {
                negatives++;
                if (o.getScore() >= cut) {
                    flagged++;
                }
            }
        }
        return negatives == 0 ? 0.0 : (double) flagged / negatives;
    }

    static double recall(List<ThresholdState.LabeledOutcome> labeled, double cut) {
        int positives = 0;
        int caught = 0;
        for (ThresholdState.LabeledOutcome o : labeled) {
            if (o.isAnomaly()) {
                positives++;
                if (o.getScore() >= cut) {
                    caught++;
                }
            }
        }
        return positives == 0 ? 0.0 : (double) caught / positives;
    }
}
