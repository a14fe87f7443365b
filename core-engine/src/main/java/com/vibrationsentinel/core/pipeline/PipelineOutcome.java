package com.vibrationsentinel.core.pipeline;

import com.vibrationsentinel.core.model.DriftEvent;
import com.vibrationsentinel.core.model.EnsembleResult;
import com.vibrationsentinel.core.model.RulEstimate;

import java.util.Optional;

/**
 * What one window produced: possibly an ensemble result, a drift event and
 * a RUL estimate, or the reason the window was dropped.
 */
public final class PipelineOutcome {

    private final EnsembleResult result;
    private final DriftEvent driftEvent;
    private final RulEstimate rulEstimate;
    private final String droppedReason;

    private PipelineOutcome(EnsembleResult result, DriftEvent driftEvent, RulEstimate rulEstimate,
            String droppedReason) {
        this.result = result;
        this.driftEvent = driftEvent;
        this.rulEstimate = rulEstimate;
        this.droppedReason = droppedReason;
    }

    static PipelineOutcome of(EnsembleResult result, DriftEvent driftEvent, RulEstimate rulEstimate) {
        return new PipelineOutcome(result, driftEvent, rulEstimate, null);
    }

    static PipelineOutcome dropped(String reason) {
        return new PipelineOutcome(null, null, null, reason);
    }

    public Optional<EnsembleResult> result() {
        return Optional.ofNullable(result);
    }

    public Optional<DriftEvent> driftEvent() {
        return Optional.ofNullable(driftEvent);
    }

    public Optional<RulEstimate> rulEstimate() {
        return Optional.ofNullable(rulEstimate);
    }

    public boolean isDropped() {
        return droppedReason != null;
    }

    public String droppedReason() {
        return droppedReason;
    }

    @Override
    public String toString() {
        if (isDropped()) {
            return "PipelineOutcome{dropped='" + droppedReason + "'}";
        }
        return "PipelineOutcome{result=" + (result != null ? result.getAlertLevel() : "none")
                + ", drift=" + (driftEvent != null) + ", rul=" + (rulEstimate != null ? rulEstimate.getStatus() : "none")
                + '}';
    }
}
