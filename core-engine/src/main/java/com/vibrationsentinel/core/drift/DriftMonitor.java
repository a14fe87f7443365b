package com.vibrationsentinel.core.drift;

import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.ensemble.FallbackPolicy;
import com.vibrationsentinel.core.error.AvailabilityException;
import com.vibrationsentinel.core.model.DriftEvent;
import com.vibrationsentinel.core.model.FeatureSchema;
import com.vibrationsentinel.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Watches the live distribution of normalized features for departure from
 * the healthy reference.
 *
 * <p>
 * Every normalized vector is binned into a per-feature z-space histogram.
 * Every {@code checkInterval} windows the histogram is compared with the
 * reference using the Population Stability Index; the drift score is the
 * mean PSI across features and the histogram starts over. A
 * {@link DriftEvent} is produced only once {@code consecutiveChecks} checks
 * in a row exceed the threshold; a single check under the threshold resets
 * the run.
 * </p>
 *
 * <p>
 * The monitor is advisory: it never changes alert cuts or statistics.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(DriftMonitor.class);

    static final String RECOMMENDATION =
            "Live feature distribution has moved away from the healthy reference; "
                    + "review sensor placement and consider re-fitting normalization statistics and detectors";

    private final String assetId;
    private final PipelineConfig.Drift config;
    private final ExecutorService executor;
    private final Clock clock;
    private final Duration timeout;
    private final DriftState state;

    /**
     * @param state persisted state, or {@code null} to start against the
     *              standard-normal reference for {@code schema}
     */
    public DriftMonitor(String assetId, PipelineConfig.Drift config, FeatureSchema schema, DriftState state,
            ExecutorService executor, Clock clock) {
        this.assetId = Objects.requireNonNull(assetId, "assetId must not be null");
        this.config = Objects.requireNonNull(config, "Drift config must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.timeout = Duration.ofMillis(config.getTimeoutMs());
        if (state == null) {
            Objects.requireNonNull(schema, "schema must not be null");
            this.state = new DriftState(schema.names(), DistributionSummary.standardNormalReference(schema.size()));
        } else {
            state.checkInvariants();
            this.state = state.copy();
        }
    }

    public synchronized DriftState snapshot() {
        return state.copy();
    }

    /**
     * Account for one normalized vector and run a check when due.
     *
     * @return an event if this observation completed a sustained drift
     * @throws AvailabilityException if the check timed out or failed under
     *                               {@link FallbackPolicy#FAIL}
     */
    public synchronized Optional<DriftEvent> observe(FeatureVector normalized) {
        Objects.requireNonNull(normalized, "normalized vector must not be null");
        List<String> names = state.getFeatureNames();
        long[][] counts = state.getCurrentCounts();
        for (int f = 0; f < names.size(); f++) {
            counts[f][DistributionSummary.binOf(normalized.get(names.get(f)))]++;
        }
        state.setWindowsSinceCheck(state.getWindowsSinceCheck() + 1);
        if (state.getWindowsSinceCheck() < config.getCheckInterval()) {
            return Optional.empty();
        }
        return check();
    }

    private Optional<DriftEvent> check() {
        double[][] reference = state.getReference();
        long[][] counts = state.getCurrentCounts();
        List<String> names = state.getFeatureNames();
        state.setCurrentCounts(new long[names.size()][DistributionSummary.BINS]);
        state.setWindowsSinceCheck(0);

        Future<double[]> future = executor.submit(() -> {
            double[] psi = new double[names.size()];
            for (int f = 0; f < psi.length; f++) {
                psi[f] = DistributionSummary.psi(reference[f], DistributionSummary.proportions(counts[f]));
            }
            return psi;
        });

        double[] psi;
        try {
            psi = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return onFailure("drift check timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            return onFailure("drift check failed: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AvailabilityException("Interrupted during drift check for asset '" + assetId + "'", e);
        }

        Map<String, Double> perFeature = new LinkedHashMap<>();
        double sum = 0.0;
        for (int f = 0; f < psi.length; f++) {
            perFeature.put(names.get(f), psi[f]);
            sum += psi[f];
        }
        double score = psi.length == 0 ? 0.0 : sum / psi.length;
        state.setFeatureDivergence(perFeature);
        return evaluate(score);
    }

    private Optional<DriftEvent> evaluate(double score) {
        Instant now = clock.instant();
        state.setDivergence(score);
        state.setLastCheck(now);
        state.setChecks(state.getChecks() + 1);

        if (score <= config.getThreshold()) {
            if (state.getConsecutiveOverThreshold() > 0) {
                LOG.info("Drift for asset '{}' resolved (score {})", assetId, score);
            }
            state.setConsecutiveOverThreshold(0);
            return Optional.empty();
        }
        state.setConsecutiveOverThreshold(state.getConsecutiveOverThreshold() + 1);
        LOG.debug("Drift check over threshold for asset '{}': score={} run={}", assetId, score,
                state.getConsecutiveOverThreshold());
        if (state.getConsecutiveOverThreshold() < config.getConsecutiveChecks()) {
            return Optional.empty();
        }
        LOG.warn("Sustained drift for asset '{}': score {} over {} for {} consecutive checks", assetId, score,
                config.getThreshold(), state.getConsecutiveOverThreshold());
        return Optional.of(new DriftEvent(assetId, now, score, config.getThreshold(),
                state.getConsecutiveOverThreshold(), state.getFeatureDivergence(), RECOMMENDATION));
    }

    private Optional<DriftEvent> onFailure(String reason, Throwable cause) {
        FallbackPolicy policy = config.getFallback();
        if (policy == FallbackPolicy.FAIL) {
            throw new AvailabilityException("Asset '" + assetId + "': " + reason, cause);
        }
        if (policy == FallbackPolicy.REUSE_STALE && state.getLastCheck() != null) {
            // a stale score is not a new observation: the run is left as it was
            LOG.warn("Asset '{}': {}, last drift score {} stands (run {})", assetId, reason,
                    state.getDivergence(), state.getConsecutiveOverThreshold());
            return Optional.empty();
        }
        LOG.warn("Asset '{}': {}, skipping this drift check", assetId, reason);
        return Optional.empty();
    }
}
