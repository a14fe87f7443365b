package com.vibrationsentinel.core.rul;

import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.model.RulEstimate;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Projects remaining useful life from the health trend.
 *
 * <h3>Method</h3>
 * <ol>
 * <li>Fit {@code y = a + b t} by least squares, where {@code t} is hours
 * since the oldest point and {@code y} is health (LINEAR) or log health
 * (EXPONENTIAL).</li>
 * <li>Solve for the time at which the fitted trend reaches the failure
 * threshold.</li>
 * <li>Bound the estimate by shifting the trend up and down by
 * {@code confidenceZ} residual standard deviations.</li>
 * </ol>
 *
 * <p>
 * The estimate is {@link RulEstimate.Status#UNAVAILABLE} with too few
 * points or when the trend is flat or improving. Health already at or
 * below the threshold yields zero remaining life.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(RulEstimator.class);

    private static final double NANOS_PER_HOUR = 3_600_000_000_000.0;

    private final int minPoints;
    private final double failureThreshold;
    private final double confidenceZ;
    private final TrendModel trendModel;

    public RulEstimator(int minPoints, double failureThreshold, double confidenceZ, TrendModel trendModel) {
        if (minPoints < 3) {
            throw new IllegalArgumentException("minPoints must be >= 3, got: " + minPoints);
        }
        if (!(failureThreshold > 0.0 && failureThreshold < 1.0)) {
            throw new IllegalArgumentException("failureThreshold must be in (0,1), got: " + failureThreshold);
        }
        if (!(confidenceZ > 0.0)) {
            throw new IllegalArgumentException("confidenceZ must be > 0, got: " + confidenceZ);
        }
        this.minPoints = minPoints;
        this.failureThreshold = failureThreshold;
        this.confidenceZ = confidenceZ;
        this.trendModel = Objects.requireNonNull(trendModel, "trendModel must not be null");
    }

    public static RulEstimator from(PipelineConfig.Rul config) {
        Objects.requireNonNull(config, "Rul config must not be null");
        return new RulEstimator(config.getMinPoints(), config.getFailureThreshold(), config.getConfidenceZ(),
                TrendModel.valueOf(config.getTrendModel().toUpperCase(Locale.ROOT)));
    }

    /**
     * @param assetId asset the history belongs to
     * @param history health points, oldest first
     * @param now     timestamp to stamp the estimate with
     * @return the estimate; never {@code null}
     */
    public RulEstimate estimate(String assetId, List<HealthPoint> history, Instant now) {
        Objects.requireNonNull(history, "history must not be null");
        int n = history.size();
        if (n < minPoints) {
            return RulEstimate.unavailable(assetId, now,
                    "insufficient history: " + n + " of " + minPoints + " points", n);
        }

        HealthPoint last = history.get(n - 1);
        double currentHealth = last.getHealth();
        if (currentHealth <= failureThreshold) {
            return RulEstimate.available(assetId, now, Duration.ZERO, Duration.ZERO, Duration.ZERO,
                    currentHealth, 0.0, trendModel.name(), n);
        }

        Instant origin = history.get(0).getTimestamp();
        SimpleRegression regression = new SimpleRegression();
        for (HealthPoint p : history) {
            regression.addData(hoursBetween(origin, p.getTimestamp()), trendModel.transform(p.getHealth()));
        }
        double slope = regression.getSlope();
        if (Double.isNaN(slope) || slope >= 0.0) {
            return RulEstimate.unavailable(assetId, now, "no degradation trend (slope " + slope + ")", n);
        }

        double intercept = regression.getIntercept();
        double target = trendModel.transform(failureThreshold);
        double residualStd = n > 2 ? Math.sqrt(Math.max(regression.getMeanSquareError(), 0.0)) : 0.0;
        double margin = confidenceZ * residualStd;
        double elapsed = hoursBetween(origin, last.getTimestamp());

        double remaining = Math.max(0.0, (target - intercept) / slope - elapsed);
        double lower = Math.max(0.0, (target - (intercept - margin)) / slope - elapsed);
        double upper = Math.max(remaining, (target - (intercept + margin)) / slope - elapsed);
        lower = Math.min(lower, remaining);

        LOG.debug("RUL for asset '{}': {} h [{}, {}] slope={} per hour", assetId, remaining, lower, upper, slope);
        return RulEstimate.available(assetId, now, hours(remaining), hours(lower), hours(upper),
                currentHealth, slope, trendModel.name(), n);
    }

    private static double hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).toNanos() / NANOS_PER_HOUR;
    }

    private static Duration hours(double h) {
        if (h >= Long.MAX_VALUE / NANOS_PER_HOUR) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.round(h * NANOS_PER_HOUR));
    }
}
