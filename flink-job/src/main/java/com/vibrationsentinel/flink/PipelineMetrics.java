package com.vibrationsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Vibration Sentinel.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus).
 * The metric reporter is configured in {@code flink-conf.yaml} at cluster
 * level; the job only defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code windows_processed_total}: windows that produced an outcome</li>
 *   <li>{@code windows_dropped_total}: windows dropped by feature, scoring or
 *   pipeline failures</li>
 *   <li>{@code alerts_total}: WARNING and CRITICAL results</li>
 *   <li>{@code degraded_results_total}: results missing at least one detector</li>
 *   <li>{@code drift_events_total}: sustained drift notifications</li>
 *   <li>{@code processing_latency_ms}: histogram of per-window latency</li>
 * </ul>
 */
public class PipelineMetrics {

    private final Counter windowsProcessed;
    private final Counter windowsDropped;
    private final Counter alerts;
    private final Counter degradedResults;
    private final Counter driftEvents;
    private final Histogram processingLatency;

    public PipelineMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("vibration_sentinel");

        this.windowsProcessed = group.counter("windows_processed_total");
        this.windowsDropped = group.counter("windows_dropped_total");
        this.alerts = group.counter("alerts_total");
        this.degradedResults = group.counter("degraded_results_total");
        this.driftEvents = group.counter("drift_events_total");

        // sliding window of the last 350 samples
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementWindowsProcessed() {
        windowsProcessed.inc();
    }

    public void incrementWindowsDropped() {
        windowsDropped.inc();
    }

    public void incrementAlerts() {
        alerts.inc();
    }

    public void incrementDegradedResults() {
        degradedResults.inc();
    }

    public void incrementDriftEvents() {
        driftEvents.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
