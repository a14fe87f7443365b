package com.vibrationsentinel.flink;

import com.vibrationsentinel.core.detection.AnomalyDetector;
import com.vibrationsentinel.core.detection.DetectorInput;
import com.vibrationsentinel.core.detection.MissingModelDetector;
import com.vibrationsentinel.core.ensemble.EnsembleScorer;
import com.vibrationsentinel.core.ensemble.EnsembleWeights;
import com.vibrationsentinel.core.ensemble.FallbackPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private final ExecutorService executor = EnsembleScorer.newDetectorExecutor(1);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Readiness lists each detector and reports a degraded ensemble")
    void degradedReadiness() {
        HealthServer server = new HealthServer(scorer(
                online("reconstruction"), new MissingModelDetector("temporal", "no artifact")));

        Map<String, Object> readiness = server.readiness();

        assertThat(readiness).containsEntry("status", "DEGRADED");
        assertThat(readiness.get("detectors"))
                .isEqualTo(Map.of("reconstruction", true, "temporal", false));
    }

    @Test
    @DisplayName("No loaded model means unhealthy")
    void unhealthyReadiness() {
        HealthServer server = new HealthServer(scorer(
                new MissingModelDetector("reconstruction", "no artifact"),
                new MissingModelDetector("temporal", "no artifact")));

        assertThat(server.readiness()).containsEntry("status", "UNHEALTHY");
    }

    @Test
    @DisplayName("Ports outside [1, 65535] are rejected before binding")
    void invalidPort() {
        HealthServer server = new HealthServer(scorer(online("reconstruction")));

        assertThatThrownBy(() -> server.start(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> server.start(65_536)).isInstanceOf(IllegalArgumentException.class);
        assertThat(server.isRunning()).isFalse();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private EnsembleScorer scorer(AnomalyDetector... detectors) {
        return new EnsembleScorer(List.of(detectors),
                new EnsembleWeights(Map.of("reconstruction", 0.5, "temporal", 0.5)),
                executor, Duration.ofSeconds(1), FallbackPolicy.SKIP, Clock.systemUTC());
    }

    private static AnomalyDetector online(String name) {
        return new AnomalyDetector() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public double score(DetectorInput input) {
                return 0.0;
            }
        };
    }
}
