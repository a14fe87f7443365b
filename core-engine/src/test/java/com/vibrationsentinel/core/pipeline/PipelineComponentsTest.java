package com.vibrationsentinel.core.pipeline;

import com.vibrationsentinel.core.detection.Activation;
import com.vibrationsentinel.core.detection.AnomalyDetector;
import com.vibrationsentinel.core.detection.DenseAutoencoder;
import com.vibrationsentinel.core.detection.DenseLayer;
import com.vibrationsentinel.core.detection.FeatureLayout;
import com.vibrationsentinel.core.detection.MissingModelDetector;
import com.vibrationsentinel.core.detection.PercentileScaler;
import com.vibrationsentinel.core.detection.ReconstructionDetector;
import com.vibrationsentinel.core.model.FeatureSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PipelineComponents}.
 */
class PipelineComponentsTest {

    @Test
    @DisplayName("Detectors whose inputs the schema provides are kept as they are")
    void matchingDetectorIsKept() {
        AnomalyDetector detector = detector(FeatureSchema.DEFAULT.names().subList(0, 3));

        List<AnomalyDetector> matched = PipelineComponents.matchToSchema(List.of(detector), FeatureSchema.DEFAULT);

        assertThat(matched).containsExactly(detector);
    }

    @Test
    @DisplayName("A detector trained on a feature the extractor does not produce is disabled")
    void unknownInputDisablesDetector() {
        List<String> names = new ArrayList<>(FeatureSchema.DEFAULT.names().subList(0, 2));
        names.add("bearing_temperature");

        List<AnomalyDetector> matched = PipelineComponents.matchToSchema(List.of(detector(names)),
                FeatureSchema.DEFAULT);

        assertThat(matched).singleElement().isInstanceOf(MissingModelDetector.class);
        assertThat(matched.get(0).name()).isEqualTo(ReconstructionDetector.NAME);
        assertThat(matched.get(0).isAvailable()).isFalse();
        assertThat(((MissingModelDetector) matched.get(0)).getReason()).contains("bearing_temperature");
    }

    @Test
    @DisplayName("Detectors without a layout pass through untouched")
    void detectorWithoutLayoutIsKept() {
        AnomalyDetector missing = new MissingModelDetector("isolation", "no artifact");

        assertThat(PipelineComponents.matchToSchema(List.of(missing), FeatureSchema.DEFAULT))
                .containsExactly(missing);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnomalyDetector detector(List<String> names) {
        int n = names.size();
        double[][] weights = new double[n][n];
        for (int i = 0; i < n; i++) {
            weights[i][i] = 1.0;
        }
        return new ReconstructionDetector(new FeatureLayout(names),
                new DenseAutoencoder(List.of(new DenseLayer(weights, new double[n], Activation.LINEAR))),
                new PercentileScaler(0.1, 0.5));
    }
}
