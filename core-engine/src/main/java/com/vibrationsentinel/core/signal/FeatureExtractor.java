package com.vibrationsentinel.core.signal;

import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.error.FeatureComputationException;
import com.vibrationsentinel.core.model.FeatureSchema;
import com.vibrationsentinel.core.model.FeatureVector;
import com.vibrationsentinel.core.model.Window;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * Maps a {@link Window} to the 30-feature {@link FeatureVector} defined by
 * {@link FeatureSchema#DEFAULT}.
 *
 * <h3>Feature groups</h3>
 * <ul>
 * <li><b>Time</b> (10): on the raw window</li>
 * <li><b>Frequency</b> (10): on the Hann-tapered window</li>
 * <li><b>Wavelet</b> (10): db4, four levels, on the raw window</li>
 * </ul>
 *
 * <p>
 * Extraction is deterministic: the same window always yields a bit-identical
 * vector. It is a pure function of its input and therefore thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureExtractor implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final int MIN_WINDOW = 8;

    private final double ratioCeiling;
    private final double[] bandEdges;

    /**
     * @param ratioCeiling upper bound applied to crest and impulse factor
     * @param bandEdges    five ascending band edges in Hz
     */
    public FeatureExtractor(double ratioCeiling, double[] bandEdges) {
        if (!(ratioCeiling > 0)) {
            throw new IllegalArgumentException("ratioCeiling must be > 0, got: " + ratioCeiling);
        }
        Objects.requireNonNull(bandEdges, "bandEdges must not be null");
        if (bandEdges.length != 5) {
            throw new IllegalArgumentException("Exactly 5 band edges required, got: " + bandEdges.length);
        }
        for (int i = 1; i < bandEdges.length; i++) {
            if (!(bandEdges[i] > bandEdges[i - 1])) {
                throw new IllegalArgumentException("Band edges must be strictly ascending: "
                        + Arrays.toString(bandEdges));
            }
        }
        this.ratioCeiling = ratioCeiling;
        this.bandEdges = bandEdges.clone();
    }

    public static FeatureExtractor from(PipelineConfig.Features config) {
        Objects.requireNonNull(config, "Features config must not be null");
        return new FeatureExtractor(config.getCrestFactorCeiling(), config.bandEdges());
    }

    public static FeatureExtractor withDefaults() {
        return from(new PipelineConfig.Features());
    }

    public FeatureSchema schema() {
        return FeatureSchema.DEFAULT;
    }

    /**
     * @param window window to characterize; must not be {@code null}
     * @return the feature vector, tagged with the window's start and sequence
     * @throws IllegalArgumentException     if the window is too short for the
     *                                      wavelet filter
     * @throws FeatureComputationException if any feature is NaN or infinite
     */
    public FeatureVector extract(Window window) {
        Objects.requireNonNull(window, "window must not be null");
        if (window.size() < MIN_WINDOW) {
            throw new IllegalArgumentException("Window must have at least " + MIN_WINDOW
                    + " samples, got: " + window.size());
        }
        double[] x = window.samples();
        double[] values = new double[FeatureSchema.DEFAULT.size()];
        TimeDomainFeatures.compute(x, ratioCeiling, values, 0);
        FrequencyDomainFeatures.compute(x, window.getSampleRate(), bandEdges, values,
                TimeDomainFeatures.COUNT);
        WaveletDomainFeatures.compute(x, values,
                TimeDomainFeatures.COUNT + FrequencyDomainFeatures.COUNT);
        return new FeatureVector(FeatureSchema.DEFAULT, values, window.getStart(), window.getSequence());
    }
}
