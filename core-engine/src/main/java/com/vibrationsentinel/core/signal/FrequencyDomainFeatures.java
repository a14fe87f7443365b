package com.vibrationsentinel.core.signal;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * Spectral features of a Hann-tapered window.
 *
 * <p>
 * Only strictly positive frequencies below Nyquist are used (bins
 * {@code 1 .. M/2 - 1}); the DC and Nyquist bins are ignored. Windows whose
 * length is not a power of two are zero-padded to the next power of two,
 * with bin frequencies computed from the padded length.
 * </p>
 */
final class FrequencyDomainFeatures {

    static final int COUNT = 10;

    private static final double EPS = 1e-12;
    private static final double ROLLOFF_FRACTION = 0.85;

    private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

    private FrequencyDomainFeatures() {
        // utility class, not instantiable
    }

    /**
     * Writes dominant_freq, spectral_centroid, spectral_rolloff_85,
     * spectral_spread, four band powers, freq_variance and spectral_kurtosis
     * into {@code out} starting at {@code offset}.
     *
     * @param bandEdges five ascending edges delimiting the four power bands;
     *                  a bin belongs to band {@code b} when
     *                  {@code edges[b] <= f < edges[b + 1]}
     */
    static void compute(double[] x, double sampleRate, double[] bandEdges, double[] out, int offset) {
        int n = x.length;
        int m = Integer.highestOneBit(n) == n ? n : Integer.highestOneBit(n) << 1;

        double[] tapered = new double[m];
        for (int i = 0; i < n; i++) {
            tapered[i] = x[i] * hann(i, n);
        }
        Complex[] spectrum = FFT.transform(tapered, TransformType.FORWARD);

        int bins = Math.max(0, m / 2 - 1);
        double[] freq = new double[bins];
        double[] power = new double[bins];
        double total = 0.0;
        int dominant = 0;
        double dominantMag = -1.0;
        for (int k = 0; k < bins; k++) {
            freq[k] = (k + 1) * sampleRate / m;
            double mag = spectrum[k + 1].abs();
            power[k] = mag * mag;
            total += power[k];
            if (mag > dominantMag) {
                dominantMag = mag;
                dominant = k;
            }
        }
        double denom = total + EPS;

        double centroid = 0.0;
        for (int k = 0; k < bins; k++) {
            centroid += freq[k] * power[k];
        }
        centroid /= denom;

        double variance = 0.0;
        for (int k = 0; k < bins; k++) {
            double d = freq[k] - centroid;
            variance += power[k] * d * d;
        }
        variance /= denom;
        double spread = Math.sqrt(variance);

        double kurtosis = 0.0;
        if (spread > EPS) {
            for (int k = 0; k < bins; k++) {
                double z = (freq[k] - centroid) / spread;
                kurtosis += power[k] * z * z * z * z;
            }
            kurtosis = kurtosis / denom - 3.0;
        }

        double rolloff = 0.0;
        double target = ROLLOFF_FRACTION * total;
        double cumulative = 0.0;
        for (int k = 0; k < bins; k++) {
            cumulative += power[k];
            if (cumulative >= target) {
                rolloff = freq[k];
                break;
            }
        }

        double[] bands = new double[4];
        for (int k = 0; k < bins; k++) {
            for (int b = 0; b < 4; b++) {
                if (freq[k] >= bandEdges[b] && freq[k] < bandEdges[b + 1]) {
                    bands[b] += power[k];
                    break;
                }
            }
        }

        out[offset] = bins == 0 ? 0.0 : freq[dominant];
        out[offset + 1] = centroid;
        out[offset + 2] = rolloff;
        out[offset + 3] = spread;
        System.arraycopy(bands, 0, out, offset + 4, 4);
        out[offset + 8] = variance;
        out[offset + 9] = kurtosis;
    }

    static double hann(int i, int n) {
        if (n == 1) {
            return 1.0;
        }
        return 0.5 - 0.5 * Math.cos(2.0 * Math.PI * i / (n - 1));
    }
}
