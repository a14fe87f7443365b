/**
 * Signal conditioning: windowing of raw sample streams and extraction of
 * the time, frequency and wavelet feature vector.
 *
 * <p>
 * {@link com.vibrationsentinel.core.signal.Windower} produces
 * {@link com.vibrationsentinel.core.model.Window}s either lazily from a
 * {@link com.vibrationsentinel.core.signal.SampleStreamReader} or one sample
 * at a time through a {@link com.vibrationsentinel.core.signal.WindowAssembler}.
 * {@link com.vibrationsentinel.core.signal.FeatureExtractor} turns each
 * window into a {@link com.vibrationsentinel.core.model.FeatureVector}.
 * </p>
 */
package com.vibrationsentinel.core.signal;
