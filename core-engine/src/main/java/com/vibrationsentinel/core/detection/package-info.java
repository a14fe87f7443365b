/**
 * The {@link com.vibrationsentinel.core.detection.AnomalyDetector}
 * capability and its three implementations.
 *
 * <ul>
 * <li>{@link com.vibrationsentinel.core.detection.ReconstructionDetector}
 * uses autoencoder reconstruction error.</li>
 * <li>{@link com.vibrationsentinel.core.detection.IsolationDetector} uses
 * isolation forest path length.</li>
 * <li>{@link com.vibrationsentinel.core.detection.TemporalDetector} uses an
 * LSTM over the recent vector sequence.</li>
 * </ul>
 *
 * <p>
 * Model weights are produced offline and loaded through
 * {@link com.vibrationsentinel.core.registry.ModelRegistry}; this package only
 * evaluates them.
 * </p>
 */
package com.vibrationsentinel.core.detection;
