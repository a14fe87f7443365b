/**
 * Combination of detector scores into a composite score and alert level.
 *
 * <p>
 * {@link com.vibrationsentinel.core.ensemble.EnsembleScorer} calls every
 * {@link com.vibrationsentinel.core.detection.AnomalyDetector} concurrently
 * under a shared timeout, renormalizes
 * {@link com.vibrationsentinel.core.ensemble.EnsembleWeights} over the
 * detectors that answered and classifies the composite against
 * {@link com.vibrationsentinel.core.ensemble.AlertCuts}.
 * </p>
 */
package com.vibrationsentinel.core.ensemble;
