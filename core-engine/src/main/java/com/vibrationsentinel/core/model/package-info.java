/**
 * Domain model of the vibration scoring pipeline.
 *
 * <p>
 * Value types flowing through the pipeline:
 * </p>
 * <ul>
 * <li>{@link com.vibrationsentinel.core.model.RawSample} and
 * {@link com.vibrationsentinel.core.model.Window}: input signal</li>
 * <li>{@link com.vibrationsentinel.core.model.FeatureVector} with its
 * {@link com.vibrationsentinel.core.model.FeatureSchema}: extracted
 * features</li>
 * <li>{@link com.vibrationsentinel.core.model.DetectorScore} and
 * {@link com.vibrationsentinel.core.model.EnsembleResult}: scoring
 * output</li>
 * <li>{@link com.vibrationsentinel.core.model.Feedback},
 * {@link com.vibrationsentinel.core.model.DriftEvent} and
 * {@link com.vibrationsentinel.core.model.RulEstimate}: calibration and
 * reporting</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.vibrationsentinel.core.model;
