/**
 * Apache Flink streaming job for Vibration Sentinel.
 *
 * <p>
 * This package wires the core inference engine into a Flink pipeline that
 * consumes raw vibration samples and operator feedback from Kafka, runs one
 * {@link com.vibrationsentinel.core.pipeline.AssetPipeline} per asset, and
 * publishes ensemble results, drift events and RUL estimates back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.vibrationsentinel.flink.VibrationSentinelJob}: main entry
 * point</li>
 * <li>{@link com.vibrationsentinel.flink.AssetPipelineFunction}: keyed
 * co-process function hosting the per-asset pipelines</li>
 * <li>{@link com.vibrationsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.vibrationsentinel.flink.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.vibrationsentinel.flink;
