/**
 * Configuration loading and validation for the scoring pipeline.
 *
 * <p>
 * The pipeline is configured in YAML and loaded by
 * {@link com.vibrationsentinel.core.config.PipelineConfigLoader} into a
 * {@link com.vibrationsentinel.core.config.PipelineConfig} instance.
 * Validation runs automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.vibrationsentinel.core.config;
