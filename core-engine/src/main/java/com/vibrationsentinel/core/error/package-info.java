/**
 * Exception hierarchy of the scoring pipeline.
 *
 * <p>
 * All exceptions are unchecked and extend
 * {@link com.vibrationsentinel.core.error.VibrationSentinelException}.
 * {@link com.vibrationsentinel.core.error.VibrationSentinelException#isFatal()}
 * tells the per-asset pipeline whether to degrade or stop.
 * </p>
 *
 * @since 1.0.0
 */
package com.vibrationsentinel.core.error;
