/**
 * Versioned JSON persistence for normalization statistics, model artifacts
 * and per-asset calibration and drift state.
 */
package com.vibrationsentinel.core.state;
