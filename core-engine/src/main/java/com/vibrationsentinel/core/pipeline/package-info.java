/**
 * Per-asset orchestration of windowing, features, normalization, ensemble
 * scoring, calibration, drift monitoring and RUL projection.
 */
package com.vibrationsentinel.core.pipeline;
