/**
 * Feedback-driven calibration of the per-asset alert cuts.
 */
package com.vibrationsentinel.core.calibration;
