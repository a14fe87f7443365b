package com.vibrationsentinel.core.model;

/**
 * Signal domain a feature is computed in.
 */
public enum FeatureDomain {
    TIME,
    FREQUENCY,
    WAVELET
}
