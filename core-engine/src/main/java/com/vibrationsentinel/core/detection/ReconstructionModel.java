package com.vibrationsentinel.core.detection;

/**
 * Model that reproduces its input; large reconstruction error signals an
 * input unlike the healthy data the model was fit on.
 */
public interface ReconstructionModel {

    int inputSize();

    double[] reconstruct(double[] input);
}
