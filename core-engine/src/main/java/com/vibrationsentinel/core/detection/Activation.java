package com.vibrationsentinel.core.detection;

/**
 * Elementwise activation functions used by the dense and recurrent layers.
 */
public enum Activation {
    LINEAR {
        @Override
        public double apply(double x) {
            return x;
        }
    },
    RELU {
        @Override
        public double apply(double x) {
            return x > 0.0 ? x : 0.0;
        }
    },
    SIGMOID {
        @Override
        public double apply(double x) {
            return 1.0 / (1.0 + Math.exp(-x));
        }
    },
    TANH {
        @Override
        public double apply(double x) {
            return Math.tanh(x);
        }
    };

    public abstract double apply(double x);
}
