package com.vibrationsentinel.core.rul;

/**
 * Shape of the degradation trend fitted to the health history.
 */
public enum TrendModel {

    /** {@code health(t) = a + b t} */
    LINEAR {
        @Override
        double transform(double health) {
            return health;
        }
    },

    /** {@code ln health(t) = a + b t}, i.e. exponential decay */
    EXPONENTIAL {
        @Override
        double transform(double health) {
            return Math.log(Math.max(health, MIN_HEALTH));
        }
    };

    static final double MIN_HEALTH = 1e-6;

    /** Map a health value into the space the trend is linear in. */
    abstract double transform(double health);
}
