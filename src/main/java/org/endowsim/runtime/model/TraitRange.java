package org.endowsim.runtime.model;

import org.endowsim.runtime.spi.IRandomProvider;

/**
 * A closed sampling interval for a holder trait or holding size.
 *
 * @param min lower bound
 * @param max upper bound, must be >= min
 */
public record TraitRange(double min, double max) {

    public TraitRange {
        if (Double.isNaN(min) || Double.isNaN(max) || max < min) {
            throw new IllegalArgumentException("Invalid range [" + min + ", " + max + "]");
        }
    }

    /**
     * Draws a value uniformly from this range.
     *
     * @param random the random stream to draw from
     * @return a value in [min, max]
     */
    public double sample(IRandomProvider random) {
        return random.uniform(min, max);
    }

    /**
     * @param value the value to test
     * @return true if the value lies within the closed range
     */
    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
