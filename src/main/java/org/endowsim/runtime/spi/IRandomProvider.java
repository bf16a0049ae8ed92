package org.endowsim.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to a Simulation.
 * Implementations should be pure with respect to the provided seed: the same seed must yield
 * the same sequence of draws, which is what makes two identically configured runs reproduce
 * each other.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Returns a normally distributed double with mean 0 and standard deviation 1.
     *
     * @return the gaussian sample
     */
    double nextGaussian();

    /**
     * Returns a double drawn uniformly from [min, max). If {@code max <= min} the result is {@code min}.
     *
     * @param min inclusive lower bound
     * @param max exclusive upper bound
     * @return the uniform sample
     */
    default double uniform(double min, double max) {
        if (max <= min) {
            return min;
        }
        return min + (max - min) * nextDouble();
    }

    /**
     * Returns an integer drawn uniformly from the closed range [min, max].
     *
     * @param min inclusive lower bound
     * @param max inclusive upper bound, must be >= min
     * @return the uniform sample
     */
    default long uniformInclusive(long min, long max) {
        if (max < min) {
            throw new IllegalArgumentException("max (" + max + ") must be >= min (" + min + ")");
        }
        long span = max - min + 1;
        if (span <= Integer.MAX_VALUE) {
            return min + nextInt((int) span);
        }
        return min + (long) Math.floor(nextDouble() * span);
    }

    /**
     * Provides access to an underlying {@link Random} instance for APIs that require it
     * (e.g., {@code Collections.shuffle}). Draws made through the returned instance advance
     * this provider's stream.
     *
     * @return the Random instance
     */
    Random asJavaRandom();
}
