package com.railwise.backend.service;

/**
 * Source of randomness for the simulation. Tests supply scripted sequences.
 */
public interface RandomSource {

    /**
     * Uniform double in [0, 1).
     */
    double nextDouble();

    /**
     * Uniform integer in [min, max], both inclusive.
     */
    int nextInt(int min, int max);

    /**
     * Uniform double in [min, max).
     */
    default double uniform(double min, double max) {
        return min + (max - min) * nextDouble();
    }
}
