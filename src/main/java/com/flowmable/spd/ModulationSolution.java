package com.flowmable.spd;

/**
 * Outcome of one constrained modulation search.
 *
 * @param primary                   Modulation primary settings
 * @param contrastScale             Fraction of the desired contrast requested in the final attempt
 * @param differentialConstraintMet Whether every contrast group ended within its bound
 * @param attempts                  Number of contrast levels tried
 */
public record ModulationSolution(
        double[] primary,
        double contrastScale,
        boolean differentialConstraintMet,
        int attempts
) {}
