package com.flowmable.spd;

import java.util.List;

/**
 * Result of a full search: the winning subset's bundle plus the score of every tested subset.
 *
 * @param best           Full trial bundle of the winning subset
 * @param bestIndex      Position of the winner in {@code testedSubsets}
 * @param worstShortfall Score of every tested subset, same order as {@code testedSubsets}
 * @param testedSubsets  Subsets in search order
 * @param seed           Seed that reproduces the subset order and random starts
 * @param elapsedMillis  Wall-clock duration of the trial loop
 */
public record SearchOutcome(
        SubsetTrial best,
        int bestIndex,
        double[] worstShortfall,
        List<int[]> testedSubsets,
        long seed,
        long elapsedMillis
) {

    public double bestScore() {
        return worstShortfall[bestIndex];
    }
}
