package com.flowmable.spd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Builds the list of primary subsets a search will test.
 * <p>
 * Every enumerated subset is returned with its members ordered by increasing peak
 * wavelength (ties by pool index), which is the order the mirror cascade expects.
 */
public final class SubsetEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(SubsetEnumerator.class);

    private SubsetEnumerator() {}

    /**
     * @param peakWavelengths Peak wavelength of every primary in the pool
     * @param subsetSize      Number of primaries per subset
     * @param minSpacingNm    Adjacent peaks must differ by strictly more than this
     * @param explicitSubset  If non-empty, the only subset tested (used as given)
     * @param maxTests        Cap on the number of subsets; null tests all survivors
     * @param random          Source for the search order shuffle
     * @return Subsets to test, in search order
     * @throws ConfigurationException if no subset survives the spacing filter
     */
    public static List<int[]> candidates(
            double[] peakWavelengths,
            int subsetSize,
            double minSpacingNm,
            int[] explicitSubset,
            Integer maxTests,
            Random random) {

        int pool = peakWavelengths.length;

        if (explicitSubset != null && explicitSubset.length > 0) {
            validateExplicit(explicitSubset, pool);
            logger.info("Testing the explicit subset {}", Arrays.toString(explicitSubset));
            return List.of(explicitSubset.clone());
        }

        if (subsetSize < 1 || subsetSize > pool) {
            throw new ConfigurationException(String.format(
                    "Cannot choose %d primaries from a pool of %d", subsetSize, pool));
        }

        List<int[]> survivors = new ArrayList<>();
        long[] total = {0};
        forEachCombination(pool, subsetSize, combo -> {
            total[0]++;
            int[] ordered = sortByPeak(combo, peakWavelengths);
            if (isWellSeparated(ordered, peakWavelengths, minSpacingNm)) {
                survivors.add(ordered);
            }
        });

        if (survivors.isEmpty()) {
            throw new ConfigurationException(String.format(
                    "No %d-primary subset has peaks separated by more than %.1f nm; relax the spacing or the subset size",
                    subsetSize, minSpacingNm));
        }

        Collections.shuffle(survivors, random);

        int nTests = maxTests == null ? survivors.size() : Math.min(maxTests, survivors.size());
        logger.info("{} of {} subsets pass the {} nm spacing filter; testing {}",
                survivors.size(), total[0], minSpacingNm, nTests);
        return new ArrayList<>(survivors.subList(0, nTests));
    }

    /**
     * True when every pair of peak-adjacent members is more than {@code minSpacingNm} apart.
     */
    public static boolean isWellSeparated(int[] subset, double[] peakWavelengths, double minSpacingNm) {
        int[] ordered = sortByPeak(subset, peakWavelengths);
        for (int i = 1; i < ordered.length; i++) {
            double gap = peakWavelengths[ordered[i]] - peakWavelengths[ordered[i - 1]];
            if (gap <= minSpacingNm) {
                return false;
            }
        }
        return true;
    }

    public static int[] sortByPeak(int[] subset, double[] peakWavelengths) {
        return Arrays.stream(subset)
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> peakWavelengths[i])
                        .thenComparingInt(i -> i))
                .mapToInt(Integer::intValue)
                .toArray();
    }

    /**
     * All k-element combinations of {@code 0..n-1} in lexicographic order.
     */
    public static List<int[]> combinations(int n, int k) {
        List<int[]> out = new ArrayList<>();
        forEachCombination(n, k, c -> out.add(c.clone()));
        return out;
    }

    /**
     * Visits every k-element combination of {@code 0..n-1} in lexicographic order
     * without materializing them. The array passed to {@code action} is reused
     * between calls; copy it to keep it.
     */
    public static void forEachCombination(int n, int k, Consumer<int[]> action) {
        if (k < 1 || k > n) {
            return;
        }
        int[] c = new int[k];
        for (int i = 0; i < k; i++) {
            c[i] = i;
        }
        while (true) {
            action.accept(c);
            int i = k - 1;
            while (i >= 0 && c[i] == n - k + i) {
                i--;
            }
            if (i < 0) {
                return;
            }
            c[i]++;
            for (int j = i + 1; j < k; j++) {
                c[j] = c[j - 1] + 1;
            }
        }
    }

    private static void validateExplicit(int[] subset, int pool) {
        boolean[] seen = new boolean[pool];
        for (int idx : subset) {
            if (idx < 0 || idx >= pool) {
                throw new ConfigurationException("Explicit subset index " + idx + " is outside the pool of " + pool);
            }
            if (seen[idx]) {
                throw new ConfigurationException("Explicit subset lists primary " + idx + " twice");
            }
            seen[idx] = true;
        }
    }
}
