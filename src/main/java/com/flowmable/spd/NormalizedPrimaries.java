package com.flowmable.spd;

import java.util.List;

/**
 * The full pool of power-normalized primaries. Read-only once built.
 *
 * @param support   Shared wavelength sampling
 * @param primaries Primaries in input-table order
 */
public record NormalizedPrimaries(WavelengthSupport support, List<Primary> primaries) {

    public NormalizedPrimaries {
        primaries = List.copyOf(primaries);
    }

    public int size() {
        return primaries.size();
    }

    public Primary get(int index) {
        return primaries.get(index);
    }

    public double[] peakWavelengths() {
        return primaries.stream().mapToDouble(Primary::peakWavelengthNm).toArray();
    }

    /**
     * Wavelength × primary matrix of the selected primaries, in the given order.
     * Always a fresh copy.
     */
    public double[][] matrixFor(int[] subset) {
        double[][] b = new double[support.count()][subset.length];
        for (int c = 0; c < subset.length; c++) {
            double[] spd = primaries.get(subset[c]).spd();
            for (int w = 0; w < spd.length; w++) {
                b[w][c] = spd[w];
            }
        }
        return b;
    }
}
