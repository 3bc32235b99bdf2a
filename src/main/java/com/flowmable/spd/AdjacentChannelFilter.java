package com.flowmable.spd;

/**
 * Model of the dichroic mirrors that combine spectrally adjacent primaries.
 * <p>
 * Each mirror is a logistic crossover: the higher-wavelength primary of a pair is
 * passed with transmittance {@code t(λ)} and the lower one with {@code 1 - t(λ)}.
 * Pairs are processed left to right exactly once, so an inner primary is
 * attenuated first by its lower neighbour's mirror and then by its upper one.
 */
public class AdjacentChannelFilter {

    private final double maxSlopePerNm;

    /**
     * @param maxSlopePerNm Maximum slope of the logistic, in transmittance fraction per nm
     */
    public AdjacentChannelFilter(double maxSlopePerNm) {
        if (!(maxSlopePerNm > 0)) {
            throw new ConfigurationException("Filter slope must be positive, got " + maxSlopePerNm);
        }
        this.maxSlopePerNm = maxSlopePerNm;
    }

    /**
     * Filtered primary matrix plus the crossover wavelength used for every adjacent pair.
     *
     * @param matrix                 Wavelength × primary matrix after filtering
     * @param crossoverWavelengthsNm One entry per adjacent pair (length = primaries - 1)
     */
    public record Filtered(double[][] matrix, double[] crossoverWavelengthsNm) {}

    /**
     * Transmittance of the upper channel of a mirror centred on {@code centerIndex}.
     */
    public double[] transmittance(WavelengthSupport support, int centerIndex) {
        double[] t = new double[support.count()];
        for (int w = 0; w < t.length; w++) {
            double offsetNm = (w - centerIndex) * support.stepNm();
            t[w] = 1.0 / (1.0 + Math.exp(-maxSlopePerNm * offsetNm));
        }
        return t;
    }

    /**
     * Sample index where the curves of two neighbouring primaries cross.
     * <p>
     * Takes the pointwise difference {@code lower - upper}, locates its maximum and
     * minimum, and returns the index between them where the absolute difference is
     * smallest. The first such index wins on ties.
     */
    public static int crossoverIndex(double[] lower, double[] upper) {
        int argMax = 0;
        int argMin = 0;
        double[] diff = new double[lower.length];
        for (int w = 0; w < diff.length; w++) {
            diff[w] = lower[w] - upper[w];
            if (diff[w] > diff[argMax]) argMax = w;
            if (diff[w] < diff[argMin]) argMin = w;
        }

        int from = Math.min(argMax, argMin);
        int to = Math.max(argMax, argMin);
        int best = from;
        for (int w = from + 1; w <= to; w++) {
            if (Math.abs(diff[w]) < Math.abs(diff[best])) {
                best = w;
            }
        }
        return best;
    }

    /**
     * Apply the mirror cascade to a copy of {@code b}; the input is not modified.
     *
     * @param b               Wavelength × primary matrix, columns ordered by increasing peak wavelength
     * @param support         Wavelength sampling of {@code b}
     * @param explicitCenters Crossover wavelengths to use instead of automatic detection; may be null
     */
    public Filtered apply(double[][] b, WavelengthSupport support, double[] explicitCenters) {
        int nPrimaries = b.length == 0 ? 0 : b[0].length;
        double[][] out = SpectralMath.copy(b);
        double[] centersNm = new double[Math.max(0, nPrimaries - 1)];

        if (explicitCenters != null && explicitCenters.length < centersNm.length) {
            throw new ConfigurationException(String.format(
                    "Need %d filter centre wavelengths, got %d", centersNm.length, explicitCenters.length));
        }

        for (int i = 0; i < nPrimaries - 1; i++) {
            int centerIdx;
            if (explicitCenters != null) {
                centersNm[i] = explicitCenters[i];
                centerIdx = support.indexOfNearest(explicitCenters[i]);
            } else {
                centerIdx = crossoverIndex(SpectralMath.column(out, i), SpectralMath.column(out, i + 1));
                centersNm[i] = support.wavelengthAt(centerIdx);
            }

            double[] t = transmittance(support, centerIdx);
            for (int w = 0; w < out.length; w++) {
                out[w][i] *= (1.0 - t[w]);
                out[w][i + 1] *= t[w];
            }
        }
        return new Filtered(out, centersNm);
    }
}
