package com.flowmable.spd;

/**
 * Modulation designed for one stimulus direction on one primary subset.
 *
 * @param direction                 Direction name
 * @param backgroundPrimary         Background settings
 * @param backgroundSpd             Background spectrum, {@code B · background}
 * @param modulationPrimary         Positive-arm settings returned by the solver
 * @param positiveContrast          Receptor contrast of the positive arm, one entry per receptor
 * @param negativeContrast          Receptor contrast of the mirrored negative arm
 * @param positiveSpd               Positive-arm spectrum
 * @param negativeSpd               Negative-arm spectrum
 * @param contrastScale             Fraction of the desired contrast finally requested
 * @param differentialConstraintMet Whether the contrast-group bound was met
 */
public record DirectionResult(
        String direction,
        double[] backgroundPrimary,
        double[] backgroundSpd,
        double[] modulationPrimary,
        double[] positiveContrast,
        double[] negativeContrast,
        double[] positiveSpd,
        double[] negativeSpd,
        double contrastScale,
        boolean differentialConstraintMet
) {}
