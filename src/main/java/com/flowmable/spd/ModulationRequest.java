package com.flowmable.spd;

import java.util.List;

/**
 * Everything the constrained modulation solver needs for one direction of one subset.
 *
 * @param primaries              Wavelength × primary matrix (B)
 * @param background             Background primary settings
 * @param start                  Starting vector for iterative solvers
 * @param ambientSpd             Ambient spectrum added to every setting
 * @param sensitivities          Receptor × wavelength matrix (T)
 * @param targets                Receptors to modulate
 * @param ignored                Receptors left unconstrained
 * @param minimized              Receptors whose contrast is minimized in the objective
 * @param pinned                 Primaries held at their background setting
 * @param headroom               Margin kept from the [0, 1] device limits
 * @param desiredContrast        Signed desired contrast per target
 * @param contrastGroups         Groups of target positions subject to the difference bound
 * @param maxContrastDifference  Allowed spread of contrast magnitude within a group
 * @param stepSize               Decrement of the contrast scale between attempts
 * @param shrinkFactorThreshold  Give up once the scale falls below this fraction
 */
public record ModulationRequest(
        double[][] primaries,
        double[] background,
        double[] start,
        double[] ambientSpd,
        double[][] sensitivities,
        int[] targets,
        int[] ignored,
        int[] minimized,
        int[] pinned,
        double headroom,
        double[] desiredContrast,
        List<int[]> contrastGroups,
        double maxContrastDifference,
        double stepSize,
        double shrinkFactorThreshold
) {}
