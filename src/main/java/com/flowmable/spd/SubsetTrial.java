package com.flowmable.spd;

import java.util.List;
import java.util.Map;

/**
 * Everything computed for one candidate subset of primaries.
 *
 * @param subset                 Pool indices, in mirror-cascade order
 * @param names                  Primary names, same order
 * @param preFilterMatrix        Wavelength × primary matrix before mirror filtering
 * @param matrix                 Matrix actually used for the modulations
 * @param crossoverWavelengthsNm Mirror centres (empty when filtering is off)
 * @param directions             Result per direction name, in configuration order
 */
public record SubsetTrial(
        int[] subset,
        List<String> names,
        double[][] preFilterMatrix,
        double[][] matrix,
        double[] crossoverWavelengthsNm,
        Map<String, DirectionResult> directions
) {

    public DirectionResult result(StimulusDirection direction) {
        DirectionResult r = directions.get(direction.name());
        if (r == null) {
            throw new IllegalArgumentException("No result for direction " + direction.name());
        }
        return r;
    }
}
