package com.flowmable.spd;

import java.util.List;
import java.util.Map;

/**
 * The persisted device design: the winning subset and everything computed for it.
 *
 * @param primaryIndices          Pool indices of the chosen primaries
 * @param primaryNames            Their names
 * @param receptorClasses         Photoreceptor class names
 * @param sensitivities           Receptor × wavelength sensitivity matrix
 * @param wavelengthsNm           Wavelength of every sample
 * @param preFilterMatrix         Primary matrix before mirror filtering
 * @param matrix                  Primary matrix used for the modulations
 * @param crossoverWavelengthsNm  Mirror centres
 * @param directions              Direction specs, in evaluation order
 * @param results                 Per-direction modulation, by direction name
 * @param worstShortfall          Selection score of this subset
 * @param testedSubsets           Number of subsets compared
 * @param seed                    Seed reproducing the search
 */
public record ResultSet(
        int[] primaryIndices,
        List<String> primaryNames,
        List<String> receptorClasses,
        double[][] sensitivities,
        double[] wavelengthsNm,
        double[][] preFilterMatrix,
        double[][] matrix,
        double[] crossoverWavelengthsNm,
        List<StimulusDirection> directions,
        Map<String, DirectionResult> results,
        double worstShortfall,
        int testedSubsets,
        long seed
) {

    public static ResultSet of(SearchOutcome outcome, NormalizedPrimaries primaries,
                               ReceptorSet receptors, SearchConfig config) {
        SubsetTrial best = outcome.best();
        return new ResultSet(
                best.subset(),
                best.names(),
                receptors.classNames(),
                receptors.sensitivities(),
                primaries.support().wavelengths(),
                best.preFilterMatrix(),
                best.matrix(),
                best.crossoverWavelengthsNm(),
                config.directions(),
                best.directions(),
                outcome.bestScore(),
                outcome.testedSubsets().size(),
                outcome.seed());
    }
}
