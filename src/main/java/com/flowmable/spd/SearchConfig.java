package com.flowmable.spd;

import java.util.List;
import java.util.Map;

/**
 * Immutable run configuration of a primary-set search.
 * <p>
 * Indices (primaries, receptors, target positions) are 0-based.
 *
 * @param outputDir                Directory receiving the result artifact and plots
 * @param spdFile                  CSV table of raw primary spectra
 * @param powerFile                CSV table of measured total power per primary (mW)
 * @param sensitivityFile          CSV table of receptor sensitivities
 * @param primaryHeadroom          Margin kept from the device limits [0, 1]
 * @param observer                 Observer parameters for the sensitivity provider
 * @param primariesToKeep          Subset size
 * @param minSpacingNm             Adjacent peaks in a subset must differ by more than this
 * @param backgroundMode           Background construction
 * @param filterAdjacentPrimaries  Whether to model the dichroic mirrors
 * @param filterMaxSlope           Maximum logistic slope of a mirror, per nm
 * @param bestKnownSubset          If set, the only subset tested
 * @param filterCenterWavelengths  If set, mirror centres in nm instead of automatic crossovers
 * @param maxTests                 Cap on tested subsets; null tests all
 * @param contrastStepSize         Contrast-scale decrement in the differential search
 * @param shrinkFactorThreshold    Give up once the contrast scale falls below this
 * @param startingPolicy           Starting vector for the solver
 * @param randomSeed               Seed for subset order and random starts; null for a fresh seed
 * @param parallelism              Worker threads; 0 uses every available processor
 * @param verbose                  Log search progress
 * @param makePlots                Write per-direction diagnostic plots
 * @param surfaceAreas             Emitter area (mm²) per primary-name suffix
 * @param receptorClasses          Photoreceptor class names, in sensitivity-row order
 * @param directions               Stimulus directions, in evaluation order
 */
public record SearchConfig(
        String outputDir,
        String spdFile,
        String powerFile,
        String sensitivityFile,
        double primaryHeadroom,
        ObserverParameters observer,
        int primariesToKeep,
        double minSpacingNm,
        BackgroundMode backgroundMode,
        boolean filterAdjacentPrimaries,
        double filterMaxSlope,
        int[] bestKnownSubset,
        double[] filterCenterWavelengths,
        Integer maxTests,
        double contrastStepSize,
        double shrinkFactorThreshold,
        StartingPolicy startingPolicy,
        Long randomSeed,
        int parallelism,
        boolean verbose,
        boolean makePlots,
        Map<String, Double> surfaceAreas,
        List<String> receptorClasses,
        List<StimulusDirection> directions
) {

    public static final List<String> DEFAULT_RECEPTOR_CLASSES = List.of(
            "L_2deg", "M_2deg", "S_2deg", "L_10deg", "M_10deg", "S_10deg", "Mel");

    /*
     * LMS     - equal contrast on peripheral cones, silencing Mel
     * LminusM - L-M with equal contrast at both eccentricities, ignoring Mel
     * S       - S with equal contrast at both eccentricities, ignoring Mel
     * Mel     - Mel directed, silencing peripheral but not central cones
     * SnoMel  - peripheral S that silences Mel
     */
    public static final List<StimulusDirection> DEFAULT_DIRECTIONS = List.of(
            new StimulusDirection("LMS", new int[]{3, 4, 5}, new int[]{0, 1, 2}, new int[0],
                    new double[]{0.5, 0.5, 0.5}, List.of(new int[]{0, 1, 2}), 0.015, true),
            new StimulusDirection("LminusM", new int[]{0, 1, 3, 4}, new int[]{6}, new int[0],
                    new double[]{0.12, -0.12, 0.12, -0.12}, List.of(new int[]{0, 1}, new int[]{2, 3}), 0.005, false),
            new StimulusDirection("S", new int[]{2, 5}, new int[]{6}, new int[0],
                    new double[]{0.7, 0.7}, List.of(new int[]{0, 1}), 0.025, false),
            new StimulusDirection("Mel", new int[]{6}, new int[]{0, 1, 2}, new int[0],
                    new double[]{0.6}, List.of(), 0, true),
            new StimulusDirection("SnoMel", new int[]{5}, new int[]{0, 1, 2}, new int[0],
                    new double[]{0.65}, List.of(), 0, false)
    );

    public static final SearchConfig DEFAULT = new SearchConfig(
            "nominalSPDs",
            "PrizmatixLED_FullSet_SPDs.csv",
            "PrizmatixLED_FullSet_totalPower.csv",
            "receptorSensitivities.csv",
            0.05,
            ObserverParameters.DEFAULT,
            8,
            20,
            BackgroundMode.UNIFORM,
            true,
            0.2,
            null,
            null,
            null,
            0.025,
            0.5,
            StartingPolicy.BACKGROUND,
            null,
            0,
            true,
            true,
            SurfaceAreaLookup.DEFAULT_AREAS,
            DEFAULT_RECEPTOR_CLASSES,
            DEFAULT_DIRECTIONS
    );

    public SurfaceAreaLookup surfaceAreaLookup() {
        return new SurfaceAreaLookup(surfaceAreas);
    }

    public int effectiveParallelism() {
        return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }

    /**
     * @throws ConfigurationException describing the first invalid setting found
     */
    public void validate() {
        if (!(primaryHeadroom >= 0 && primaryHeadroom < 0.5)) {
            throw new ConfigurationException("Primary headroom must be in [0, 0.5), got " + primaryHeadroom);
        }
        if (primariesToKeep < 1 && (bestKnownSubset == null || bestKnownSubset.length == 0)) {
            throw new ConfigurationException("Subset size must be at least 1, got " + primariesToKeep);
        }
        if (minSpacingNm < 0) {
            throw new ConfigurationException("Minimum spacing cannot be negative, got " + minSpacingNm);
        }
        if (filterAdjacentPrimaries && !(filterMaxSlope > 0)) {
            throw new ConfigurationException("Filter slope must be positive, got " + filterMaxSlope);
        }
        if (filterAdjacentPrimaries && filterCenterWavelengths != null) {
            int subsetSize = bestKnownSubset != null && bestKnownSubset.length > 0
                    ? bestKnownSubset.length
                    : primariesToKeep;
            if (filterCenterWavelengths.length < subsetSize - 1) {
                throw new ConfigurationException(String.format(
                        "Need %d filter centre wavelengths for %d primaries, got %d",
                        subsetSize - 1, subsetSize, filterCenterWavelengths.length));
            }
        }
        if (maxTests != null && maxTests < 1) {
            throw new ConfigurationException("Number of tests must be at least 1 (or unset), got " + maxTests);
        }
        if (!(contrastStepSize > 0)) {
            throw new ConfigurationException("Contrast step size must be positive, got " + contrastStepSize);
        }
        if (!(shrinkFactorThreshold > 0 && shrinkFactorThreshold <= 1)) {
            throw new ConfigurationException("Shrink threshold must be in (0, 1], got " + shrinkFactorThreshold);
        }
        if (parallelism < 0) {
            throw new ConfigurationException("Parallelism cannot be negative, got " + parallelism);
        }
        if (observer == null) {
            throw new ConfigurationException("Observer parameters are required");
        }
        if (backgroundMode == null || startingPolicy == null) {
            throw new ConfigurationException("Background mode and starting policy are required");
        }
        if (surfaceAreas == null || surfaceAreas.isEmpty()) {
            throw new ConfigurationException("No surface areas configured");
        }
        if (receptorClasses == null || receptorClasses.isEmpty()) {
            throw new ConfigurationException("No receptor classes configured");
        }
        observer.validate(receptorClasses.size());
        if (directions == null || directions.isEmpty()) {
            throw new ConfigurationException("No stimulus directions configured");
        }
        long distinctNames = directions.stream().map(StimulusDirection::name).distinct().count();
        if (distinctNames != directions.size()) {
            throw new ConfigurationException("Stimulus direction names must be unique");
        }
        for (StimulusDirection direction : directions) {
            direction.validate(receptorClasses.size());
        }
        if (directions.stream().noneMatch(StimulusDirection::scored)) {
            throw new ConfigurationException("At least one stimulus direction must be flagged for scoring");
        }
    }
}
