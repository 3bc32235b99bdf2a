package com.flowmable.spd;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end searches over a small synthetic pool.
 */
class PrimarySetSearchTest {

    private static final double[] PEAKS = {410, 450, 490, 530, 570, 620};
    private static final double[] POWERS = {4, 9, 6, 12, 8, 15};

    private static final NormalizedPrimaries POOL = SyntheticSpectra.primaries(PEAKS, POWERS);
    private static final ReceptorSet RECEPTORS = SyntheticSpectra.defaultReceptors();

    private static SearchConfig variant(SearchConfig c, int[] explicitSubset, boolean filter) {
        return new SearchConfig(
                c.outputDir(), c.spdFile(), c.powerFile(), c.sensitivityFile(),
                c.primaryHeadroom(), c.observer(),
                c.primariesToKeep(), c.minSpacingNm(), c.backgroundMode(),
                filter, c.filterMaxSlope(),
                explicitSubset, c.filterCenterWavelengths(), c.maxTests(),
                c.contrastStepSize(), c.shrinkFactorThreshold(), c.startingPolicy(),
                c.randomSeed(), c.parallelism(), c.verbose(), c.makePlots(),
                c.surfaceAreas(), c.receptorClasses(), c.directions());
    }

    @Test
    void searchTestsEverySurvivingSubsetAndPicksTheMinimum() {
        SearchOutcome outcome = new PrimarySetSearch(SyntheticSpectra.testConfig(5, null, 2, 7L))
                .run(POOL, RECEPTORS);

        assertEquals(6, outcome.testedSubsets().size());
        assertEquals(6, outcome.worstShortfall().length);
        assertEquals(7L, outcome.seed());
        for (double score : outcome.worstShortfall()) {
            if (!Double.isNaN(score)) {
                assertTrue(outcome.bestScore() <= score);
            }
        }
        assertArrayEquals(outcome.testedSubsets().get(outcome.bestIndex()), outcome.best().subset());
    }

    @Test
    void winnerBundleIsComplete() {
        SearchConfig config = SyntheticSpectra.testConfig(5, null, 2, 7L);
        SearchOutcome outcome = new PrimarySetSearch(config).run(POOL, RECEPTORS);
        SubsetTrial best = outcome.best();

        List<String> names = new ArrayList<>(best.directions().keySet());
        assertEquals(List.of("LMS", "LminusM", "S", "Mel", "SnoMel"), names);
        assertEquals(4, best.crossoverWavelengthsNm().length);
        assertEquals(5, best.names().size());
        assertEquals(outcome.bestScore(), OutcomeScorer.worstShortfall(best, config.directions()), 0.0);

        for (int w = 0; w < best.matrix().length; w++) {
            for (int c = 0; c < 5; c++) {
                assertTrue(best.matrix()[w][c] <= best.preFilterMatrix()[w][c] + 1e-12);
            }
        }
        for (DirectionResult r : best.directions().values()) {
            for (double x : r.modulationPrimary()) {
                assertTrue(x >= 0.05 - 1e-12 && x <= 0.95 + 1e-12);
            }
        }
    }

    @Test
    void sameSeedReproducesTheSearch() {
        SearchOutcome a = new PrimarySetSearch(SyntheticSpectra.testConfig(5, 4, 1, 11L)).run(POOL, RECEPTORS);
        SearchOutcome b = new PrimarySetSearch(SyntheticSpectra.testConfig(5, 4, 1, 11L)).run(POOL, RECEPTORS);

        assertEquals(4, a.testedSubsets().size());
        for (int i = 0; i < 4; i++) {
            assertArrayEquals(a.testedSubsets().get(i), b.testedSubsets().get(i));
        }
        assertArrayEquals(a.worstShortfall(), b.worstShortfall());
        assertArrayEquals(a.best().subset(), b.best().subset());
        for (int w = 0; w < a.best().matrix().length; w++) {
            assertArrayEquals(a.best().matrix()[w], b.best().matrix()[w]);
        }
        for (String direction : a.best().directions().keySet()) {
            assertArrayEquals(a.best().directions().get(direction).positiveContrast(),
                    b.best().directions().get(direction).positiveContrast());
        }
    }

    @Test
    void parallelAndSerialSearchesAgree() {
        SearchOutcome serial = new PrimarySetSearch(SyntheticSpectra.testConfig(4, null, 1, 3L)).run(POOL, RECEPTORS);
        SearchOutcome parallel = new PrimarySetSearch(SyntheticSpectra.testConfig(4, null, 4, 3L)).run(POOL, RECEPTORS);

        assertArrayEquals(serial.worstShortfall(), parallel.worstShortfall());
        assertEquals(serial.bestIndex(), parallel.bestIndex());
    }

    @Test
    void explicitSubsetIsTheOnlyTrial() {
        SearchConfig config = variant(SyntheticSpectra.testConfig(5, null, 2, 1L), new int[]{4, 0, 2}, true);

        SearchOutcome outcome = new PrimarySetSearch(config).run(POOL, RECEPTORS);

        assertEquals(1, outcome.testedSubsets().size());
        assertArrayEquals(new int[]{4, 0, 2}, outcome.best().subset());
        assertEquals(POOL.get(4).name(), outcome.best().names().get(0));
    }

    @Test
    void disabledFilterLeavesMatrixUntouched() {
        SearchConfig config = variant(SyntheticSpectra.testConfig(3, 2, 1, 5L), null, false);

        SubsetTrial best = new PrimarySetSearch(config).run(POOL, RECEPTORS).best();

        assertEquals(0, best.crossoverWavelengthsNm().length);
        for (int w = 0; w < best.matrix().length; w++) {
            assertArrayEquals(best.preFilterMatrix()[w], best.matrix()[w]);
        }
    }

    @Test
    void receptorCountMustMatchConfiguration() {
        ReceptorSet three = new ReceptorSet(List.of("L", "M", "S"), new double[][]{
                SyntheticSpectra.gaussian(SyntheticSpectra.SUPPORT, 560, 45),
                SyntheticSpectra.gaussian(SyntheticSpectra.SUPPORT, 530, 45),
                SyntheticSpectra.gaussian(SyntheticSpectra.SUPPORT, 440, 45)});

        assertThrows(ConfigurationException.class,
                () -> new PrimarySetSearch(SyntheticSpectra.testConfig(5, null, 1, 1L)).run(POOL, three));
    }

    @Test
    void subsetThatCannotExciteATargetScoresWorseWithoutAbortingTheSearch() {
        // Melanopsin only sees 390-420 nm, where only the 400 nm primary emits
        PrimaryTable table = SyntheticSpectra.primaryTable(new double[]{400, 480, 540, 600}, new double[]{5, 5, 5, 5});
        WavelengthSupport support = table.support();
        for (int p = 1; p < table.size(); p++) {
            for (int w = 0; support.wavelengthAt(w) < 430; w++) {
                table.spds()[p][w] = 0;
            }
        }
        NormalizedPrimaries pool = PrimaryPowerNormalizer.normalize(table, SurfaceAreaLookup.defaults());

        double[][] rows = SyntheticSpectra.defaultReceptors().sensitivities();
        double[] narrowMel = new double[support.count()];
        for (int w = 0; w < narrowMel.length; w++) {
            double wl = support.wavelengthAt(w);
            narrowMel[w] = wl >= 390 && wl <= 420 ? 1.0 : 0.0;
        }
        rows[6] = narrowMel;
        ReceptorSet receptors = new ReceptorSet(SearchConfig.DEFAULT_RECEPTOR_CLASSES, rows);

        SearchOutcome outcome = assertDoesNotThrow(
                () -> new PrimarySetSearch(SyntheticSpectra.testConfig(3, null, 2, 3L)).run(pool, receptors));

        assertEquals(4, outcome.testedSubsets().size());
        int blind = -1;
        for (int i = 0; i < outcome.testedSubsets().size(); i++) {
            if (outcome.testedSubsets().get(i)[0] != 0) blind = i;
        }
        assertTrue(blind >= 0);
        assertTrue(Double.isNaN(outcome.worstShortfall()[blind]));
        assertNotEquals(blind, outcome.bestIndex());
        assertEquals(0, outcome.best().subset()[0]);
        assertFalse(Double.isNaN(outcome.bestScore()));
    }

    @Test
    void failingTrialAbortsTheSearch() {
        ModulationSolver broken = request -> {
            throw new IllegalArgumentException("singular");
        };

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new PrimarySetSearch(SyntheticSpectra.testConfig(5, null, 2, 1L), broken).run(POOL, RECEPTORS));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }
}
