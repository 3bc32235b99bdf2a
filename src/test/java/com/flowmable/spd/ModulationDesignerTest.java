package com.flowmable.spd;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ModulationDesignerTest {

    private static final ReceptorSet RECEPTORS = SyntheticSpectra.defaultReceptors();

    private static double[][] subsetMatrix() {
        return SyntheticSpectra.primaries(new double[]{430, 480, 530, 590, 640}, new double[]{5, 8, 13, 9, 20})
                .matrixFor(new int[]{0, 1, 2, 3, 4});
    }

    private static ModulationDesigner designer(ModulationSolver solver, BackgroundMode mode, StartingPolicy policy) {
        return new ModulationDesigner(solver, RECEPTORS, 0.05, mode, policy, 0.025, 0.5);
    }

    @Test
    void equalPowersGiveUniformBackground() {
        double[] bg = ModulationDesigner.background(BackgroundMode.POWER_WEIGHTED, new double[]{10, 10, 10});
        assertArrayEquals(new double[]{0.5, 0.5, 0.5}, bg, 1e-15);
    }

    @Test
    void brighterPrimarySitsLowerAndMeanStaysHalf() {
        double[] bg = ModulationDesigner.background(BackgroundMode.POWER_WEIGHTED, new double[]{20, 10});
        assertArrayEquals(new double[]{0.375, 0.625}, bg, 1e-15);

        double[] spread = ModulationDesigner.background(BackgroundMode.POWER_WEIGHTED, new double[]{3, 40, 7, 12});
        double mean = 0;
        for (double v : spread) mean += v;
        assertEquals(0.5, mean / spread.length, 1e-12);
        assertTrue(spread[1] < spread[0]);
    }

    @Test
    void uniformBackgroundIgnoresPower() {
        assertArrayEquals(new double[]{0.5, 0.5}, ModulationDesigner.background(BackgroundMode.UNIFORM, new double[]{1, 99}));
    }

    @Test
    void startingVectorFollowsPolicy() {
        double[] bg = {0.4, 0.6};
        assertArrayEquals(bg, designer(null, BackgroundMode.UNIFORM, StartingPolicy.BACKGROUND).startingVector(bg, new Random(1)));
        assertArrayEquals(new double[]{1, 1}, designer(null, BackgroundMode.UNIFORM, StartingPolicy.ONES).startingVector(bg, new Random(1)));

        double[] random = designer(null, BackgroundMode.UNIFORM, StartingPolicy.RANDOM).startingVector(bg, new Random(3));
        Random expected = new Random(3);
        assertEquals(expected.nextDouble(), random[0]);
        assertEquals(expected.nextDouble(), random[1]);
    }

    @Test
    void requestCarriesDirectionAndNoAmbient() {
        AtomicReference<ModulationRequest> seen = new AtomicReference<>();
        ModulationSolver capture = request -> {
            seen.set(request);
            return new ModulationSolution(request.background().clone(), 1.0, true, 1);
        };
        StimulusDirection lms = SearchConfig.DEFAULT_DIRECTIONS.get(0);

        designer(capture, BackgroundMode.UNIFORM, StartingPolicy.BACKGROUND)
                .design(subsetMatrix(), new double[]{5, 8, 13, 9, 20}, lms, new Random(0));

        ModulationRequest req = seen.get();
        assertArrayEquals(new int[]{3, 4, 5}, req.targets());
        assertArrayEquals(new int[]{0, 1, 2}, req.ignored());
        assertEquals(0, req.pinned().length);
        assertEquals(0.05, req.headroom());
        assertEquals(0.015, req.maxContrastDifference());
        for (double a : req.ambientSpd()) {
            assertEquals(0.0, a);
        }
    }

    @Test
    void singleDesiredContrastIsExpandedToEveryTarget() {
        AtomicReference<ModulationRequest> seen = new AtomicReference<>();
        ModulationSolver capture = request -> {
            seen.set(request);
            return new ModulationSolution(request.background().clone(), 1.0, true, 1);
        };
        StimulusDirection direction = new StimulusDirection("LM", new int[]{0, 1}, null, null,
                new double[]{0.3}, null, 0, true);

        designer(capture, BackgroundMode.UNIFORM, StartingPolicy.BACKGROUND)
                .design(subsetMatrix(), new double[]{1, 1, 1, 1, 1}, direction, new Random(0));

        assertArrayEquals(new double[]{0.3, 0.3}, seen.get().desiredContrast());
    }

    @Test
    void negativeArmMirrorsPositiveArm() {
        ModulationSolver nudge = request -> {
            double[] x = request.background().clone();
            x[0] += 0.2;
            x[3] -= 0.1;
            return new ModulationSolution(x, 0.8, false, 3);
        };
        double[][] b = subsetMatrix();

        DirectionResult result = designer(nudge, BackgroundMode.UNIFORM, StartingPolicy.BACKGROUND)
                .design(b, new double[]{1, 1, 1, 1, 1}, SearchConfig.DEFAULT_DIRECTIONS.get(3), new Random(0));

        assertEquals("Mel", result.direction());
        assertEquals(0.8, result.contrastScale());
        assertFalse(result.differentialConstraintMet());
        for (int r = 0; r < RECEPTORS.size(); r++) {
            assertEquals(-result.positiveContrast()[r], result.negativeContrast()[r], 1e-12);
        }
        for (int w = 0; w < b.length; w++) {
            assertEquals(2 * result.backgroundSpd()[w], result.positiveSpd()[w] + result.negativeSpd()[w], 1e-9);
        }

        double[] bgExcitation = SpectralMath.apply(RECEPTORS.sensitivities(), result.backgroundSpd());
        double[] posExcitation = SpectralMath.apply(RECEPTORS.sensitivities(), result.positiveSpd());
        for (int r = 0; r < RECEPTORS.size(); r++) {
            assertEquals((posExcitation[r] - bgExcitation[r]) / bgExcitation[r], result.positiveContrast()[r], 1e-9);
        }
    }

    @Test
    void designsWithTheLinearSolver() {
        ModulationDesigner designer = designer(new ShrinkingContrastSolver(), BackgroundMode.UNIFORM, StartingPolicy.BACKGROUND);
        StimulusDirection mel = new StimulusDirection("Mel", new int[]{6}, new int[]{0, 1, 2}, null,
                new double[]{0.2}, List.of(), 0, true);

        DirectionResult result = designer.design(subsetMatrix(), new double[]{1, 1, 1, 1, 1}, mel, new Random(0));

        assertTrue(result.positiveContrast()[6] > 0);
        for (int r = 3; r <= 5; r++) {
            assertEquals(0.0, result.positiveContrast()[r], 1e-5, "Receptor " + r + " should be silenced");
        }
    }
}
