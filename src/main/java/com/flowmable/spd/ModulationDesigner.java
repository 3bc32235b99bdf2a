package com.flowmable.spd;

import java.util.Random;

/**
 * Designs the background and modulation for one direction on one primary matrix,
 * and derives the receptor contrasts and spectra of both modulation arms.
 */
public class ModulationDesigner {

    private final ModulationSolver solver;
    private final double[][] sensitivities;
    private final double headroom;
    private final BackgroundMode backgroundMode;
    private final StartingPolicy startingPolicy;
    private final double stepSize;
    private final double shrinkFactorThreshold;

    public ModulationDesigner(
            ModulationSolver solver,
            ReceptorSet receptors,
            double headroom,
            BackgroundMode backgroundMode,
            StartingPolicy startingPolicy,
            double stepSize,
            double shrinkFactorThreshold) {
        this.solver = solver;
        this.sensitivities = receptors.sensitivities();
        this.headroom = headroom;
        this.backgroundMode = backgroundMode;
        this.startingPolicy = startingPolicy;
        this.stepSize = stepSize;
        this.shrinkFactorThreshold = shrinkFactorThreshold;
    }

    public static ModulationDesigner from(SearchConfig config, ModulationSolver solver, ReceptorSet receptors) {
        return new ModulationDesigner(solver, receptors,
                config.primaryHeadroom(),
                config.backgroundMode(),
                config.startingPolicy(),
                config.contrastStepSize(),
                config.shrinkFactorThreshold());
    }

    /**
     * Background settings for primaries with the given measured total powers.
     * <p>
     * Power weighting: {@code j = p / max(p)}, centred on its mean and halved;
     * the background is {@code 0.5 - j}, so brighter primaries sit lower.
     */
    public static double[] background(BackgroundMode mode, double[] totalPowerMw) {
        int n = totalPowerMw.length;
        if (mode == BackgroundMode.UNIFORM) {
            return SpectralMath.filled(n, 0.5);
        }

        double max = Double.NEGATIVE_INFINITY;
        for (double p : totalPowerMw) {
            max = Math.max(max, p);
        }
        if (!(max > 0)) {
            throw new ConfigurationException("Power-weighted background needs positive primary powers");
        }
        double[] j = new double[n];
        double mean = 0;
        for (int i = 0; i < n; i++) {
            j[i] = totalPowerMw[i] / max;
            mean += j[i];
        }
        mean /= n;

        double[] bg = new double[n];
        for (int i = 0; i < n; i++) {
            bg[i] = 0.5 - (j[i] - mean) / 2.0;
        }
        return bg;
    }

    public double[] startingVector(double[] background, Random random) {
        switch (startingPolicy) {
            case ONES:
                return SpectralMath.filled(background.length, 1.0);
            case RANDOM: {
                double[] x0 = new double[background.length];
                for (int i = 0; i < x0.length; i++) {
                    x0[i] = random.nextDouble();
                }
                return x0;
            }
            case BACKGROUND:
            default:
                return background.clone();
        }
    }

    /**
     * @param b            Wavelength × primary matrix of the subset (already filtered)
     * @param totalPowerMw Measured power of each subset primary, for the background
     * @param direction    Direction to design
     * @param random       Used only by the random starting policy
     */
    public DirectionResult design(double[][] b, double[] totalPowerMw, StimulusDirection direction, Random random) {
        int nWavelengths = b.length;
        double[] bg = background(backgroundMode, totalPowerMw);
        double[] ambient = new double[nWavelengths];

        ModulationRequest request = new ModulationRequest(
                b,
                bg,
                startingVector(bg, random),
                ambient,
                sensitivities,
                direction.targets(),
                direction.ignored(),
                direction.minimized(),
                new int[0],
                headroom,
                direction.desiredContrastPerTarget(),
                direction.contrastGroups(),
                direction.maxContrastDifference(),
                stepSize,
                shrinkFactorThreshold);

        ModulationSolution solution = solver.solve(request);
        double[] modulation = solution.primary();

        double[] backgroundSpd = SpectralMath.apply(b, bg);
        double[] backgroundExcitation = SpectralMath.apply(sensitivities, backgroundSpd);

        double[] delta = SpectralMath.subtract(modulation, bg);
        double[] positiveContrast = SpectralMath.divide(
                SpectralMath.apply(sensitivities, SpectralMath.apply(b, delta)), backgroundExcitation);
        double[] negativeContrast = SpectralMath.divide(
                SpectralMath.apply(sensitivities, SpectralMath.apply(b, SpectralMath.negate(delta))), backgroundExcitation);

        double[] positiveSpd = SpectralMath.apply(b, modulation);
        double[] negativeSpd = SpectralMath.apply(b, SpectralMath.subtract(bg, delta));

        return new DirectionResult(
                direction.name(),
                bg,
                backgroundSpd,
                modulation,
                positiveContrast,
                negativeContrast,
                positiveSpd,
                negativeSpd,
                solution.contrastScale(),
                solution.differentialConstraintMet());
    }
}
