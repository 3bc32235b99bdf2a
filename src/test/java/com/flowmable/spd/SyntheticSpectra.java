package com.flowmable.spd;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Gaussian primaries and receptor sensitivities shared by the tests.
 */
final class SyntheticSpectra {

    static final WavelengthSupport SUPPORT = new WavelengthSupport(380, 1, 401);

    /** Peaks roughly where the seven default receptor classes sit. */
    static final double[] RECEPTOR_PEAKS = {566, 541, 442, 560, 535, 437, 480};

    private SyntheticSpectra() {}

    static double[] gaussian(WavelengthSupport support, double peakNm, double sigmaNm) {
        double[] out = new double[support.count()];
        for (int w = 0; w < out.length; w++) {
            double d = (support.wavelengthAt(w) - peakNm) / sigmaNm;
            out[w] = Math.exp(-0.5 * d * d);
        }
        return out;
    }

    static double[] flat(WavelengthSupport support, double value) {
        return SpectralMath.filled(support.count(), value);
    }

    static PrimaryTable primaryTable(double[] peaks, double[] powers) {
        List<String> names = new ArrayList<>();
        double[][] spds = new double[peaks.length][];
        for (int p = 0; p < peaks.length; p++) {
            names.add(String.format("UHP-%d-%s", (int) peaks[p], p % 2 == 0 ? "EP" : "SR"));
            spds[p] = gaussian(SUPPORT, peaks[p], 12);
        }
        return new PrimaryTable(SUPPORT, names, spds, powers.clone());
    }

    static NormalizedPrimaries primaries(double[] peaks, double[] powers) {
        return PrimaryPowerNormalizer.normalize(primaryTable(peaks, powers), SurfaceAreaLookup.defaults());
    }

    static ReceptorSet defaultReceptors() {
        double[][] rows = new double[RECEPTOR_PEAKS.length][];
        for (int r = 0; r < rows.length; r++) {
            rows[r] = gaussian(SUPPORT, RECEPTOR_PEAKS[r], 45);
        }
        return new ReceptorSet(SearchConfig.DEFAULT_RECEPTOR_CLASSES, rows);
    }

    /**
     * Default configuration trimmed for fast, reproducible test runs.
     */
    static SearchConfig testConfig(int subsetSize, Integer maxTests, int parallelism, long seed) {
        SearchConfig d = SearchConfig.DEFAULT;
        return new SearchConfig(
                d.outputDir(), d.spdFile(), d.powerFile(), d.sensitivityFile(),
                d.primaryHeadroom(), d.observer(),
                subsetSize, d.minSpacingNm(), d.backgroundMode(),
                d.filterAdjacentPrimaries(), d.filterMaxSlope(),
                null, null, maxTests,
                0.1, d.shrinkFactorThreshold(), d.startingPolicy(),
                seed, parallelism, false, false,
                d.surfaceAreas(), d.receptorClasses(), d.directions());
    }

    /**
     * Writes SPD, power and sensitivity tables in the on-disk CSV layout.
     */
    static void writeTables(Path dir, String spdFile, String powerFile, String sensitivityFile,
                            double[] peaks, double[] powers) throws IOException {
        PrimaryTable table = primaryTable(peaks, powers);
        ReceptorSet receptors = defaultReceptors();
        double[] wls = SUPPORT.wavelengths();

        StringBuilder spd = new StringBuilder("Wavelength,").append(String.join(",", table.names())).append('\n');
        StringBuilder sens = new StringBuilder("Wavelength,")
                .append(String.join(",", receptors.classNames())).append('\n');
        for (int w = 0; w < wls.length; w++) {
            spd.append(wls[w]);
            for (double[] curve : table.spds()) spd.append(',').append(curve[w]);
            spd.append('\n');
            sens.append(wls[w]);
            for (double[] row : receptors.sensitivities()) sens.append(',').append(row[w]);
            sens.append('\n');
        }

        StringBuilder power = new StringBuilder(String.join(",", table.names())).append('\n');
        for (int p = 0; p < powers.length; p++) {
            if (p > 0) power.append(',');
            power.append(powers[p]);
        }
        power.append('\n');

        Files.writeString(dir.resolve(spdFile), spd);
        Files.writeString(dir.resolve(powerFile), power);
        Files.writeString(dir.resolve(sensitivityFile), sens);
    }
}
