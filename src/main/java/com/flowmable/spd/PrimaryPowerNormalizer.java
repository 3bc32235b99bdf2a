package com.flowmable.spd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rescales each raw primary curve to its measured absolute power.
 * <p>
 * Negative samples (measurement noise) are clamped to zero before the sum is
 * taken, so that after scaling {@code sum(curve) * step == totalPower * surfaceArea}
 * holds for the curve actually stored. The wavelength of the curve maximum is
 * recorded as the peak.
 */
public final class PrimaryPowerNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(PrimaryPowerNormalizer.class);

    private PrimaryPowerNormalizer() {}

    public static NormalizedPrimaries normalize(PrimaryTable table, SurfaceAreaLookup areas) {
        WavelengthSupport support = table.support();
        List<Primary> primaries = new ArrayList<>(table.size());

        for (int p = 0; p < table.size(); p++) {
            String name = table.names().get(p);
            double surfaceArea = areas.areaFor(name);
            double totalPower = table.totalPowerMw()[p];
            double[] raw = table.spds()[p];

            double sum = 0;
            for (double v : raw) {
                sum += Math.max(0.0, v);
            }
            if (sum <= 0) {
                throw new ConfigurationException("Primary " + name + " has no positive spectral power");
            }

            double scale = (totalPower * surfaceArea) / (support.stepNm() * sum);
            double[] spd = new double[raw.length];
            int peakIdx = 0;
            for (int w = 0; w < raw.length; w++) {
                spd[w] = Math.max(0.0, raw[w]) * scale;
                if (spd[w] > spd[peakIdx]) {
                    peakIdx = w;
                }
            }

            double peak = support.wavelengthAt(peakIdx);
            logger.debug("Primary {}: area={} mm², power={} mW, peak={} nm", name, surfaceArea, totalPower, peak);
            primaries.add(new Primary(name, spd, totalPower, surfaceArea, peak));
        }
        return new NormalizedPrimaries(support, primaries);
    }
}
