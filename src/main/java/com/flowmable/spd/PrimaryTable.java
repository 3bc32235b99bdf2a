package com.flowmable.spd;

import java.util.List;

/**
 * Raw primary data as loaded from the SPD and total-power tables.
 *
 * @param support       Wavelength sampling of every curve
 * @param names         Primary names, in table column order
 * @param spds          Raw curves, {@code spds[p][w]} for primary p and sample w
 * @param totalPowerMw  Measured total power per primary, same order as {@code names}
 */
public record PrimaryTable(
        WavelengthSupport support,
        List<String> names,
        double[][] spds,
        double[] totalPowerMw
) {

    public PrimaryTable {
        if (names.size() != spds.length || names.size() != totalPowerMw.length) {
            throw new ConfigurationException(String.format(
                    "Primary table is inconsistent: %d names, %d curves, %d powers",
                    names.size(), spds.length, totalPowerMw.length));
        }
        for (int p = 0; p < spds.length; p++) {
            if (spds[p].length != support.count()) {
                throw new ConfigurationException(String.format(
                        "Curve for %s has %d samples, wavelength support has %d",
                        names.get(p), spds[p].length, support.count()));
            }
        }
    }

    public int size() {
        return names.size();
    }
}
