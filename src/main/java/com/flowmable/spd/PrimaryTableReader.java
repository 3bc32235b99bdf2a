package com.flowmable.spd;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;

/**
 * Loads the raw primary SPD table and the matching total-power table.
 * <p>
 * SPD table: header {@code Wavelength,<name>,...}, one row per wavelength sample.
 * Power table: header of primary names, a single row of milliwatt values.
 */
public final class PrimaryTableReader {

    private PrimaryTableReader() {}

    public static PrimaryTable read(Path spdFile, Path powerFile) throws IOException {
        NumericCsv.Table spdTable = NumericCsv.read(spdFile);
        NumericCsv.Table powerTable = NumericCsv.read(powerFile);

        WavelengthSupport support = NumericCsv.supportOf(spdTable, spdFile);
        List<String> names = spdTable.header().subList(1, spdTable.header().size());
        if (names.isEmpty()) {
            throw new ConfigurationException(spdFile.getFileName() + " lists no primaries");
        }
        if (new HashSet<>(names).size() != names.size()) {
            throw new ConfigurationException(spdFile.getFileName() + " repeats a primary name");
        }
        if (powerTable.rows().size() != 1) {
            throw new ConfigurationException(String.format("%s must hold exactly one row of powers, found %d",
                    powerFile.getFileName(), powerTable.rows().size()));
        }
        if (!new HashSet<>(names).equals(new HashSet<>(powerTable.header()))) {
            throw new ConfigurationException(String.format("Primary names differ between %s and %s",
                    spdFile.getFileName(), powerFile.getFileName()));
        }

        double[][] spds = new double[names.size()][];
        double[] powers = new double[names.size()];
        double[] powerRow = powerTable.rows().get(0);
        for (int p = 0; p < names.size(); p++) {
            spds[p] = spdTable.column(p + 1);
            powers[p] = powerRow[powerTable.columnIndex(names.get(p))];
        }
        return new PrimaryTable(support, List.copyOf(names), spds, powers);
    }
}
