package com.flowmable.spd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Sensitivities precomputed for a fixed observer and stored as a CSV table
 * ({@code Wavelength,<class>,...}). Observer parameters are recorded but not applied.
 */
public class TabulatedSensitivityProvider implements ReceptorSensitivityProvider {

    private static final Logger logger = LoggerFactory.getLogger(TabulatedSensitivityProvider.class);

    private final Path file;
    private final NumericCsv.Table table;
    private final WavelengthSupport tableSupport;

    public TabulatedSensitivityProvider(Path file) throws IOException {
        this.file = file;
        this.table = NumericCsv.read(file);
        this.tableSupport = NumericCsv.supportOf(table, file);
    }

    @Override
    public ReceptorSet sensitivities(WavelengthSupport support, List<String> classNames, ObserverParameters observer) {
        if (!sameSupport(support, tableSupport)) {
            throw new ConfigurationException(String.format(
                    "%s is sampled as %s, primaries as %s", file.getFileName(), tableSupport, support));
        }
        double[][] rows = new double[classNames.size()][];
        for (int r = 0; r < rows.length; r++) {
            int col = table.columnIndex(classNames.get(r));
            if (col < 1) {
                throw new ConfigurationException("No sensitivity column for receptor class " + classNames.get(r)
                        + " in " + file.getFileName());
            }
            rows[r] = table.column(col);
        }
        logger.info("Loaded {} receptor sensitivities from {} (tabulated; requested field {} deg, age {} y, pupil {} mm)",
                classNames.size(), file.getFileName(),
                observer.fieldSizeDegrees(), observer.ageYears(), observer.pupilDiameterMm());
        if (observer.fractionBleached() != null || observer.oxygenationFraction() != null
                || observer.vesselThicknessUm() != null) {
            logger.warn("Bleaching and vessel parameters are not applied to tabulated sensitivities");
        }
        return new ReceptorSet(classNames, rows);
    }

    private static boolean sameSupport(WavelengthSupport a, WavelengthSupport b) {
        return a.count() == b.count()
                && Math.abs(a.startNm() - b.startNm()) < 1e-6
                && Math.abs(a.stepNm() - b.stepNm()) < 1e-6;
    }
}
