package com.flowmable.spd;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Minimal reader for comma-separated tables with one header row and numeric cells.
 */
final class NumericCsv {

    private NumericCsv() {}

    /**
     * @param header Column names, unquoted and trimmed
     * @param rows   One array per data row, same width as the header
     */
    record Table(List<String> header, List<double[]> rows) {

        int columnIndex(String name) {
            return header.indexOf(name);
        }

        double[] column(int index) {
            double[] out = new double[rows.size()];
            for (int r = 0; r < out.length; r++) {
                out[r] = rows.get(r)[index];
            }
            return out;
        }
    }

    static Table read(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<String> header = null;
        List<double[]> rows = new ArrayList<>();

        for (int n = 0; n < lines.size(); n++) {
            String line = lines.get(n);
            if (n == 0 && line.startsWith("\uFEFF")) {
                line = line.substring(1);
            }
            if (line.isBlank()) continue;

            String[] cells = line.split(",", -1);
            if (header == null) {
                header = Arrays.stream(cells).map(NumericCsv::unquote).toList();
                continue;
            }
            if (cells.length != header.size()) {
                throw new ConfigurationException(String.format("%s line %d: expected %d cells, found %d",
                        file.getFileName(), n + 1, header.size(), cells.length));
            }
            double[] row = new double[cells.length];
            for (int c = 0; c < cells.length; c++) {
                String cell = unquote(cells[c]);
                try {
                    row[c] = Double.parseDouble(cell);
                } catch (NumberFormatException e) {
                    throw new ConfigurationException(String.format("%s line %d: '%s' is not a number",
                            file.getFileName(), n + 1, cell), e);
                }
            }
            rows.add(row);
        }

        if (header == null) {
            throw new ConfigurationException(file.getFileName() + " is empty");
        }
        return new Table(header, rows);
    }

    /**
     * Wavelength support of a table whose first column holds wavelengths.
     */
    static WavelengthSupport supportOf(Table table, Path file) {
        double[] wls = table.column(0);
        if (wls.length < 2) {
            throw new ConfigurationException(file.getFileName() + " needs at least two wavelength rows");
        }
        double step = wls[1] - wls[0];
        for (int i = 2; i < wls.length; i++) {
            if (Math.abs((wls[i] - wls[i - 1]) - step) > 1e-6 * Math.abs(step)) {
                throw new ConfigurationException(String.format(
                        "%s has a non-uniform wavelength step at %.1f nm", file.getFileName(), wls[i]));
            }
        }
        return new WavelengthSupport(wls[0], step, wls.length);
    }

    private static String unquote(String cell) {
        String s = cell.trim();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            s = s.substring(1, s.length() - 1).trim();
        }
        return s;
    }
}
