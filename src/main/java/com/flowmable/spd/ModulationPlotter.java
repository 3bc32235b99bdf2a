package com.flowmable.spd;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.CategoryPlot;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.category.LineAndShapeRenderer;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.category.DefaultCategoryDataset;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic PNGs of each direction's spectra and primary settings.
 */
public final class ModulationPlotter {

    private static final int PANEL_WIDTH = 800;
    private static final int PANEL_HEIGHT = 600;
    private static final Color BACKGROUND_GRAY = new Color(128, 128, 128);

    private ModulationPlotter() {}

    public static List<Path> writeAll(ResultSet resultSet, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();
        for (StimulusDirection direction : resultSet.directions()) {
            Path file = outputDir.resolve(direction.name() + "_PrimariesAndSPD.png");
            ImageIO.write(render(resultSet, direction), "png", file.toFile());
            written.add(file);
        }
        return written;
    }

    /**
     * Spectra on the left, primary settings on the right.
     */
    public static BufferedImage render(ResultSet resultSet, StimulusDirection direction) {
        DirectionResult result = resultSet.results().get(direction.name());
        double contrast = result.positiveContrast()[direction.primaryTarget()];

        BufferedImage image = new BufferedImage(2 * PANEL_WIDTH, PANEL_HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = image.createGraphics();
        try {
            spectraChart(resultSet.wavelengthsNm(), result, direction.name(), contrast)
                    .draw(g2, new Rectangle2D.Double(0, 0, PANEL_WIDTH, PANEL_HEIGHT));
            primaryChart(resultSet.primaryNames(), result)
                    .draw(g2, new Rectangle2D.Double(PANEL_WIDTH, 0, PANEL_WIDTH, PANEL_HEIGHT));
        } finally {
            g2.dispose();
        }
        return image;
    }

    private static JFreeChart spectraChart(double[] wavelengths, DirectionResult result, String name, double contrast) {
        XYSeriesCollection ds = new XYSeriesCollection();
        ds.addSeries(series("Positive", wavelengths, result.positiveSpd()));
        ds.addSeries(series("Negative", wavelengths, result.negativeSpd()));
        ds.addSeries(series("Background", wavelengths, result.backgroundSpd()));

        JFreeChart chart = ChartFactory.createXYLineChart(
                String.format("%s: modulation spectra [%.2f]", name, contrast),
                "Wavelength (nm)", "Power", ds, PlotOrientation.VERTICAL, true, false, false);
        XYPlot plot = chart.getXYPlot();
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
        Color[] colors = {Color.BLACK, Color.RED, BACKGROUND_GRAY};
        for (int s = 0; s < colors.length; s++) {
            renderer.setSeriesPaint(s, colors[s]);
            renderer.setSeriesStroke(s, new BasicStroke(2f));
        }
        plot.setRenderer(renderer);
        return chart;
    }

    private static JFreeChart primaryChart(List<String> names, DirectionResult result) {
        DefaultCategoryDataset ds = new DefaultCategoryDataset();
        double[] mod = result.modulationPrimary();
        double[] bg = result.backgroundPrimary();
        for (int i = 0; i < names.size(); i++) {
            ds.addValue(mod[i], "Modulation", names.get(i));
            ds.addValue(bg[i] - (mod[i] - bg[i]), "Negative", names.get(i));
            ds.addValue(bg[i], "Background", names.get(i));
        }

        JFreeChart chart = ChartFactory.createLineChart("Primary settings", "Primary", "Setting",
                ds, PlotOrientation.VERTICAL, true, false, false);
        CategoryPlot plot = chart.getCategoryPlot();
        plot.getRangeAxis().setRange(0.0, 1.0);

        LineAndShapeRenderer renderer = new LineAndShapeRenderer();
        renderer.setSeriesLinesVisible(0, false);
        renderer.setSeriesLinesVisible(1, false);
        renderer.setSeriesPaint(0, Color.BLACK);
        renderer.setSeriesPaint(1, Color.RED);
        renderer.setSeriesPaint(2, BACKGROUND_GRAY);
        renderer.setDefaultShapesVisible(true);
        plot.setRenderer(renderer);
        return chart;
    }

    private static XYSeries series(String key, double[] x, double[] y) {
        XYSeries s = new XYSeries(key);
        for (int i = 0; i < x.length; i++) {
            s.add(x[i], y[i]);
        }
        return s;
    }
}
