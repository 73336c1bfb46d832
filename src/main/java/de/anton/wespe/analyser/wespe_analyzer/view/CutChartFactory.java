package de.anton.wespe.analyser.wespe_analyzer.view;

import de.anton.wespe.analyser.wespe_analyzer.model.EnergyAxis;
import de.anton.wespe.analyser.wespe_analyzer.model.MapAxis;
import de.anton.wespe.analyser.wespe_analyzer.model.MapCut;
import de.anton.wespe.analyser.wespe_analyzer.model.PeakFitResult;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.ui.RectangleInsets;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Builds line charts of map cuts: one series per cut with data, the difference series and the fitted
 * peak curve. Charts are created headless and written as PNG.
 */
public class CutChartFactory {

    private static final Logger logger = LoggerFactory.getLogger(CutChartFactory.class);

    private static final Color[] SERIES_COLORS = { new Color(31, 119, 180), new Color(255, 127, 14), new Color(44, 160, 44), new Color(214, 39, 40), new Color(148, 103, 189), new Color(140, 86, 75), new Color(227, 119, 194), new Color(127, 127, 127), new Color(188, 189, 34), new Color(23, 190, 207) };
    private static final Color FIT_COLOR = Color.BLACK;
    private static final BasicStroke LINE_STROKE = new BasicStroke(1.5f);
    private static final BasicStroke DIFFERENCE_STROKE = new BasicStroke(1.5f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER,
            10.0f, new float[]{6.0f, 4.0f}, 0.0f);

    static final int DEFAULT_WIDTH = 900;
    static final int DEFAULT_HEIGHT = 600;

    /**
     * Dataset in display order: cuts with data, difference sequences, fit curve.
     * Cuts flagged as having no data are left out.
     */
    public XYSeriesCollection createDataset(MapCut cut) {
        Objects.requireNonNull(cut, "Cut cannot be null.");
        XYSeriesCollection dataset = new XYSeriesCollection();
        double[] x = cut.getCoordinates();
        for (int i = 0; i < cut.size(); i++) {
            if (!cut.hasData(i)) {
                logger.debug("Cut {} of '{}' has no data, not plotted.", i + 1, cut.getMapName());
                continue;
            }
            dataset.addSeries(toSeries(cut.getLabel(i), x, cut.getCut(i)));
        }
        for (int i = 0; i < cut.getDifferenceCuts().size(); i++) {
            dataset.addSeries(toSeries(cut.getDifferenceLabels().get(i), x, cut.getDifferenceCuts().get(i)));
        }
        if (cut.hasFit()) {
            PeakFitResult fit = cut.getFit();
            dataset.addSeries(toSeries(fit.toLabel(cut.getCoordinateVariableName(), cut.getCoordinateUnits()),
                    fit.getXFit(), fit.getYFit()));
        }
        return dataset;
    }

    private XYSeries toSeries(String key, double[] x, double[] y) {
        XYSeries series = new XYSeries(key, false, true);
        for (int k = 0; k < x.length; k++) {
            if (!Double.isNaN(y[k])) {
                series.add(x[k], y[k]);
            }
        }
        return series;
    }

    public JFreeChart createChart(MapCut cut, String title) {
        XYSeriesCollection dataset = createDataset(cut);
        String xLabel = (cut.getCutAxis() == MapAxis.TIME ? cut.getEnergyAxis().getLabel() : cut.getTimeAxis().getLabel())
                + ", " + cut.getCoordinateUnits();
        String yLabel = cut.isArbitraryUnits() ? "Intensity, arb. units" : "Intensity, counts";

        JFreeChart chart = ChartFactory.createXYLineChart(title, xLabel, yLabel, dataset,
                PlotOrientation.VERTICAL, true, false, false);
        XYPlot plot = (XYPlot) chart.getPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        plot.setAxisOffset(new RectangleInsets(5.0, 5.0, 5.0, 5.0));

        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
        int cutsShown = (int) IntStream.range(0, cut.size()).filter(cut::hasData).count();
        int differences = cut.getDifferenceCuts().size();
        for (int s = 0; s < dataset.getSeriesCount(); s++) {
            boolean isFit = cut.hasFit() && s == dataset.getSeriesCount() - 1;
            renderer.setSeriesPaint(s, isFit ? FIT_COLOR : SERIES_COLORS[s % SERIES_COLORS.length]);
            renderer.setSeriesStroke(s, s >= cutsShown && s < cutsShown + differences ? DIFFERENCE_STROKE : LINE_STROKE);
        }
        plot.setRenderer(renderer);

        NumberAxis domainAxis = (NumberAxis) plot.getDomainAxis();
        domainAxis.setAutoRangeIncludesZero(false);
        // Binding energy is plotted decreasing from left to right
        if (cut.getCutAxis() == MapAxis.TIME && cut.getEnergyAxis() == EnergyAxis.BINDING) {
            domainAxis.setInverted(true);
        }
        NumberAxis rangeAxis = (NumberAxis) plot.getRangeAxis();
        rangeAxis.setAutoRangeIncludesZero(false);

        logger.debug("Chart '{}' created with {} series.", title, dataset.getSeriesCount());
        return chart;
    }

    /** Writes the chart of {@code cut} as PNG. */
    public Path saveAsPng(MapCut cut, String title, Path file) throws IOException {
        return saveAsPng(createChart(cut, title), file, DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    public Path saveAsPng(JFreeChart chart, Path file, int width, int height) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            ChartUtils.saveChartAsPNG(file.toFile(), chart, width, height);
            logger.info("Chart saved to {}", file);
            return file;
        } catch (IOException e) {
            logger.error("Could not save chart to {}", file, e);
            throw e;
        }
    }
}
