package de.anton.wespe.analyser.wespe_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes maps and cuts as plain-text files: a {@code Summary.txt} describing the reduction plus one
 * two-column {@code .dat} file per map row or per cut.
 */
public class MapAsciiExporter {

    private static final Logger logger = LoggerFactory.getLogger(MapAsciiExporter.class);

    static final String SUMMARY_FILE = "Summary.txt";
    static final String DELIMITER = "    ";
    private static final String NUMBER_FORMAT = "%.18e";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("dd.MM.yyyy_HH-mm-ss");

    /** {@code <root>/ASCII_output/<kind>/<dd.MM.yyyy_HH-mm-ss>}, created on demand. */
    public static Path timestampedDirectory(Path root, String kind) throws IOException {
        Path dir = root.resolve("ASCII_output").resolve(kind).resolve(LocalDateTime.now().format(STAMP));
        return Files.createDirectories(dir);
    }

    /**
     * Writes one file per time row of the map, named {@code <order>_<time> ps.dat} (or {@code u.dat}).
     * Rows are numbered from the end when the time axis is relative to time zero.
     *
     * @return the written data files in row order
     */
    public List<Path> exportMap(DelayEnergyMap map, String loadedRuns, Path directory) throws IOException {
        Objects.requireNonNull(map, "Map cannot be null.");
        logger.info("Starting ASCII export of map '{}' to {}", map.getName(), directory);
        Files.createDirectories(directory);

        Ordinate ordinate = map.getOrdinate();
        StringBuilder summary = new StringBuilder();
        summary.append("Loaded runs: ").append(loadedRuns).append('\n');
        summary.append("Energy step: ").append(map.getEnergyStep()).append(" eV\n");
        summary.append(ordinate.getStepLabel()).append(": ").append(map.getTimeStep())
                .append(' ').append(ordinate.getUnits()).append('\n');
        summary.append("Energy axis: ").append(map.getEnergyAxis().getLabel()).append(" (column 1)\n");
        String timeLabel = ordinate == Ordinate.MICROBUNCH
                ? TimeAxis.MICROBUNCH_ID.getLabel()
                : map.getTimeAxis().getLabel();
        summary.append("Time axis: ").append(timeLabel).append(" (file name)\n");
        summary.append("Normalized: ").append(map.isNormalized() ? "True" : "False").append('\n');
        writeText(directory.resolve(SUMMARY_FILE), summary.toString());

        double[] energy = BinningUtils.roundToStep(map.getEnergyCoordinates(), map.getEnergyStep());
        double[] time = map.getTimeCoordinates();
        int length = map.getTimeSize();
        boolean reversed = map.getTimeAxis() == TimeAxis.DELAY_RELATIVE_T0;
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            int order = reversed ? length - 1 - i : i;
            String name = String.format(Locale.ROOT, "%s_%s %s.dat", padOrder(order, length),
                    BinningUtils.roundToDecimals(time[i], 2), map.getTimeUnits());
            Path file = directory.resolve(name);
            writeColumns(file, energy, map.getRow(i));
            files.add(file);
        }
        logger.info("ASCII export of map '{}' completed successfully ({} files).", map.getName(), files.size());
        return files;
    }

    /**
     * Writes one file per cut, named {@code <order>_<pos> (d<width>) ps.dat} (or {@code u.dat}).
     * Cuts are numbered from the end when the time axis shows raw delay stage values.
     *
     * @return the written data files in cut order
     */
    public List<Path> exportCuts(MapCut cut, String loadedRuns, Path directory) throws IOException {
        Objects.requireNonNull(cut, "Cut cannot be null.");
        logger.info("Starting ASCII export of {} cuts of '{}' to {}", cut.size(), cut.getMapName(), directory);
        Files.createDirectories(directory);

        Ordinate ordinate = cut.getOrdinate();
        StringBuilder summary = new StringBuilder();
        summary.append("Loaded runs: ").append(loadedRuns).append('\n');
        summary.append("Cuts across: ").append(cut.getCutAxis().getLabel()).append('\n');
        summary.append("Cut positions: ").append(joined(cut.getPositions())).append(' ').append(cut.getPositionUnits()).append('\n');
        summary.append("Cut widths: ").append(joined(cut.getWidths())).append(' ').append(cut.getPositionUnits()).append('\n');
        summary.append("Delay-energy map parameters:\n");
        summary.append("Energy step: ").append(cut.getEnergyStep()).append(" eV\n");
        summary.append(ordinate.getStepLabel()).append(": ").append(cut.getTimeStep())
                .append(' ').append(ordinate.getUnits()).append('\n');
        summary.append("Energy axis: ").append(cut.getEnergyAxis().getLabel()).append('\n');
        summary.append("Time axis: ").append(ordinate == Ordinate.MICROBUNCH
                ? TimeAxis.MICROBUNCH_ID.getLabel() : cut.getTimeAxis().getLabel()).append('\n');
        writeText(directory.resolve(SUMMARY_FILE), summary.toString());

        double step = cut.getCutAxis() == MapAxis.ENERGY ? cut.getTimeStep() : cut.getEnergyStep();
        double[] x = BinningUtils.roundToStep(cut.getCoordinates(), step);
        int length = cut.size();
        boolean reversed = cut.getTimeAxis() == TimeAxis.DELAY_STAGE_VALUES;
        // delay indices are unitless whatever the ordinate
        String units = cut.getTimeAxis() == TimeAxis.DELAY_INDEX ? "u." : ordinate.getUnits();
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            int order = reversed ? length - 1 - i : i;
            String name = String.format(Locale.ROOT, "%s_%s (d%s) %s.dat", padOrder(order, length),
                    BinningUtils.roundToDecimals(cut.getPositions().get(i), 2),
                    BinningUtils.roundToDecimals(cut.getWidths().get(i), 2), units);
            Path file = directory.resolve(name);
            writeColumns(file, x, cut.getCut(i));
            files.add(file);
        }
        logger.info("ASCII export of cuts of '{}' completed successfully ({} files).", cut.getMapName(), files.size());
        return files;
    }

    /** Zero-pads the order to the digit count of {@code length}. */
    static String padOrder(int order, int length) {
        String text = String.valueOf(order);
        int width = String.valueOf(length).length();
        StringBuilder sb = new StringBuilder();
        for (int k = text.length(); k < width; k++) sb.append('0');
        return sb.append(text).toString();
    }

    private static String joined(List<Double> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    private static void writeText(Path file, String text) throws IOException {
        Files.writeString(file, text, StandardCharsets.UTF_8);
    }

    private static void writeColumns(Path file, double[] x, double[] y) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (int k = 0; k < x.length; k++) {
                writer.write(String.format(Locale.ROOT, NUMBER_FORMAT, x[k]));
                writer.write(DELIMITER);
                writer.write(String.format(Locale.ROOT, NUMBER_FORMAT, y[k]));
                writer.write('\n');
            }
        } catch (IOException e) {
            logger.error("Error writing data file {}", file, e);
            throw e;
        }
    }
}
