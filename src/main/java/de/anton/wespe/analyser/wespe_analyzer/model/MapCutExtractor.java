package de.anton.wespe.analyser.wespe_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Extracts {@link MapCut}s from a map and resolves the cut positions a user typed in.
 */
public final class MapCutExtractor {

    private static final Logger logger = LoggerFactory.getLogger(MapCutExtractor.class);

    public static final double DEFAULT_WIDTH = 0.5;
    /** Photon energy added to the main feature for the {@code sb} keyword, in eV. */
    public static final double DEFAULT_SIDEBAND_HV = 2.407;

    private MapCutExtractor() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * One width per position. Missing widths repeat the last given one; without any width
     * every position gets {@link #DEFAULT_WIDTH}. Surplus widths are ignored.
     */
    public static List<Double> effectiveWidths(List<Double> positions, List<Double> widths) {
        List<Double> given = widths != null ? widths : Collections.emptyList();
        List<Double> result = new ArrayList<>(positions.size());
        for (int i = 0; i < positions.size(); i++) {
            if (i < given.size()) {
                result.add(given.get(i));
            } else {
                result.add(result.isEmpty() ? DEFAULT_WIDTH : result.get(i - 1));
            }
        }
        return result;
    }

    /**
     * Integrates a band of width {@code w} around every position along {@code cutAxis}.
     * A band that holds no valid value gives a zero sequence flagged as having no data.
     *
     * @param cutAxis axis the positions refer to; the sequences run along the other axis
     * @throws IllegalArgumentException if no position is given or a width is not positive
     */
    public static MapCut extract(DelayEnergyMap map, List<Double> positions, List<Double> widths,
                                 MapAxis cutAxis, Aggregation aggregation) {
        Objects.requireNonNull(map, "Map cannot be null");
        Objects.requireNonNull(cutAxis, "Cut axis cannot be null");
        Objects.requireNonNull(aggregation, "Aggregation cannot be null");
        if (positions == null || positions.isEmpty()) {
            throw new IllegalArgumentException("At least one cut position is required.");
        }
        List<Double> effective = effectiveWidths(positions, widths);
        for (Double w : effective) {
            if (w == null || !(w > 0) || Double.isInfinite(w)) {
                throw new IllegalArgumentException("Cut widths must be positive finite numbers, got " + effective);
            }
        }

        MapCut cut = new MapCut(map, cutAxis, map.getCoordinates(cutAxis.other()));
        for (int k = 0; k < positions.size(); k++) {
            double position = positions.get(k);
            double width = effective.get(k);
            DelayEnergyMap band = MapTransformer.clip(map, position - width / 2, position + width / 2, cutAxis);
            double[] values = aggregate(band, cutAxis, aggregation);
            if (ArrayStatistics.allNaN(values)) {
                logger.warn("Cut at {} (width {}) across {} of '{}' contains no data.", position, width, cutAxis, map.getName());
                cut.addSlice(position, width, new double[values.length], false);
            } else {
                cut.addSlice(position, width, values, true);
            }
        }
        logger.info("Extracted {} cut(s) across {} of '{}' ({}), positions {}.",
                positions.size(), cutAxis, map.getName(), aggregation, positions);
        return cut;
    }

    // Collapses the cut axis; lines without any valid value give NaN
    private static double[] aggregate(DelayEnergyMap band, MapAxis cutAxis, Aggregation aggregation) {
        int length = cutAxis == MapAxis.TIME ? band.getEnergySize() : band.getTimeSize();
        int lines = cutAxis == MapAxis.TIME ? band.getTimeSize() : band.getEnergySize();
        double[] result = new double[length];
        for (int k = 0; k < length; k++) {
            double[] line = new double[lines];
            for (int l = 0; l < lines; l++) {
                line[l] = cutAxis == MapAxis.TIME ? band.getValue(l, k) : band.getValue(k, l);
            }
            if (ArrayStatistics.allNaN(line)) {
                result[k] = Double.NaN;
            } else {
                result[k] = aggregation == Aggregation.SUM ? ArrayStatistics.nanSum(line) : ArrayStatistics.nanMean(line);
            }
        }
        return result;
    }

    /**
     * Parses a comma separated position field. Numbers are taken as they are; otherwise the text is handed
     * to {@link #locateFeature(DelayEnergyMap, String, MapAxis)} and yields a single position.
     */
    public static List<Double> resolvePositions(String text, DelayEnergyMap map, MapAxis cutAxis) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cut position field is empty.");
        }
        List<Double> positions = new ArrayList<>();
        try {
            for (String part : text.split(",")) {
                positions.add(Double.parseDouble(part.trim()));
            }
            return positions;
        } catch (NumberFormatException e) {
            logger.debug("Positions '{}' are not numeric, locating feature instead.", text);
            return new ArrayList<>(List.of(locateFeature(map, text, cutAxis)));
        }
    }

    /**
     * Finds a reference position along {@code cutAxis}.
     * <ul>
     *     <li>{@code main}: coordinate of the maximum of the median profile taken over the other axis</li>
     *     <li>{@code sb} or {@code sb,<hv>}: that coordinate plus hv (default {@value #DEFAULT_SIDEBAND_HV})</li>
     *     <li>a number: the number itself</li>
     * </ul>
     * The result is rounded to 2 decimals.
     */
    public static double locateFeature(DelayEnergyMap map, String request, MapAxis cutAxis) {
        String[] parts = request.split(",");
        String keyword = parts[0].trim().toLowerCase(Locale.ROOT);
        try {
            return BinningUtils.roundToDecimals(Double.parseDouble(keyword), 2);
        } catch (NumberFormatException e) {
            logger.trace("'{}' is a keyword, not a number.", keyword);
        }
        if (!keyword.equals("main") && !keyword.equals("sb")) {
            throw new IllegalArgumentException("Unknown cut position '" + request + "', use numbers, 'main' or 'sb[,hv]'.");
        }
        if (map.isDegenerate()) {
            throw new IllegalArgumentException("Cannot locate '" + request + "' on the empty map '" + map.getName() + "'.");
        }

        double[] coordinates = map.getCoordinates(cutAxis);
        double[][] values = map.getValues();
        double[] profile = new double[coordinates.length];
        for (int k = 0; k < coordinates.length; k++) {
            double[] line = cutAxis == MapAxis.ENERGY ? ArrayStatistics.column(values, k) : values[k];
            profile[k] = ArrayStatistics.median(line);
        }
        int peak = ArrayStatistics.nanArgMax(profile);
        if (peak < 0) {
            throw new IllegalArgumentException("Map '" + map.getName() + "' holds no valid value to locate '" + request + "'.");
        }
        double position = coordinates[peak];
        if (keyword.equals("sb")) {
            double hv = DEFAULT_SIDEBAND_HV;
            if (parts.length > 1) {
                try {
                    hv = Double.parseDouble(parts[1].trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Sideband photon energy must be a number: '" + parts[1] + "'", e);
                }
            }
            position += hv;
        }
        double rounded = BinningUtils.roundToDecimals(position, 2);
        logger.info("Feature '{}' located at {} on {} of '{}' (profile values {}).", request, rounded, cutAxis, map.getName(),
                profile.length <= 8 ? Arrays.toString(profile) : profile.length + " points");
        return rounded;
    }
}
