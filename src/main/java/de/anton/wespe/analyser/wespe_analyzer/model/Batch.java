package de.anton.wespe.analyser.wespe_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * An ordered list of loaded runs that are reduced together, plus the summary checks shown before the
 * reduction (static/delay mix, energy region, monochromator energy) and the combined map once built.
 */
public class Batch {

    private static final Logger logger = LoggerFactory.getLogger(Batch.class);

    static final int RANGE_DISPLAY_THRESHOLD = 6;
    static final double REGION_TOLERANCE_EV = 5.0;
    static final double MONO_TOLERANCE_EV = 0.15;
    static final double THRESHOLD_MARGIN_EV = 50.0;
    static final double THRESHOLD_FALLBACK_EV = 1000.0;

    private static final String RUNS_PREFIX = "Uploaded runs: ";

    private final List<Run> runs;
    private DelayEnergyMap combinedMap;   // null until reduced
    private DelayEnergyMap differenceMap; // null unless requested

    public Batch(List<Run> runs) {
        if (runs == null || runs.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one run.");
        }
        this.runs = Collections.unmodifiableList(new ArrayList<>(runs));
        logger.info("Batch created with {} runs: {}", runs.size(), getRunIds());
    }

    // --- Getters ---
    public List<Run> getRuns() { return runs; }
    public int size() { return runs.size(); }
    public DelayEnergyMap getCombinedMap() { return combinedMap; }
    public DelayEnergyMap getDifferenceMap() { return differenceMap; }
    public boolean hasDifferenceMap() { return differenceMap != null; }

    public void setCombinedMap(DelayEnergyMap combinedMap) { this.combinedMap = combinedMap; }
    public void setDifferenceMap(DelayEnergyMap differenceMap) { this.differenceMap = differenceMap; }

    /** Run ids in load order, comma separated. */
    public String getRunIds() {
        return runs.stream().map(Run::getRunId).collect(Collectors.joining(", "));
    }

    /**
     * Sorted run list: {@code Uploaded run: N} for one run, {@code Uploaded runs: min-max} for more than six,
     * a comma separated list otherwise.
     */
    public String getRunListText() {
        List<String> sorted = runs.stream().map(Run::getRunId).sorted(Batch::compareRunIds).collect(Collectors.toList());
        if (sorted.size() == 1) {
            return "Uploaded run: " + sorted.get(0);
        }
        if (sorted.size() > RANGE_DISPLAY_THRESHOLD) {
            return RUNS_PREFIX + sorted.get(0) + "-" + sorted.get(sorted.size() - 1);
        }
        return RUNS_PREFIX + String.join(", ", sorted);
    }

    /** Run list without its prefix, used as the "Loaded runs" label of exports and charts. */
    public String getLoadedRunsLabel() {
        return getRunListText().replace(RUNS_PREFIX, "");
    }

    private static int compareRunIds(String a, String b) {
        try {
            return Long.compare(Long.parseLong(a.trim()), Long.parseLong(b.trim()));
        } catch (NumberFormatException e) {
            return a.compareTo(b);
        }
    }

    public boolean allStatic() {
        return runs.stream().allMatch(r -> r.getMetadata().isStaticScan());
    }

    public boolean hasStaticRuns() {
        return runs.stream().anyMatch(r -> r.getMetadata().isStaticScan());
    }

    public String staticCheck() {
        if (allStatic()) {
            return "Static check: All runs are static (+)";
        }
        if (!hasStaticRuns()) {
            return "Static check: All runs are delay scans (+)";
        }
        return "Static check: Delay scans are mixed with static scans (!!!)";
    }

    public String regionCheck() {
        IntSummaryStatistics ke = runs.stream()
                .mapToInt(r -> r.getMetadata().getKineticEnergySetpoint()).summaryStatistics();
        return ke.getMax() - ke.getMin() > REGION_TOLERANCE_EV
                ? "Region check: Various energy regions are on the list (!!!)"
                : "Region check: Homogeneous energy regions (+)";
    }

    public String monoCheck() {
        DoubleSummaryStatistics mono = monoStatistics();
        return mono.getMax() - mono.getMin() > MONO_TOLERANCE_EV
                ? "Mono check: Various mono values for different runs (!!!)"
                : "Mono check: No mono energy jumps detected (+)";
    }

    private DoubleSummaryStatistics monoStatistics() {
        return runs.stream().mapToDouble(r -> r.getMetadata().getMonoMean()).summaryStatistics();
    }

    /** Short summary: run list and the three consistency checks. */
    public String shortSummary() {
        return String.join("\n", "SHORT SUMMARY:\n", getRunListText(), staticCheck(), regionCheck(), monoCheck()) + "\n\n";
    }

    /** Info text of every run. */
    public String detailedInfo() {
        return "DETAILED INFO:\n\n" + runs.stream()
                .map(r -> r.getMetadata().toInfoText())
                .collect(Collectors.joining("\n\n"));
    }

    /**
     * Upper kinetic energy kept by the pipeline: highest mono energy + 50 eV,
     * 1000 eV when that is below 50 eV or not a number.
     */
    public double energyThreshold() {
        double threshold = monoStatistics().getMax() + THRESHOLD_MARGIN_EV;
        return !Double.isFinite(threshold) || threshold < THRESHOLD_MARGIN_EV ? THRESHOLD_FALLBACK_EV : threshold;
    }

    /** Mean raw time of every static run, in load order. */
    public List<Double> staticCutPositions() {
        List<Double> positions = new ArrayList<>();
        for (Run run : runs) {
            if (run.getMetadata().isStaticScan()) {
                positions.add(ArrayStatistics.nanMean(run.getEvents().getTime()));
            }
        }
        return positions;
    }

    @Override
    public String toString() {
        return "Batch{runs=[" + getRunIds() + "], combined=" + (combinedMap != null) + "}";
    }
}
