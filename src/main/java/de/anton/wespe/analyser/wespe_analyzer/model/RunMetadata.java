package de.anton.wespe.analyser.wespe_analyzer.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Scalar summary of one run, derived once when the run is loaded.
 * This class is immutable; filtering the run's {@link EventSet} afterwards does not update it.
 */
public final class RunMetadata {

    /** Work function subtracted when converting kinetic to binding energy, in eV. */
    public static final double WORK_FUNCTION_EV = 4.5;

    private final String runId;
    private final String detector;
    private final int kineticEnergySetpoint; // Analyzer kinetic energy in eV
    private final int passEnergy;            // Analyzer pass energy in eV
    private final boolean staticScan;
    private final int electronCount;
    private final double monoMean;           // Mean monochromator energy, 2 decimals
    private final int macrobunchCount;
    private final int microbunchCount;
    private final double macrobunchMin;
    private final double macrobunchMax;
    private final Range kineticEnergy;
    private final Range bindingEnergy;
    private final Range delay;
    private final Range gasMonitor;

    /** Min, max and mean of the valid values of one channel, rounded to 2 decimals. Blank cells are skipped. */
    public record Range(double min, double max, double mean) {
        static Range of(double[] values) {
            if (values == null || ArrayStatistics.allNaN(values)) {
                return new Range(0.0, 0.0, 0.0);
            }
            return new Range(round2(ArrayStatistics.nanMin(values)), round2(ArrayStatistics.nanMax(values)),
                    round2(ArrayStatistics.nanMean(values)));
        }
    }

    private RunMetadata(String runId, String detector, int kineticEnergySetpoint, int passEnergy,
                        boolean staticScan, EventSet events) {
        this.runId = runId;
        this.detector = detector;
        this.kineticEnergySetpoint = kineticEnergySetpoint;
        this.passEnergy = passEnergy;
        this.staticScan = staticScan;
        this.electronCount = events.size();

        double[] mono = events.getMonoEnergy();
        this.monoMean = mono != null ? Range.of(mono).mean() : 0.0;

        double[] macro = events.getMacrobunchId();
        double[] micro = events.getMicrobunchId();
        this.macrobunchMin = macro.length > 0 ? min(macro) : 0.0;
        this.macrobunchMax = macro.length > 0 ? max(macro) : 0.0;
        this.macrobunchCount = (int) (macrobunchMax - macrobunchMin);
        this.microbunchCount = micro.length > 0 ? (int) max(micro) : 0;

        this.kineticEnergy = Range.of(events.getEnergy());
        // Highest kinetic energy gives the lowest binding energy
        this.bindingEnergy = new Range(
                round2(monoMean - kineticEnergy.max() - WORK_FUNCTION_EV),
                round2(monoMean - kineticEnergy.min() - WORK_FUNCTION_EV),
                round2(monoMean - kineticEnergy.mean() - WORK_FUNCTION_EV));
        this.delay = Range.of(events.getTime());
        this.gasMonitor = Range.of(events.getGasMonitor());
    }

    /**
     * Derives the summary of a freshly loaded run.
     *
     * @param staticScan true when the run has no delay scan and a constant substitute time was used
     */
    public static RunMetadata derive(String runId, String detector, int kineticEnergySetpoint, int passEnergy,
                                     boolean staticScan, EventSet events) {
        Objects.requireNonNull(runId, "Run id cannot be null");
        Objects.requireNonNull(events, "Event set cannot be null for run " + runId);
        return new RunMetadata(runId, detector, kineticEnergySetpoint, passEnergy, staticScan, events);
    }

    /** Binding energy of a kinetic energy for this run's photon energy. */
    public double toBindingEnergy(double kineticEnergyValue) {
        return monoMean - kineticEnergyValue - WORK_FUNCTION_EV;
    }

    /** Multi-line human-readable description of the run. */
    public String toInfoText() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "File name: %s / Electrons detected: %d%n", runId, electronCount));
        sb.append(String.format(Locale.ROOT, "Detector: %s / KE: %d eV / PE: %d eV / Static: %s%n",
                detector, kineticEnergySetpoint, passEnergy, staticScan ? "True" : "False"));
        sb.append(String.format(Locale.ROOT, "FEL mono: %s eV / MacroBunches: %d / MicroBunches: %d%n",
                monoMean, macrobunchCount, microbunchCount));
        sb.append(String.format(Locale.ROOT, "Min KE: %s eV / Max KE: %s eV / Mean KE: %s eV%n",
                kineticEnergy.min(), kineticEnergy.max(), kineticEnergy.mean()));
        sb.append(String.format(Locale.ROOT, "Min BE: %s eV / Max BE: %s eV / Mean BE: %s eV%n",
                bindingEnergy.min(), bindingEnergy.max(), bindingEnergy.mean()));
        sb.append(String.format(Locale.ROOT, "Min delay: %s ps / Max delay: %s ps / Mean delay: %s ps%n",
                delay.min(), delay.max(), delay.mean()));
        sb.append(String.format(Locale.ROOT, "Min GMD: %s / Max GMD: %s / Mean GMD: %s",
                gasMonitor.min(), gasMonitor.max(), gasMonitor.mean()));
        return sb.toString();
    }

    private static double round2(double value) {
        return BinningUtils.roundToDecimals(value, 2);
    }

    private static double min(double[] values) {
        double m = Double.POSITIVE_INFINITY;
        for (double v : values) m = Math.min(m, v);
        return m;
    }

    private static double max(double[] values) {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : values) m = Math.max(m, v);
        return m;
    }

    // --- Getters ---
    public String getRunId() { return runId; }
    public String getDetector() { return detector; }
    public int getKineticEnergySetpoint() { return kineticEnergySetpoint; }
    public int getPassEnergy() { return passEnergy; }
    public boolean isStaticScan() { return staticScan; }
    public int getElectronCount() { return electronCount; }
    public double getMonoMean() { return monoMean; }
    public int getMacrobunchCount() { return macrobunchCount; }
    public int getMicrobunchCount() { return microbunchCount; }
    public double getMacrobunchMin() { return macrobunchMin; }
    public double getMacrobunchMax() { return macrobunchMax; }
    public Range getKineticEnergy() { return kineticEnergy; }
    public Range getBindingEnergy() { return bindingEnergy; }
    public Range getDelay() { return delay; }
    public Range getGasMonitor() { return gasMonitor; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "RunMetadata[run=%s, detector=%s, KE=%d eV, PE=%d eV, mono=%.2f eV, static=%s, electrons=%d]",
                runId, detector, kineticEnergySetpoint, passEnergy, monoMean, staticScan, electronCount);
    }
}
