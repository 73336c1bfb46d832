package de.anton.wespe.analyser.wespe_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.function.IntPredicate;

/**
 * Detected electrons of one run, stored as parallel sequences (one entry per electron).
 * Energy, time, macrobunch id and microbunch id are mandatory. The diagnostic channels
 * (arrival time / BAM, gas monitor / GMD, monochromator energy, diode) are optional and null when
 * the run did not record them.
 * <p>
 * All sequences always share one length. Filtering removes an index from every sequence at once;
 * the set never grows again.
 */
public class EventSet {

    private static final Logger logger = LoggerFactory.getLogger(EventSet.class);

    private double[] energy;
    private double[] time;
    private double[] macrobunchId;
    private double[] microbunchId;
    private double[] arrivalTime;
    private double[] gasMonitor;
    private double[] monoEnergy;
    private double[] diode;

    public EventSet(double[] energy, double[] time, double[] macrobunchId, double[] microbunchId,
                    double[] arrivalTime, double[] gasMonitor, double[] monoEnergy, double[] diode) {
        if (energy == null || time == null || macrobunchId == null || microbunchId == null) {
            throw new IllegalArgumentException("Energy, time, macrobunch and microbunch sequences are required.");
        }
        int n = energy.length;
        requireLength("time", time, n);
        requireLength("macrobunchId", macrobunchId, n);
        requireLength("microbunchId", microbunchId, n);
        requireLength("arrivalTime", arrivalTime, n);
        requireLength("gasMonitor", gasMonitor, n);
        requireLength("monoEnergy", monoEnergy, n);
        requireLength("diode", diode, n);
        this.energy = energy.clone();
        this.time = time.clone();
        this.macrobunchId = macrobunchId.clone();
        this.microbunchId = microbunchId.clone();
        this.arrivalTime = arrivalTime != null ? arrivalTime.clone() : null;
        this.gasMonitor = gasMonitor != null ? gasMonitor.clone() : null;
        this.monoEnergy = monoEnergy != null ? monoEnergy.clone() : null;
        this.diode = diode != null ? diode.clone() : null;
    }

    /** Event set without diagnostic channels. */
    public EventSet(double[] energy, double[] time, double[] macrobunchId, double[] microbunchId) {
        this(energy, time, macrobunchId, microbunchId, null, null, null, null);
    }

    private static void requireLength(String name, double[] values, int expected) {
        if (values != null && values.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Sequence '%s' has %d entries, expected %d.", name, values.length, expected));
        }
    }

    /**
     * Removes every event matching the predicate from all sequences.
     *
     * @param shouldRemove tested with the event index in the current (pre-removal) order
     * @return number of removed events
     */
    public int removeWhere(IntPredicate shouldRemove) {
        int n = energy.length;
        boolean[] keep = new boolean[n];
        int kept = 0;
        for (int i = 0; i < n; i++) {
            keep[i] = !shouldRemove.test(i);
            if (keep[i]) kept++;
        }
        int removed = n - kept;
        if (removed == 0) {
            return 0;
        }
        energy = compact(energy, keep, kept);
        time = compact(time, keep, kept);
        macrobunchId = compact(macrobunchId, keep, kept);
        microbunchId = compact(microbunchId, keep, kept);
        arrivalTime = compact(arrivalTime, keep, kept);
        gasMonitor = compact(gasMonitor, keep, kept);
        monoEnergy = compact(monoEnergy, keep, kept);
        diode = compact(diode, keep, kept);
        logger.trace("Removed {} of {} events.", removed, n);
        return removed;
    }

    private static double[] compact(double[] values, boolean[] keep, int kept) {
        if (values == null) return null;
        double[] result = new double[kept];
        int j = 0;
        for (int i = 0; i < values.length; i++) {
            if (keep[i]) result[j++] = values[i];
        }
        return result;
    }

    // --- Getters (copies, the set is only changed through removeWhere) ---
    public int size() { return energy.length; }
    public boolean isEmpty() { return energy.length == 0; }
    public double[] getEnergy() { return energy.clone(); }
    public double[] getTime() { return time.clone(); }
    public double[] getMacrobunchId() { return macrobunchId.clone(); }
    public double[] getMicrobunchId() { return microbunchId.clone(); }
    public double[] getArrivalTime() { return arrivalTime != null ? arrivalTime.clone() : null; }
    public double[] getGasMonitor() { return gasMonitor != null ? gasMonitor.clone() : null; }
    public double[] getMonoEnergy() { return monoEnergy != null ? monoEnergy.clone() : null; }
    public double[] getDiode() { return diode != null ? diode.clone() : null; }
    public boolean hasGasMonitor() { return gasMonitor != null; }
    public boolean hasMonoEnergy() { return monoEnergy != null; }

    // Package-private index access for the filters, avoids copying per event
    double energyAt(int i) { return energy[i]; }
    double timeAt(int i) { return time[i]; }
    double macrobunchAt(int i) { return macrobunchId[i]; }
    double microbunchAt(int i) { return microbunchId[i]; }

    @Override
    public String toString() {
        return "EventSet{size=" + energy.length
                + ", energy=" + Arrays.toString(Arrays.copyOf(energy, Math.min(3, energy.length))) + "...}";
    }
}
