package de.anton.wespe.analyser.wespe_analyzer.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Store for maps built from single runs, so that a rerun with unchanged binning and filters skips
 * the histogram construction. Implementations never throw on a failed read or write; the map is
 * simply recomputed.
 */
public interface MapCache {

    Optional<DelayEnergyMap> read(String key);

    void write(String key, DelayEnergyMap map);

    /**
     * Key of a run's map: run id, detector, both steps and the two bunch filter labels,
     * e.g. {@code 41234_DLD4Q_0.05eV_0.1ps_All_Macro_B_All_Micro_B}.
     */
    static String keyFor(Run run, double energyStep, double timeStep) {
        return String.join("_",
                run.getRunId(),
                run.getMetadata().getDetector(),
                plain(energyStep) + "eV",
                plain(timeStep) + "ps",
                run.getMacroFilterLabel(),
                run.getMicroFilterLabel());
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
