package de.anton.wespe.analyser.wespe_analyzer.model;

import java.nio.file.Path;

/**
 * Source of stored acquisition runs.
 */
public interface RunReader {

    /**
     * Reads one run for one detector.
     *
     * @param runDirectory directory holding one sub-directory per run
     * @param runId        run number
     * @param detector     detector id, e.g. {@code DLD4Q}
     * @return the run with its events and derived metadata
     * @throws RunLoadException if the run is missing or lacks required channels
     */
    Run read(Path runDirectory, String runId, String detector) throws RunLoadException;
}
