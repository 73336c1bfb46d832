package de.anton.wespe.analyser.wespe_analyzer.model;

import java.io.IOException;

/**
 * Raised when a run cannot be read or lacks required data. No partially read run is ever returned.
 */
public class RunLoadException extends IOException {

    private final String runId;

    public RunLoadException(String runId, String message) {
        super("Run " + runId + ": " + message);
        this.runId = runId;
    }

    public RunLoadException(String runId, String message, Throwable cause) {
        super("Run " + runId + ": " + message, cause);
        this.runId = runId;
    }

    public String getRunId() { return runId; }
}
