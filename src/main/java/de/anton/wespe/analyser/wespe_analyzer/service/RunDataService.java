package de.anton.wespe.analyser.wespe_analyzer.service;

import de.anton.wespe.analyser.wespe_analyzer.model.Batch;
import de.anton.wespe.analyser.wespe_analyzer.model.Run;
import de.anton.wespe.analyser.wespe_analyzer.model.RunLoadException;
import de.anton.wespe.analyser.wespe_analyzer.model.RunReader;
import de.anton.wespe.analyser.wespe_analyzer.model.WorkbookRunReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Service responsible for loading the runs of a batch.
 */
public class RunDataService {

    private static final Logger logger = LoggerFactory.getLogger(RunDataService.class);
    private final RunReader runReader;

    public RunDataService() {
        this(new WorkbookRunReader());
    }

    public RunDataService(RunReader runReader) {
        this.runReader = Objects.requireNonNull(runReader, "Run reader cannot be null.");
    }

    /**
     * Loads every run in order. The first run that cannot be read aborts the whole load.
     *
     * @throws RunLoadException         if any run fails to load
     * @throws IllegalArgumentException if no run id is given
     */
    public Batch loadBatch(Path runDirectory, List<String> runIds, String detector) throws RunLoadException {
        Objects.requireNonNull(runDirectory, "Run directory cannot be null.");
        if (runIds == null || runIds.isEmpty()) {
            throw new IllegalArgumentException("At least one run id is required.");
        }
        logger.info("Data Service: Loading {} runs ({}) for detector {} from {}", runIds.size(), runIds, detector,
                runDirectory.toAbsolutePath());
        List<Run> runs = new ArrayList<>(runIds.size());
        for (String runId : runIds) {
            try {
                runs.add(runReader.read(runDirectory, runId.trim(), detector));
            } catch (RunLoadException e) {
                logger.error("Data Service: Batch load aborted at run {}: {}", runId, e.getMessage());
                throw e;
            }
        }
        Batch batch = new Batch(runs);
        logger.info("Data Service: Batch loaded successfully. {}", batch.getRunListText());
        return batch;
    }

    /** Loads the batch named by the configuration. */
    public Batch loadBatch(ReductionConfiguration config) throws RunLoadException {
        return loadBatch(config.runDirectoryPath(), config.runIds(), config.detector());
    }
}
