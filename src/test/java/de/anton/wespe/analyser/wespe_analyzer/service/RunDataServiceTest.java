package de.anton.wespe.analyser.wespe_analyzer.service;

import de.anton.wespe.analyser.wespe_analyzer.model.Batch;
import de.anton.wespe.analyser.wespe_analyzer.model.RunLoadException;
import de.anton.wespe.analyser.wespe_analyzer.model.RunReader;
import de.anton.wespe.analyser.wespe_analyzer.model.RunTestUtils;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunDataServiceTest {

    private final List<String> requested = new ArrayList<>();

    private final RunReader reader = (runDirectory, runId, detector) -> {
        requested.add(runId);
        if (runId.equals("bad")) {
            throw new RunLoadException(runId, "Workbook not found");
        }
        return RunTestUtils.run(runId, RunTestUtils.events(new double[]{1, 2}, new double[]{0, 0}));
    };

    @Test
    void loadsRunsInOrder() throws RunLoadException {
        Batch batch = new RunDataService(reader).loadBatch(Path.of("data"), List.of("12", " 3"), "DLD4Q");

        assertEquals(2, batch.size());
        assertEquals("12, 3", batch.getRunIds());
        assertEquals(List.of("12", "3"), requested);
    }

    @Test
    void firstFailingRunAbortsTheLoad() {
        RunDataService service = new RunDataService(reader);

        RunLoadException e = assertThrows(RunLoadException.class,
                () -> service.loadBatch(Path.of("data"), List.of("1", "bad", "3"), "DLD4Q"));

        assertEquals("bad", e.getRunId());
        assertEquals(List.of("1", "bad"), requested);
    }

    @Test
    void runIdsAreRequired() {
        RunDataService service = new RunDataService(reader);
        assertThrows(IllegalArgumentException.class, () -> service.loadBatch(Path.of("data"), List.of(), "DLD4Q"));
    }

    @Test
    void configurationNamesTheBatch() throws Exception {
        ReductionConfiguration config = new ConfigurationLoader().fromJson("{\"runIds\": [\"5\"], \"detector\": \"DLD1Q\"}");

        Batch batch = new RunDataService(reader).loadBatch(config);

        assertEquals("Uploaded run: 5", batch.getRunListText());
    }
}
