package de.anton.wespe.analyser.wespe_analyzer.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileMapCacheTest {

    @TempDir Path tempDir;

    @Test
    void keyNamesRunDetectorStepsAndFilters() {
        Run run = RunTestUtils.run("41234", RunTestUtils.events(new double[]{1}, new double[]{0}));
        assertEquals("41234_DLD4Q_0.05eV_0.1ps_All_Macro_B_All_Micro_B", MapCache.keyFor(run, 0.05, 0.1));
        assertEquals("41234_DLD4Q_1eV_2ps_All_Macro_B_All_Micro_B", MapCache.keyFor(run, 1.0, 2.0));
    }

    @Test
    void storedMapIsReadBackUnchanged() {
        JsonFileMapCache cache = new JsonFileMapCache(tempDir.resolve("cache"));
        DelayEnergyMap map = RunTestUtils.map(new double[][]{{1, 2}, {3, Double.NaN}},
                new double[]{1.0, 1.1}, new double[]{-0.5, 0.5});

        cache.write("k", map);
        Optional<DelayEnergyMap> read = cache.read("k");

        assertTrue(Files.isRegularFile(cache.fileFor("k")));
        assertTrue(read.isPresent());
        DelayEnergyMap restored = read.get();
        assertEquals(map.getName(), restored.getName());
        assertArrayEquals(map.getEnergyCoordinates(), restored.getEnergyCoordinates());
        assertArrayEquals(map.getTimeCoordinates(), restored.getTimeCoordinates());
        assertArrayEquals(map.getRow(0), restored.getRow(0));
        assertTrue(Double.isNaN(restored.getValue(1, 1)));
        assertEquals(map.getMonoEnergy(), restored.getMonoEnergy());
        assertEquals(Ordinate.DELAY, restored.getOrdinate());
    }

    @Test
    void missingKeyIsEmpty() {
        assertTrue(new JsonFileMapCache(tempDir).read("nothing").isEmpty());
    }

    @Test
    void corruptFileIsTreatedAsMiss() throws IOException {
        JsonFileMapCache cache = new JsonFileMapCache(tempDir);
        Files.writeString(cache.fileFor("broken"), "{not json");
        assertTrue(cache.read("broken").isEmpty());
    }

    @Test
    void microbunchMapsAreNotStored() {
        JsonFileMapCache cache = new JsonFileMapCache(tempDir);
        DelayEnergyMap map = DelayEnergyMap.of(new double[][]{{1}}, new double[]{1.0}, new double[]{3.0},
                Ordinate.MICROBUNCH, 0.1, 1.0, 100.0, "mb");

        cache.write("mb", map);

        assertFalse(Files.exists(cache.fileFor("mb")));
    }
}
