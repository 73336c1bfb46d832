package de.anton.wespe.analyser.wespe_analyzer.model;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link MapCache} keeping one JSON file per key in a directory. Only maps on the delay ordinate
 * are stored; microbunch maps are always rebuilt.
 */
public class JsonFileMapCache implements MapCache {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileMapCache.class);
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    /** Serialized form of a freshly built map (kinetic energy and raw time coordinates). */
    record MapSnapshot(String name, Ordinate ordinate, double energyStep, double timeStep, double monoEnergy,
                       double[] kineticEnergy, double[] rawTime, double[][] values) {

        static MapSnapshot of(DelayEnergyMap map) {
            return new MapSnapshot(map.getName(), map.getOrdinate(), map.getEnergyStep(), map.getTimeStep(),
                    map.getMonoEnergy(), map.getEnergyCoordinates(EnergyAxis.KINETIC),
                    map.getTimeCoordinates(map.getOrdinate().getRawAxis()), map.getValues());
        }

        DelayEnergyMap toMap() {
            return DelayEnergyMap.of(values, kineticEnergy, rawTime, ordinate, energyStep, timeStep, monoEnergy, name);
        }
    }

    public JsonFileMapCache(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Cache directory cannot be null");
        this.mapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .build();
    }

    public Path getDirectory() { return directory; }

    Path fileFor(String key) {
        return directory.resolve(key + EXTENSION);
    }

    @Override
    public Optional<DelayEnergyMap> read(String key) {
        Path file = fileFor(key);
        if (!Files.isRegularFile(file)) {
            logger.debug("No cached map for key {}", key);
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(file)) {
            MapSnapshot snapshot = mapper.readValue(in, MapSnapshot.class);
            logger.info("Map {} loaded from cache {}", snapshot.name(), file.getFileName());
            return Optional.of(snapshot.toMap());
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Cached map {} is unreadable, it will be rebuilt: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void write(String key, DelayEnergyMap map) {
        if (map.getOrdinate() != Ordinate.DELAY) {
            logger.debug("Map {} is not on the delay ordinate, not cached.", map.getName());
            return;
        }
        Path file = fileFor(key);
        try {
            Files.createDirectories(directory);
            try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writeValue(out, MapSnapshot.of(map));
            }
            logger.debug("Map {} cached as {}", map.getName(), file.getFileName());
        } catch (IOException e) {
            logger.warn("Could not cache map {} at {}: {}", map.getName(), file, e.getMessage());
        }
    }
}
