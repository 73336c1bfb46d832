package de.anton.wespe.analyser.wespe_analyzer.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads a {@link ReductionConfiguration} from JSON. User files only need the keys they change;
 * everything else comes from the bundled {@code wespe-analyzer.json}. Unknown keys are rejected.
 */
public class ConfigurationLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    static final String DEFAULTS_RESOURCE = "/wespe-analyzer.json";

    private final ObjectMapper mapper;

    public ConfigurationLoader() {
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /** Bundled defaults only. */
    public ReductionConfiguration loadDefaults() throws IOException {
        return toConfiguration(readDefaults());
    }

    /** Defaults overridden by the keys of {@code file}. */
    public ReductionConfiguration load(Path file) throws IOException {
        Objects.requireNonNull(file, "Configuration file cannot be null.");
        logger.info("Loading configuration from {}", file.toAbsolutePath());
        try (InputStream in = Files.newInputStream(file)) {
            return merge(mapper.readTree(in));
        } catch (IOException e) {
            logger.error("Could not read configuration file {}", file.toAbsolutePath(), e);
            throw e;
        }
    }

    /** Defaults overridden by the keys of a JSON object given as text. */
    public ReductionConfiguration fromJson(String json) throws IOException {
        return merge(mapper.readTree(json));
    }

    private ReductionConfiguration merge(JsonNode overrides) throws IOException {
        ObjectNode merged = readDefaults();
        if (overrides != null && !overrides.isNull() && !overrides.isMissingNode()) {
            if (!overrides.isObject()) {
                throw new IOException("Configuration must be a JSON object.");
            }
            merged.setAll((ObjectNode) overrides);
        }
        return toConfiguration(merged);
    }

    private ObjectNode readDefaults() throws IOException {
        try (InputStream in = ConfigurationLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Bundled configuration " + DEFAULTS_RESOURCE + " not found on the classpath.");
            }
            return (ObjectNode) mapper.readTree(in);
        }
    }

    private ReductionConfiguration toConfiguration(ObjectNode node) throws IOException {
        try {
            ReductionConfiguration config = mapper.treeToValue(node, ReductionConfiguration.class);
            logger.debug("Configuration: {}", config);
            return config;
        } catch (ValueInstantiationException e) {
            // Validation failures of the record surface as the wrapped IllegalArgumentException
            if (e.getCause() instanceof IllegalArgumentException) {
                throw (IllegalArgumentException) e.getCause();
            }
            throw e;
        }
    }
}
