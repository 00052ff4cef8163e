package de.bsommerfeld.landcover.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GlobalConfig} from a JSON file. A missing file is created with
 * the defaults so users have a template to edit; unknown keys are ignored and
 * missing keys keep their defaults.
 */
public final class ConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);

    private final Path path;
    private final ObjectMapper mapper;

    private ConfigurationLoader(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static ConfigurationLoader from(Path path) {
        return new ConfigurationLoader(path);
    }

    /**
     * @throws ConfigurationException if the file exists but cannot be parsed, or
     *                                the default file cannot be written
     */
    public GlobalConfig load() {
        if (!Files.exists(path)) {
            GlobalConfig defaults = new GlobalConfig();
            LOG.info("No configuration at {}, writing defaults", path.toAbsolutePath());
            save(defaults);
            return defaults;
        }
        try {
            GlobalConfig config = mapper.readValue(path.toFile(), GlobalConfig.class);
            LOG.debug("Loaded configuration from {}", path.toAbsolutePath());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration: " + path, e);
        }
    }

    public void save(GlobalConfig config) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), config);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to write configuration: " + path, e);
        }
    }
}
