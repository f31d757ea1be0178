package dev.totis.s3sim.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.totis.s3sim.exception.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConfigLoader {
  private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

  public static final String DEFAULT_CONFIG_FILE = "s3sim_config.json";

  private static final ObjectMapper mapper = new ObjectMapper();

  /** Reads the file, or returns {@link ConfigFile#EMPTY} when it does not exist. */
  public static ConfigFile load(Path path) throws ConfigurationException {
    if (path == null || !Files.exists(path)) {
      logger.debug("No configuration file at {}", path);
      return ConfigFile.EMPTY;
    }
    try {
      ConfigFile config = mapper.readValue(path.toFile(), ConfigFile.class);
      logger.debug("Loaded configuration from {}", path);
      return config == null ? ConfigFile.EMPTY : config;
    } catch (JsonProcessingException e) {
      throw new ConfigurationException(
          "Invalid configuration file " + path + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read configuration file " + path, e);
    }
  }
}
