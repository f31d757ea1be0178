package dev.totis.s3sim.config;

import static org.junit.jupiter.api.Assertions.*;

import dev.totis.s3sim.exception.ConfigurationException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void missingFileYieldsEmptyConfig() throws Exception {
    assertSame(ConfigFile.EMPTY, ConfigLoader.load(tempDir.resolve("absent.json")));
    assertSame(ConfigFile.EMPTY, ConfigLoader.load(null));
  }

  @Test
  void readsKnownKeysAndIgnoresOthers() throws Exception {
    Path file = tempDir.resolve("s3sim_config.json");
    Files.writeString(
        file,
        "{\"endpoint_url\": \"http://localhost:9000\", \"region\": \"eu-west-1\","
            + " \"default_user_id\": \"alice\", \"theme\": \"dark\"}");

    ConfigFile config = ConfigLoader.load(file);

    assertEquals("http://localhost:9000", config.endpointUrl());
    assertEquals("eu-west-1", config.region());
    assertEquals("alice", config.defaultUserId());
  }

  @Test
  void malformedFileIsAConfigurationError() throws Exception {
    Path file = tempDir.resolve("broken.json");
    Files.writeString(file, "{\"region\": ");

    assertThrows(ConfigurationException.class, () -> ConfigLoader.load(file));
  }
}
