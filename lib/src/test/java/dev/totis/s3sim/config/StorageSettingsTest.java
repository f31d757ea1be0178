package dev.totis.s3sim.config;

import static org.junit.jupiter.api.Assertions.*;

import dev.totis.s3sim.StorageMode;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StorageSettingsTest {

  @Test
  void defaults() {
    StorageSettings settings = StorageSettings.builder().build();

    assertEquals(StorageMode.MOCK, settings.mode());
    assertTrue(settings.endpoint().isEmpty());
    assertEquals("http://localhost:5000", settings.effectiveEndpoint());
    assertEquals("us-east-1", settings.region());
    assertEquals(Paths.get("s3sim-mirror"), settings.mirrorBase());
    assertTrue(settings.defaultUserId().isEmpty());
  }

  @Test
  void realModeDefaultsToRegionalEndpoint() {
    StorageSettings settings =
        StorageSettings.builder().withMode(StorageMode.REAL).withRegion("eu-central-1").build();

    assertEquals("https://s3.eu-central-1.amazonaws.com", settings.effectiveEndpoint());
  }

  @Test
  void laterLayersOverrideEarlierOnes() {
    ConfigFile file = new ConfigFile("http://from-file:9000", "eu-west-1", "alice");
    Map<String, String> env = Map.of("S3_ENDPOINT_URL", "http://from-env:9000");

    StorageSettings settings =
        StorageSettings.builder()
            .withConfigFile(file)
            .withEnvironment(env)
            .withRegion("ap-south-1")
            .withDefaultUserId(null)
            .build();

    assertEquals("http://from-env:9000", settings.effectiveEndpoint());
    assertEquals("ap-south-1", settings.region());
    assertEquals("alice", settings.defaultUserId().orElseThrow());
  }

  @Test
  void awsRegionWinsOverDefaultRegion() {
    StorageSettings settings =
        StorageSettings.builder()
            .withEnvironment(Map.of("AWS_REGION", "eu-north-1", "AWS_DEFAULT_REGION", "us-west-2"))
            .build();
    assertEquals("eu-north-1", settings.region());

    settings =
        StorageSettings.builder()
            .withEnvironment(Map.of("AWS_DEFAULT_REGION", "us-west-2", "AWS_PROFILE", "dev"))
            .build();
    assertEquals("us-west-2", settings.region());
    assertEquals("dev", settings.profile().orElseThrow());
  }

  @Test
  void mirrorRootsListActiveModeFirst() {
    Path base = Paths.get("/tmp/mirror");
    StorageSettings settings =
        StorageSettings.builder().withMode(StorageMode.REAL).withMirrorBase(base).build();

    assertEquals(List.of(base.resolve("real"), base.resolve("mock")), settings.mirrorRoots());
    assertEquals(base.resolve("mock"), settings.mirrorRoot(StorageMode.MOCK));
  }

  @Test
  void toBuilderKeepsEveryValue() {
    StorageSettings settings =
        StorageSettings.builder()
            .withMode(StorageMode.REAL)
            .withEndpoint("http://localhost:9000")
            .withProfile("dev")
            .withDefaultUserId("bob")
            .build();

    StorageSettings copy = settings.toBuilder().build();

    assertEquals(settings.toString(), copy.toString());
    assertEquals("bob", copy.defaultUserId().orElseThrow());
  }
}
