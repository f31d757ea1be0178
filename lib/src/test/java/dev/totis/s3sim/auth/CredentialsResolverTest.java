package dev.totis.s3sim.auth;

import static org.junit.jupiter.api.Assertions.*;

import dev.totis.s3sim.exception.ConfigurationException;
import io.minio.credentials.Provider;
import io.minio.credentials.StaticProvider;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CredentialsResolverTest {
  @TempDir Path tempDir;

  private Path credentialsFile;

  /** Stands in for the process environment so tests do not depend on it. */
  private final Provider environmentKeys = new StaticProvider("ENVKEY", "envsecret", "envtoken");

  @BeforeEach
  void writeProfiles() throws Exception {
    credentialsFile = tempDir.resolve("credentials");
    Files.writeString(
        credentialsFile,
        String.join(
            "\n",
            "[default]",
            "aws_access_key_id = DEFAULTKEY",
            "aws_secret_access_key = defaultsecret",
            "",
            "[dev]",
            "aws_access_key_id = DEVKEY",
            "aws_secret_access_key = devsecret",
            "aws_session_token = devtoken",
            "",
            "[broken]",
            "aws_access_key_id = ONLYKEY",
            ""));
  }

  private Map<String, String> environment(String... entries) {
    Map<String, String> environment = new HashMap<>();
    environment.put("AWS_SHARED_CREDENTIALS_FILE", credentialsFile.toString());
    for (int i = 0; i < entries.length; i += 2) {
      environment.put(entries[i], entries[i + 1]);
    }
    return environment;
  }

  private Map<String, String> environmentWithKeys() {
    return environment("AWS_ACCESS_KEY_ID", "ENVKEY", "AWS_SECRET_ACCESS_KEY", "envsecret");
  }

  @Test
  void explicitCredentialsWin() throws Exception {
    CredentialsResolver resolver = new CredentialsResolver(environmentWithKeys(), environmentKeys);

    Provider provider = resolver.resolve(Credentials.of("EXPLICIT", "secret"), "dev");

    assertEquals("EXPLICIT", provider.fetch().accessKey());
  }

  @Test
  void environmentComesBeforeProfileFile() throws Exception {
    CredentialsResolver resolver = new CredentialsResolver(environmentWithKeys(), environmentKeys);

    Provider provider = resolver.resolve(null, "dev");

    assertEquals("ENVKEY", provider.fetch().accessKey());
    assertEquals("envtoken", provider.fetch().sessionToken());
  }

  @Test
  void environmentIsSkippedWithoutBothKeys() throws Exception {
    CredentialsResolver resolver =
        new CredentialsResolver(environment("AWS_ACCESS_KEY_ID", "ENVKEY"), environmentKeys);

    assertEquals("DEFAULTKEY", resolver.resolve(null, null).fetch().accessKey());
  }

  @Test
  void profileFileIsUsedLast() throws Exception {
    CredentialsResolver resolver = new CredentialsResolver(environment(), environmentKeys);

    assertEquals("DEFAULTKEY", resolver.resolve(null, null).fetch().accessKey());

    Provider dev = resolver.resolve(null, "dev");
    assertEquals("DEVKEY", dev.fetch().accessKey());
    assertEquals("devtoken", dev.fetch().sessionToken());
  }

  @Test
  void profileCanComeFromEnvironment() throws Exception {
    CredentialsResolver resolver =
        new CredentialsResolver(environment("AWS_PROFILE", "dev"), environmentKeys);

    assertEquals("DEVKEY", resolver.resolve(null, null).fetch().accessKey());
  }

  @Test
  void failsWhenNothingResolves() {
    Map<String, String> environment =
        Map.of("AWS_SHARED_CREDENTIALS_FILE", tempDir.resolve("no-such-file").toString());
    CredentialsResolver resolver = new CredentialsResolver(environment, environmentKeys);

    assertThrows(ConfigurationException.class, () -> resolver.resolve(null, null));
  }

  @Test
  void namedProfileMustExistAndBeComplete() {
    CredentialsResolver resolver = new CredentialsResolver(environment(), environmentKeys);

    ConfigurationException e =
        assertThrows(ConfigurationException.class, () -> resolver.resolve(null, "broken"));
    assertTrue(e.getMessage().contains("'broken'"));
    assertThrows(ConfigurationException.class, () -> resolver.resolve(null, "unknown"));
  }

  @Test
  void secretIsNotPrinted() {
    assertFalse(Credentials.of("KEY", "topsecret").toString().contains("topsecret"));
  }
}
