package dev.totis.s3sim;

import dev.totis.s3sim.client.ObjectStorageClient;
import dev.totis.s3sim.config.StorageSettings;
import dev.totis.s3sim.exception.AuthenticationException;
import dev.totis.s3sim.exception.ConfigurationException;
import dev.totis.s3sim.exception.ProbeException;
import dev.totis.s3sim.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the mode by probing the real backend. Missing or rejected credentials select the mock
 * backend; any other probe failure is reported as a {@link ProbeException} instead of silently
 * switching to the mock.
 *
 * <p>An endpoint override in the incoming settings is taken to address the mock server. The probe
 * always goes to the regional AWS endpoint, and the override is kept only if the mock is selected.
 */
public class ModeDetector {
  private static final Logger logger = LoggerFactory.getLogger(ModeDetector.class);

  private final StorageClientFactory clientFactory;

  public ModeDetector(StorageClientFactory clientFactory) {
    this.clientFactory = clientFactory;
  }

  /** Returns {@code settings} bound to the detected mode. */
  public StorageSettings detect(StorageSettings settings) throws ProbeException {
    StorageSettings realSettings =
        settings.toBuilder().withMode(StorageMode.REAL).withoutEndpoint().build();
    StorageSettings mockSettings = settings.toBuilder().withMode(StorageMode.MOCK).build();

    final ObjectStorageClient client;
    try {
      client = clientFactory.create(realSettings);
    } catch (ConfigurationException e) {
      logger.info("No usable credentials for the real backend, using mock: {}", e.getMessage());
      return mockSettings;
    }

    try (client) {
      client.probeIdentity();
      logger.info("Credentials accepted by {}", realSettings.effectiveEndpoint());
      return realSettings;
    } catch (AuthenticationException e) {
      logger.info("Credentials rejected by the real backend, using mock: {}", e.getMessage());
      return mockSettings;
    } catch (StorageException e) {
      throw new ProbeException(
          "Could not reach " + realSettings.effectiveEndpoint() + ": " + e.getMessage(), e);
    }
  }
}
