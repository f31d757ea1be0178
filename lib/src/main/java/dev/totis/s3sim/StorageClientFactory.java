package dev.totis.s3sim;

import dev.totis.s3sim.auth.Credentials;
import dev.totis.s3sim.auth.CredentialsResolver;
import dev.totis.s3sim.client.InMemoryObjectStorageClient;
import dev.totis.s3sim.client.MinioObjectStorageClient;
import dev.totis.s3sim.client.ObjectStorageClient;
import dev.totis.s3sim.config.StorageSettings;
import dev.totis.s3sim.exception.ConfigurationException;
import io.minio.MinioClient;
import io.minio.credentials.Provider;
import io.minio.credentials.StaticProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a client bound to one mode, endpoint and credential set. Building never contacts the
 * network.
 */
public class StorageClientFactory {
  private static final Logger logger = LoggerFactory.getLogger(StorageClientFactory.class);

  /** Any key pair is accepted by the local mock server. */
  static final Credentials MOCK_CREDENTIALS = Credentials.of("test", "test");

  private final CredentialsResolver credentialsResolver;

  public StorageClientFactory() {
    this(new CredentialsResolver());
  }

  public StorageClientFactory(CredentialsResolver credentialsResolver) {
    this.credentialsResolver = credentialsResolver;
  }

  public ObjectStorageClient create(StorageSettings settings) throws ConfigurationException {
    Provider credentials = credentialsProvider(settings);
    String endpoint = settings.effectiveEndpoint();
    logger.info(
        "Using {} backend at {} (region {})", settings.mode().id(), endpoint, settings.region());
    try {
      MinioClient minioClient =
          MinioClient.builder()
              .endpoint(endpoint)
              .region(settings.region())
              .credentialsProvider(credentials)
              .build();
      return new MinioObjectStorageClient(minioClient);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid endpoint " + endpoint + ": " + e.getMessage(), e);
    }
  }

  Provider credentialsProvider(StorageSettings settings) throws ConfigurationException {
    if (settings.mode() == StorageMode.MOCK) {
      Credentials credentials = settings.credentials().orElse(MOCK_CREDENTIALS);
      return new StaticProvider(
          credentials.accessKey(), credentials.secretKey(), credentials.sessionToken());
    }
    return credentialsResolver.resolve(
        settings.credentials().orElse(null), settings.profile().orElse(null));
  }

  /** A process-local backend, for offline use and tests. */
  public static ObjectStorageClient inMemory() {
    return new InMemoryObjectStorageClient();
  }
}
