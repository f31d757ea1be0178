package dev.totis.s3sim.auth;

import dev.totis.s3sim.exception.ConfigurationException;
import io.minio.credentials.AwsConfigProvider;
import io.minio.credentials.AwsEnvironmentProvider;
import io.minio.credentials.ChainedProvider;
import io.minio.credentials.Provider;
import io.minio.credentials.StaticProvider;
import java.security.ProviderException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves credentials for the real backend as a MinIO provider chain: explicit pair, environment
 * variables, shared credentials profile file.
 */
public class CredentialsResolver {
  private static final Logger logger = LoggerFactory.getLogger(CredentialsResolver.class);

  static final String ACCESS_KEY_ENV = "AWS_ACCESS_KEY_ID";
  static final String SECRET_KEY_ENV = "AWS_SECRET_ACCESS_KEY";
  static final String PROFILE_ENV = "AWS_PROFILE";
  static final String CREDENTIALS_FILE_ENV = "AWS_SHARED_CREDENTIALS_FILE";
  static final String DEFAULT_PROFILE = "default";

  private final Map<String, String> environment;
  private final Provider environmentProvider;

  public CredentialsResolver() {
    this(System.getenv());
  }

  public CredentialsResolver(Map<String, String> environment) {
    this(environment, new AwsEnvironmentProvider());
  }

  /**
   * @param environmentProvider consulted only when {@code environment} holds both keys
   */
  public CredentialsResolver(Map<String, String> environment, Provider environmentProvider) {
    this.environment = environment;
    this.environmentProvider = environmentProvider;
  }

  /**
   * Builds the provider chain and fetches from it once, so that missing credentials fail here and
   * not on the first request. Only local sources are read.
   */
  public Provider resolve(Credentials explicit, String profile) throws ConfigurationException {
    String profileName = firstNonBlank(profile, environment.get(PROFILE_ENV), DEFAULT_PROFILE);
    List<Provider> chain = new ArrayList<>();
    try {
      if (explicit != null) {
        chain.add(
            new StaticProvider(
                explicit.accessKey(), explicit.secretKey(), explicit.sessionToken()));
      }
      // AwsEnvironmentProvider fails with a NullPointerException when the keys are unset
      if (!isBlank(environment.get(ACCESS_KEY_ENV)) && !isBlank(environment.get(SECRET_KEY_ENV))) {
        chain.add(environmentProvider);
      }
      String file = environment.get(CREDENTIALS_FILE_ENV);
      chain.add(new AwsConfigProvider(isBlank(file) ? null : file, profileName));

      ChainedProvider provider = new ChainedProvider(chain.toArray(new Provider[0]));
      provider.fetch();
      logger.debug("Resolved credentials from a chain of {} provider(s)", chain.size());
      return provider;
    } catch (ProviderException | IllegalArgumentException e) {
      throw new ConfigurationException(
          "No credentials found: pass them explicitly, set "
              + ACCESS_KEY_ENV
              + "/"
              + SECRET_KEY_ENV
              + " or configure profile '"
              + profileName
              + "'",
          e);
    }
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (!isBlank(value)) {
        return value;
      }
    }
    return null;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
