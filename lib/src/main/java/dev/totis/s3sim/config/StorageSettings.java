package dev.totis.s3sim.config;

import dev.totis.s3sim.StorageMode;
import dev.totis.s3sim.auth.Credentials;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything needed to build a client and a facade. Values are layered by the builder: defaults,
 * then the configuration file, then the environment, then explicit options.
 */
public final class StorageSettings {
  public static final String DEFAULT_REGION = "us-east-1";
  public static final String DEFAULT_MOCK_ENDPOINT = "http://localhost:5000";
  public static final Path DEFAULT_MIRROR_BASE = Paths.get("s3sim-mirror");

  static final String ENDPOINT_ENV = "S3_ENDPOINT_URL";
  static final String REGION_ENV = "AWS_REGION";
  static final String DEFAULT_REGION_ENV = "AWS_DEFAULT_REGION";
  static final String PROFILE_ENV = "AWS_PROFILE";

  private final StorageMode mode;
  private final String endpoint;
  private final String region;
  private final String profile;
  private final Credentials credentials;
  private final Path mirrorBase;
  private final String defaultUserId;

  private StorageSettings(Builder builder) {
    this.mode = builder.mode;
    this.endpoint = builder.endpoint;
    this.region = builder.region;
    this.profile = builder.profile;
    this.credentials = builder.credentials;
    this.mirrorBase = builder.mirrorBase;
    this.defaultUserId = builder.defaultUserId;
  }

  public static Builder builder() {
    return new Builder();
  }

  public StorageMode mode() {
    return mode;
  }

  /** Endpoint override, if one was configured. */
  public Optional<String> endpoint() {
    return Optional.ofNullable(endpoint);
  }

  /** The endpoint a client for the configured mode talks to. */
  public String effectiveEndpoint() {
    if (endpoint != null) {
      return endpoint;
    }
    return mode == StorageMode.MOCK
        ? DEFAULT_MOCK_ENDPOINT
        : "https://s3." + region + ".amazonaws.com";
  }

  public String region() {
    return region;
  }

  public Optional<String> profile() {
    return Optional.ofNullable(profile);
  }

  public Optional<Credentials> credentials() {
    return Optional.ofNullable(credentials);
  }

  public Path mirrorBase() {
    return mirrorBase;
  }

  public Path mirrorRoot(StorageMode storageMode) {
    return mirrorBase.resolve(storageMode.id());
  }

  /** The mirror root of every mode, active one first. */
  public List<Path> mirrorRoots() {
    List<Path> roots = new ArrayList<>();
    roots.add(mirrorRoot(mode));
    for (StorageMode other : StorageMode.values()) {
      if (other != mode) {
        roots.add(mirrorRoot(other));
      }
    }
    return roots;
  }

  public Optional<String> defaultUserId() {
    return Optional.ofNullable(defaultUserId);
  }

  public Builder toBuilder() {
    return new Builder()
        .withMode(mode)
        .withEndpoint(endpoint)
        .withRegion(region)
        .withProfile(profile)
        .withCredentials(credentials)
        .withMirrorBase(mirrorBase)
        .withDefaultUserId(defaultUserId);
  }

  @Override
  public String toString() {
    return "StorageSettings{mode="
        + mode
        + ", endpoint="
        + effectiveEndpoint()
        + ", region="
        + region
        + ", profile="
        + profile
        + ", mirrorBase="
        + mirrorBase
        + "}";
  }

  /** Setters ignore null so that lower-precedence layers are kept. */
  public static class Builder {
    private StorageMode mode = StorageMode.MOCK;
    private String endpoint;
    private String region = DEFAULT_REGION;
    private String profile;
    private Credentials credentials;
    private Path mirrorBase = DEFAULT_MIRROR_BASE;
    private String defaultUserId;

    public Builder withMode(StorageMode mode) {
      if (mode != null) {
        this.mode = mode;
      }
      return this;
    }

    public Builder withEndpoint(String endpoint) {
      if (hasText(endpoint)) {
        this.endpoint = endpoint;
      }
      return this;
    }

    /** Drops an endpoint override so the mode's default endpoint is used. */
    public Builder withoutEndpoint() {
      this.endpoint = null;
      return this;
    }

    public Builder withRegion(String region) {
      if (hasText(region)) {
        this.region = region;
      }
      return this;
    }

    public Builder withProfile(String profile) {
      if (hasText(profile)) {
        this.profile = profile;
      }
      return this;
    }

    public Builder withCredentials(Credentials credentials) {
      if (credentials != null) {
        this.credentials = credentials;
      }
      return this;
    }

    public Builder withMirrorBase(Path mirrorBase) {
      if (mirrorBase != null) {
        this.mirrorBase = mirrorBase;
      }
      return this;
    }

    public Builder withDefaultUserId(String defaultUserId) {
      if (hasText(defaultUserId)) {
        this.defaultUserId = defaultUserId;
      }
      return this;
    }

    public Builder withConfigFile(ConfigFile configFile) {
      return withEndpoint(configFile.endpointUrl())
          .withRegion(configFile.region())
          .withDefaultUserId(configFile.defaultUserId());
    }

    public Builder withEnvironment(Map<String, String> environment) {
      String envRegion = environment.get(REGION_ENV);
      return withEndpoint(environment.get(ENDPOINT_ENV))
          .withRegion(hasText(envRegion) ? envRegion : environment.get(DEFAULT_REGION_ENV))
          .withProfile(environment.get(PROFILE_ENV));
    }

    public StorageSettings build() {
      return new StorageSettings(this);
    }

    private static boolean hasText(String value) {
      return value != null && !value.isBlank();
    }
  }
}
