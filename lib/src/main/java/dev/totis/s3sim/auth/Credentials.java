package dev.totis.s3sim.auth;

import java.util.Objects;

/** An access key pair plus an optional session token. */
public record Credentials(String accessKey, String secretKey, String sessionToken) {

  public Credentials {
    Objects.requireNonNull(accessKey, "accessKey");
    Objects.requireNonNull(secretKey, "secretKey");
  }

  public static Credentials of(String accessKey, String secretKey) {
    return new Credentials(accessKey, secretKey, null);
  }

  @Override
  public String toString() {
    return "Credentials[accessKey=" + accessKey + "]";
  }
}
