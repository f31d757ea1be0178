package dev.totis.s3sim;

import dev.totis.s3sim.exception.ConfigurationException;
import java.util.Locale;

public enum StorageMode {
  MOCK("mock"),
  REAL("real");

  private final String id;

  StorageMode(String id) {
    this.id = id;
  }

  /** Name used on the command line and as the mirror sub-directory. */
  public String id() {
    return id;
  }

  /** Bucket deletion is only ever executed against the mock backend. */
  public boolean allowsBucketDeletion() {
    return this == MOCK;
  }

  public static StorageMode parse(String value) throws ConfigurationException {
    if (value == null) {
      throw new ConfigurationException("Storage mode is required");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (StorageMode mode : values()) {
      if (mode.id.equals(normalized)) {
        return mode;
      }
    }
    throw new ConfigurationException("Unknown storage mode: " + value);
  }
}
