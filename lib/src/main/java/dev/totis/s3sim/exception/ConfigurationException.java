package dev.totis.s3sim.exception;

/** Missing or invalid mode, credentials or configuration file. */
public class ConfigurationException extends StorageException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
