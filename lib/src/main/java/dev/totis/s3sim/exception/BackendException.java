package dev.totis.s3sim.exception;

/** Any failure reported by the storage backend that has no more specific type. */
public class BackendException extends StorageException {
  public BackendException(String message) {
    super(message);
  }

  public BackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
