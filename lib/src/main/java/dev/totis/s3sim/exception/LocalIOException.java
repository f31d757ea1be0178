package dev.totis.s3sim.exception;

/** A local mirror or filesystem operation failed. */
public class LocalIOException extends StorageException {
  public LocalIOException(String message) {
    super(message);
  }

  public LocalIOException(String message, Throwable cause) {
    super(message, cause);
  }
}
