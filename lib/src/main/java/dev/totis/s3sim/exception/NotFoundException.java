package dev.totis.s3sim.exception;

/** A bucket, object or local source file does not exist. */
public class NotFoundException extends StorageException {
  public NotFoundException(String message) {
    super(message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
