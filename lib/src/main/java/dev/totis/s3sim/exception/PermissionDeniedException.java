package dev.totis.s3sim.exception;

public class PermissionDeniedException extends StorageException {
  public PermissionDeniedException(String message) {
    super(message);
  }

  public PermissionDeniedException(String message, Throwable cause) {
    super(message, cause);
  }
}
