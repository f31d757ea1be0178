package dev.totis.s3sim.exception;

/** The identity probe failed for a reason other than bad credentials. */
public class ProbeException extends StorageException {
  public ProbeException(String message) {
    super(message);
  }

  public ProbeException(String message, Throwable cause) {
    super(message, cause);
  }
}
