package dev.totis.s3sim.exception;

/** Object content is not valid UTF-8 text. */
public class DecodeException extends StorageException {
  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
