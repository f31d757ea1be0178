package dev.totis.s3sim.exception;

/** The backend rejected the credentials or the request signature. */
public class AuthenticationException extends BackendException {
  public AuthenticationException(String message) {
    super(message);
  }

  public AuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
