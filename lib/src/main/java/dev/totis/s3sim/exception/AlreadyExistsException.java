package dev.totis.s3sim.exception;

public class AlreadyExistsException extends StorageException {
  private final boolean ownedByCaller;

  public AlreadyExistsException(String message, boolean ownedByCaller) {
    super(message);
    this.ownedByCaller = ownedByCaller;
  }

  public AlreadyExistsException(String message, boolean ownedByCaller, Throwable cause) {
    super(message, cause);
    this.ownedByCaller = ownedByCaller;
  }

  /** True when the backend reports the existing bucket belongs to the same account. */
  public boolean isOwnedByCaller() {
    return ownedByCaller;
  }
}
