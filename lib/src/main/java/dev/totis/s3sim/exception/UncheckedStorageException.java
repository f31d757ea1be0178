package dev.totis.s3sim.exception;

/** Carries a {@link StorageException} out of a lazy listing iterator. */
public class UncheckedStorageException extends RuntimeException {
  public UncheckedStorageException(StorageException cause) {
    super(cause.getMessage(), cause);
  }

  @Override
  public synchronized StorageException getCause() {
    return (StorageException) super.getCause();
  }
}
