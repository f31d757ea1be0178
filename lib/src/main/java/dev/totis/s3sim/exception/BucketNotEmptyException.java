package dev.totis.s3sim.exception;

/**
 * The backend refused to delete a bucket that still holds objects, typically because a concurrent
 * writer added objects after the bucket was emptied.
 */
public class BucketNotEmptyException extends StorageException {
  private final String bucketName;

  public BucketNotEmptyException(String bucketName, Throwable cause) {
    super("Bucket is not empty: " + bucketName, cause);
    this.bucketName = bucketName;
  }

  public String getBucketName() {
    return bucketName;
  }
}
