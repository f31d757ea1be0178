package dev.totis.s3sim.client;

import dev.totis.s3sim.exception.StorageException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * The subset of the S3 API the facade needs. Implementations translate backend failures into the
 * {@link StorageException} hierarchy; none of them retry.
 */
public interface ObjectStorageClient extends AutoCloseable {
  /** Largest number of keys a single {@link #deleteObjects} call accepts. */
  int MAX_DELETE_BATCH = 1000;

  /** Smallest multipart part size S3 accepts. */
  long MIN_PART_SIZE = 5L * 1024 * 1024;

  void createBucket(String bucket) throws StorageException;

  boolean bucketExists(String bucket) throws StorageException;

  List<String> listBuckets() throws StorageException;

  void putObject(String bucket, String key, Path source, Map<String, String> metadata)
      throws StorageException;

  void putLargeObject(
      String bucket, String key, Path source, long partSize, Map<String, String> metadata)
      throws StorageException;

  /** The caller closes the returned stream. */
  InputStream getObject(String bucket, String key) throws StorageException;

  ObjectInfo statObject(String bucket, String key) throws StorageException;

  void deleteObject(String bucket, String key) throws StorageException;

  /**
   * Keys under {@code prefix} in lexicographic order. The listing is lazy; every call to {@code
   * iterator()} starts a fresh listing. Failures while iterating surface as {@link
   * dev.totis.s3sim.exception.UncheckedStorageException}.
   */
  Iterable<String> listObjects(String bucket, String prefix) throws StorageException;

  /**
   * Deletes up to {@link #MAX_DELETE_BATCH} keys in one request.
   *
   * @return the keys the backend failed to delete
   */
  List<String> deleteObjects(String bucket, List<String> keys) throws StorageException;

  void deleteBucket(String bucket) throws StorageException;

  /** Makes one authenticated call to check that the credentials are accepted. */
  void probeIdentity() throws StorageException;

  @Override
  default void close() {}
}
