package dev.totis.s3sim.client;

import dev.totis.s3sim.exception.AlreadyExistsException;
import dev.totis.s3sim.exception.AuthenticationException;
import dev.totis.s3sim.exception.BackendException;
import dev.totis.s3sim.exception.BucketNotEmptyException;
import dev.totis.s3sim.exception.ConfigurationException;
import dev.totis.s3sim.exception.NotFoundException;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.exception.UncheckedStorageException;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.RemoveBucketArgs;
import io.minio.RemoveObjectArgs;
import io.minio.RemoveObjectsArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.UploadObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.MinioException;
import io.minio.messages.Bucket;
import io.minio.messages.DeleteError;
import io.minio.messages.DeleteObject;
import io.minio.messages.Item;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link ObjectStorageClient} over the MinIO S3 SDK. */
public class MinioObjectStorageClient implements ObjectStorageClient {
  private static final Logger logger = LoggerFactory.getLogger(MinioObjectStorageClient.class);

  private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "NoSuchBucket");
  private static final Set<String> AUTH_CODES =
      Set.of(
          "InvalidAccessKeyId",
          "SignatureDoesNotMatch",
          "AccessDenied",
          "ExpiredToken",
          "InvalidToken",
          "InvalidClientTokenId");

  private final MinioClient minioClient;

  public MinioObjectStorageClient(MinioClient minioClient) {
    this.minioClient = minioClient;
  }

  @Override
  public void createBucket(String bucket) throws StorageException {
    try {
      minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      throw translate("create bucket " + bucket, e);
    }
  }

  @Override
  public boolean bucketExists(String bucket) throws StorageException {
    try {
      return minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      throw translate("check bucket " + bucket, e);
    }
  }

  @Override
  public List<String> listBuckets() throws StorageException {
    try {
      return minioClient.listBuckets().stream().map(Bucket::name).toList();
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      throw translate("list buckets", e);
    }
  }

  @Override
  public void putObject(String bucket, String key, Path source, Map<String, String> metadata)
      throws StorageException {
    requireSource(source);
    try {
      minioClient.uploadObject(
          UploadObjectArgs.builder()
              .bucket(bucket)
              .object(key)
              .filename(source.toString())
              .userMetadata(metadata == null ? Map.of() : metadata)
              .build());
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      throw translate("upload " + bucket + "/" + key, e);
    }
  }

  @Override
  public void putLargeObject(
      String bucket, String key, Path source, long partSize, Map<String, String> metadata)
      throws StorageException {
    if (partSize < MIN_PART_SIZE) {
      throw new ConfigurationException(
          "Part size " + partSize + " is below the minimum of " + MIN_PART_SIZE);
    }
    requireSource(source);
    try {
      logger.debug(
          "Multipart upload of {} to {}/{} with {} byte parts", source, bucket, key, partSize);
      minioClient.uploadObject(
          UploadObjectArgs.builder()
              .bucket(bucket)
              .object(key)
              .filename(source.toString(), partSize)
              .userMetadata(metadata == null ? Map.of() : metadata)
              .build());
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      throw translate("multipart upload " + bucket + "/" + key, e);
    }
  }

  @Override
  public InputStream getObject(String bucket, String key) throws StorageException {
    try {
      return minioClient.getObject(GetObjectArgs.builder().bucket(bucket).object(key).build());
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      throw translate("get " + bucket + "/" + key, e);
    }
  }

  @Override
  public ObjectInfo statObject(String bucket, String key) throws StorageException {
    try {
      StatObjectResponse stat =
          minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
      return new ObjectInfo(bucket, key, stat.size(), stat.userMetadata());
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      throw translate("stat " + bucket + "/" + key, e);
    }
  }

  @Override
  public void deleteObject(String bucket, String key) throws StorageException {
    try {
      minioClient.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      throw translate("delete " + bucket + "/" + key, e);
    }
  }

  @Override
  public Iterable<String> listObjects(String bucket, String prefix) {
    ListObjectsArgs args =
        ListObjectsArgs.builder()
            .bucket(bucket)
            .prefix(prefix == null ? "" : prefix)
            .recursive(true)
            .build();
    return () -> new KeyIterator(minioClient.listObjects(args).iterator(), bucket);
  }

  @Override
  public List<String> deleteObjects(String bucket, List<String> keys) throws StorageException {
    if (keys.size() > MAX_DELETE_BATCH) {
      throw new ConfigurationException(
          "Cannot delete more than " + MAX_DELETE_BATCH + " keys in one request");
    }
    List<DeleteObject> objects = keys.stream().map(DeleteObject::new).toList();
    List<String> failed = new ArrayList<>();
    try {
      // the request is only sent once the results are iterated
      for (Result<DeleteError> result :
          minioClient.removeObjects(
              RemoveObjectsArgs.builder().bucket(bucket).objects(objects).build())) {
        DeleteError error = result.get();
        logger.warn(
            "Failed to delete {}/{}: {} {}",
            bucket,
            error.objectName(),
            error.code(),
            error.message());
        failed.add(error.objectName());
      }
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      throw translate("batch delete in " + bucket, e);
    }
    return failed;
  }

  @Override
  public void deleteBucket(String bucket) throws StorageException {
    try {
      minioClient.removeBucket(RemoveBucketArgs.builder().bucket(bucket).build());
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      throw translate("delete bucket " + bucket, e);
    }
  }

  @Override
  public void probeIdentity() throws StorageException {
    listBuckets();
  }

  static StorageException translate(String action, Exception e) {
    if (e instanceof ErrorResponseException errorResponseException) {
      String code = errorResponseException.errorResponse().code();
      String message = "Failed to " + action + ": " + code;
      if (NOT_FOUND_CODES.contains(code)) {
        return new NotFoundException(message, e);
      }
      if ("BucketAlreadyOwnedByYou".equals(code)) {
        return new AlreadyExistsException(message, true, e);
      }
      if ("BucketAlreadyExists".equals(code)) {
        return new AlreadyExistsException(message, false, e);
      }
      if ("BucketNotEmpty".equals(code)) {
        String bucket = errorResponseException.errorResponse().bucketName();
        return new BucketNotEmptyException(bucket, e);
      }
      if (AUTH_CODES.contains(code)) {
        return new AuthenticationException(message, e);
      }
      return new BackendException(message, e);
    }
    return new BackendException("Failed to " + action + ": " + e.getMessage(), e);
  }

  private static void requireSource(Path source) throws NotFoundException {
    if (!Files.isRegularFile(source)) {
      throw new NotFoundException("Source file does not exist: " + source);
    }
  }

  private static class KeyIterator implements Iterator<String> {
    private final Iterator<Result<Item>> results;
    private final String bucket;
    private String next;

    KeyIterator(Iterator<Result<Item>> results, String bucket) {
      this.results = results;
      this.bucket = bucket;
    }

    @Override
    public boolean hasNext() {
      while (next == null && results.hasNext()) {
        try {
          Item item = results.next().get();
          if (!item.isDir()) {
            next = item.objectName();
          }
        } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
          throw new UncheckedStorageException(translate("list objects in " + bucket, e));
        }
      }
      return next != null;
    }

    @Override
    public String next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      String key = next;
      next = null;
      return key;
    }
  }
}
