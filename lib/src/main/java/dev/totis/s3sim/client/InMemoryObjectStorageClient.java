package dev.totis.s3sim.client;

import dev.totis.s3sim.exception.AlreadyExistsException;
import dev.totis.s3sim.exception.BucketNotEmptyException;
import dev.totis.s3sim.exception.ConfigurationException;
import dev.totis.s3sim.exception.LocalIOException;
import dev.totis.s3sim.exception.NotFoundException;
import dev.totis.s3sim.exception.StorageException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local backend with S3 semantics. Keys are kept sorted so listings come back in the
 * same order S3 returns them.
 */
public class InMemoryObjectStorageClient implements ObjectStorageClient {
  private final NavigableMap<String, NavigableMap<String, StoredObject>> buckets =
      new ConcurrentSkipListMap<>();

  private static class StoredObject {
    final byte[] content;
    final Map<String, String> metadata;

    StoredObject(byte[] content, Map<String, String> metadata) {
      this.content = content;
      this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
  }

  @Override
  public void createBucket(String bucket) throws StorageException {
    if (buckets.putIfAbsent(bucket, new ConcurrentSkipListMap<>()) != null) {
      throw new AlreadyExistsException("Bucket already owned by you: " + bucket, true);
    }
  }

  @Override
  public boolean bucketExists(String bucket) {
    return buckets.containsKey(bucket);
  }

  @Override
  public List<String> listBuckets() {
    return new ArrayList<>(buckets.keySet());
  }

  @Override
  public void putObject(String bucket, String key, Path source, Map<String, String> metadata)
      throws StorageException {
    NavigableMap<String, StoredObject> objects = bucket(bucket);
    objects.put(key, new StoredObject(readSource(source), metadata));
  }

  @Override
  public void putLargeObject(
      String bucket, String key, Path source, long partSize, Map<String, String> metadata)
      throws StorageException {
    if (partSize < MIN_PART_SIZE) {
      throw new ConfigurationException(
          "Part size " + partSize + " is below the minimum of " + MIN_PART_SIZE);
    }
    putObject(bucket, key, source, metadata);
  }

  @Override
  public InputStream getObject(String bucket, String key) throws StorageException {
    return new ByteArrayInputStream(object(bucket, key).content);
  }

  @Override
  public ObjectInfo statObject(String bucket, String key) throws StorageException {
    StoredObject object = object(bucket, key);
    return new ObjectInfo(bucket, key, object.content.length, object.metadata);
  }

  @Override
  public void deleteObject(String bucket, String key) throws StorageException {
    bucket(bucket).remove(key);
  }

  @Override
  public Iterable<String> listObjects(String bucket, String prefix) throws StorageException {
    NavigableMap<String, StoredObject> objects = bucket(bucket);
    String from = prefix == null ? "" : prefix;
    return () ->
        objects.tailMap(from, true).keySet().stream()
            .takeWhile(key -> key.startsWith(from))
            .iterator();
  }

  @Override
  public List<String> deleteObjects(String bucket, List<String> keys) throws StorageException {
    if (keys.size() > MAX_DELETE_BATCH) {
      throw new ConfigurationException(
          "Cannot delete more than " + MAX_DELETE_BATCH + " keys in one request");
    }
    NavigableMap<String, StoredObject> objects = bucket(bucket);
    keys.forEach(objects::remove);
    return List.of();
  }

  @Override
  public void deleteBucket(String bucket) throws StorageException {
    if (!bucket(bucket).isEmpty()) {
      throw new BucketNotEmptyException(bucket, null);
    }
    buckets.remove(bucket);
  }

  @Override
  public void probeIdentity() throws StorageException {}

  /** Stores raw bytes directly, bypassing the file-based upload path. */
  public void putBytes(String bucket, String key, byte[] content) throws StorageException {
    bucket(bucket).put(key, new StoredObject(content.clone(), Map.of()));
  }

  private NavigableMap<String, StoredObject> bucket(String bucket) throws NotFoundException {
    NavigableMap<String, StoredObject> objects = buckets.get(bucket);
    if (objects == null) {
      throw new NotFoundException("Bucket does not exist: " + bucket);
    }
    return objects;
  }

  private StoredObject object(String bucket, String key) throws NotFoundException {
    StoredObject object = bucket(bucket).get(key);
    if (object == null) {
      throw new NotFoundException("Object does not exist: " + bucket + "/" + key);
    }
    return object;
  }

  private static byte[] readSource(Path source) throws StorageException {
    if (!Files.isRegularFile(source)) {
      throw new NotFoundException("Source file does not exist: " + source);
    }
    try {
      return Files.readAllBytes(source);
    } catch (IOException e) {
      throw new LocalIOException("Failed to read file: " + source, e);
    }
  }
}
