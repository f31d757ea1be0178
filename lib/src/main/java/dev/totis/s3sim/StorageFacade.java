package dev.totis.s3sim;

import com.google.common.collect.Iterables;
import dev.totis.s3sim.auth.AccessContext;
import dev.totis.s3sim.auth.PermissionLevel;
import dev.totis.s3sim.client.ObjectStorageClient;
import dev.totis.s3sim.config.StorageSettings;
import dev.totis.s3sim.exception.AlreadyExistsException;
import dev.totis.s3sim.exception.BackendException;
import dev.totis.s3sim.exception.ConfigurationException;
import dev.totis.s3sim.exception.DecodeException;
import dev.totis.s3sim.exception.LocalIOException;
import dev.totis.s3sim.exception.NotFoundException;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.exception.UncheckedStorageException;
import dev.totis.s3sim.io.LocalMirror;
import dev.totis.s3sim.io.NioLocalMirror;
import dev.totis.s3sim.response.BucketCreation;
import dev.totis.s3sim.response.BucketDeletion;
import dev.totis.s3sim.response.CleanupReport;
import dev.totis.s3sim.response.Deletion;
import dev.totis.s3sim.response.TransferResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bucket and object operations against one backend, keeping a local mirror of every object
 * written or read through it.
 *
 * <p>Each operation makes at most one backend round trip (listing and batch deletes page through
 * the bucket) followed by at most one mirror update. An upload or download whose mirror copy fails
 * still succeeds; the failure is reported on the returned {@link TransferResult}. Instances are
 * not thread-safe.
 *
 * <p>Every object operation takes an optional user id. When it is null the configured default user
 * is used; when both are null no permission check is made.
 */
public class StorageFacade implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(StorageFacade.class);

  public static final long DEFAULT_PART_SIZE = ObjectStorageClient.MIN_PART_SIZE;

  private final StorageMode mode;
  private final ObjectStorageClient client;
  private final LocalMirror mirror;
  private final List<LocalMirror> allMirrors;
  private final AccessContext accessContext;
  private final String defaultUserId;

  /**
   * @param mirrors one mirror per known root; the first one receives new copies, all of them are
   *     cleaned on delete
   */
  public StorageFacade(
      StorageMode mode,
      ObjectStorageClient client,
      List<LocalMirror> mirrors,
      AccessContext accessContext,
      String defaultUserId) {
    if (mirrors.isEmpty()) {
      throw new IllegalArgumentException("At least one mirror is required");
    }
    this.mode = mode;
    this.client = client;
    this.mirror = mirrors.get(0);
    this.allMirrors = List.copyOf(mirrors);
    this.accessContext = accessContext;
    this.defaultUserId = defaultUserId;
  }

  public static StorageFacade create(StorageSettings settings) throws ConfigurationException {
    return create(settings, new StorageClientFactory().create(settings));
  }

  public static StorageFacade create(StorageSettings settings, ObjectStorageClient client) {
    List<LocalMirror> mirrors =
        settings.mirrorRoots().stream().<LocalMirror>map(NioLocalMirror::new).toList();
    return new StorageFacade(
        settings.mode(),
        client,
        mirrors,
        new AccessContext(),
        settings.defaultUserId().orElse(null));
  }

  public StorageMode mode() {
    return mode;
  }

  public LocalMirror mirror() {
    return mirror;
  }

  public AccessContext accessContext() {
    return accessContext;
  }

  public BucketCreation createBucket(String bucket) throws StorageException {
    return createBucket(bucket, null);
  }

  /** Succeeds if the bucket already exists and belongs to the caller. */
  public BucketCreation createBucket(String bucket, String userId) throws StorageException {
    String user = effectiveUser(userId);
    BucketCreation outcome;
    try {
      client.createBucket(bucket);
      logger.info("Created bucket {}", bucket);
      outcome = BucketCreation.CREATED;
    } catch (AlreadyExistsException e) {
      if (!e.isOwnedByCaller()) {
        throw e;
      }
      logger.info("Bucket {} already exists and is owned by you", bucket);
      outcome = BucketCreation.ALREADY_OWNED;
    }
    if (user != null && (outcome == BucketCreation.CREATED || !accessContext.isManaged(bucket))) {
      accessContext.grantBucket(bucket, user, PermissionLevel.OWNER);
    }
    return outcome;
  }

  public List<String> listBuckets() throws StorageException {
    return client.listBuckets();
  }

  public TransferResult uploadFile(String bucket, String key, Path source)
      throws StorageException {
    return uploadFile(bucket, key, source, Map.of(), null);
  }

  public TransferResult uploadFile(
      String bucket, String key, Path source, Map<String, String> metadata, String userId)
      throws StorageException {
    long size = sourceSize(source);
    String user = authorizeWrite(bucket, key, userId);
    client.putObject(bucket, key, source, metadata);
    logger.info("Uploaded {} to {}/{}", source, bucket, key);
    recordOwner(bucket, key, user);
    return mirrorCopy(source, bucket, key, size);
  }

  /** Uploads {@code content} as UTF-8 text. */
  public TransferResult uploadContent(
      String bucket, String key, String content, Map<String, String> metadata, String userId)
      throws StorageException {
    Path staged = stage(content);
    try {
      return uploadFile(bucket, key, staged, metadata, userId);
    } finally {
      deleteStaged(staged);
    }
  }

  /** Replaces the content of an existing object. */
  public TransferResult updateFile(
      String bucket, String key, String content, Map<String, String> metadata, String userId)
      throws StorageException {
    authorizeWrite(bucket, key, userId);
    client.statObject(bucket, key);
    return uploadContent(bucket, key, content, metadata, userId);
  }

  public TransferResult uploadLargeFile(
      String bucket,
      String key,
      Path source,
      long partSize,
      Map<String, String> metadata,
      String userId)
      throws StorageException {
    if (partSize < ObjectStorageClient.MIN_PART_SIZE) {
      throw new ConfigurationException(
          "Part size must be at least " + ObjectStorageClient.MIN_PART_SIZE + " bytes");
    }
    long size = sourceSize(source);
    String user = authorizeWrite(bucket, key, userId);
    client.putLargeObject(bucket, key, source, partSize, metadata);
    logger.info(
        "Uploaded {} to {}/{} in {} parts",
        source,
        bucket,
        key,
        Math.max(1, (size + partSize - 1) / partSize));
    recordOwner(bucket, key, user);
    return mirrorCopy(source, bucket, key, size);
  }

  public TransferResult downloadFile(String bucket, String key, Path destination)
      throws StorageException {
    return downloadFile(bucket, key, destination, null);
  }

  public TransferResult downloadFile(String bucket, String key, Path destination, String userId)
      throws StorageException {
    accessContext.require(bucket, key, effectiveUser(userId), PermissionLevel.READ);
    long size;
    try (InputStream in = client.getObject(bucket, key)) {
      size = writeObject(in, destination, bucket, key);
    } catch (IOException e) {
      throw new BackendException("Failed to read " + bucket + "/" + key, e);
    }
    logger.info("Downloaded {}/{} to {}", bucket, key, destination);
    return mirrorCopy(destination, bucket, key, size);
  }

  public String readFile(String bucket, String key) throws StorageException {
    return readFile(bucket, key, null);
  }

  /** Returns the object content decoded as UTF-8. */
  public String readFile(String bucket, String key, String userId) throws StorageException {
    accessContext.require(bucket, key, effectiveUser(userId), PermissionLevel.READ);
    byte[] content;
    try (InputStream in = client.getObject(bucket, key)) {
      content = in.readAllBytes();
    } catch (IOException e) {
      throw new BackendException("Failed to read " + bucket + "/" + key, e);
    }
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(content))
          .toString();
    } catch (CharacterCodingException e) {
      throw new DecodeException(bucket + "/" + key + " is not valid UTF-8 text", e);
    }
  }

  public Map<String, String> getObjectMetadata(String bucket, String key, String userId)
      throws StorageException {
    accessContext.require(bucket, key, effectiveUser(userId), PermissionLevel.READ);
    return client.statObject(bucket, key).userMetadata();
  }

  public Deletion deleteFile(String bucket, String key) throws StorageException {
    return deleteFile(bucket, key, null);
  }

  /** A missing object is reported as {@link Deletion#ALREADY_ABSENT}, not as an error. */
  public Deletion deleteFile(String bucket, String key, String userId) throws StorageException {
    authorizeWrite(bucket, key, userId);
    boolean present;
    try {
      client.statObject(bucket, key);
      present = true;
    } catch (NotFoundException e) {
      present = false;
    }
    if (present) {
      client.deleteObject(bucket, key);
      logger.info("Deleted {}/{}", bucket, key);
    } else {
      logger.info("{}/{} is already absent", bucket, key);
    }
    for (LocalMirror each : allMirrors) {
      try {
        each.remove(bucket, key);
      } catch (LocalIOException e) {
        logger.warn("Could not remove mirror copy under {}: {}", each.root(), e.getMessage());
      }
    }
    accessContext.forget(bucket, key);
    return present ? Deletion.DELETED : Deletion.ALREADY_ABSENT;
  }

  public Iterable<String> listFiles(String bucket, String prefix) throws StorageException {
    return listFiles(bucket, prefix, null);
  }

  /**
   * Keys under {@code prefix}, lexicographically ordered. The result is lazy and can be iterated
   * more than once; backend failures during iteration surface as {@link
   * UncheckedStorageException}.
   */
  public Iterable<String> listFiles(String bucket, String prefix, String userId)
      throws StorageException {
    accessContext.require(bucket, null, effectiveUser(userId), PermissionLevel.READ);
    if (!client.bucketExists(bucket)) {
      throw new NotFoundException("Bucket does not exist: " + bucket);
    }
    return client.listObjects(bucket, prefix == null ? "" : prefix);
  }

  /**
   * Deletes a bucket on the mock backend, emptying it first when {@code force} is set. Against the
   * real backend nothing is sent and {@link BucketDeletion#REFUSED_BY_POLICY} is returned.
   */
  public BucketDeletion deleteBucket(String bucket, boolean force) throws StorageException {
    if (!mode.allowsBucketDeletion()) {
      logger.warn("Refusing to delete bucket {} on the {} backend", bucket, mode.id());
      return BucketDeletion.REFUSED_BY_POLICY;
    }
    if (force) {
      emptyBucket(bucket);
    }
    client.deleteBucket(bucket);
    accessContext.forgetBucket(bucket);
    logger.info("Deleted bucket {}", bucket);
    return BucketDeletion.DELETED;
  }

  /**
   * @param bucket limits local removal to one bucket; required when {@code removeBucket} is set
   * @param removeLocal delete the mirror tree(s), if present
   * @param removeBucket empty and delete the bucket; only honoured on the mock backend
   */
  public CleanupReport cleanup(String bucket, boolean removeLocal, boolean removeBucket)
      throws StorageException {
    if (removeBucket && bucket == null) {
      throw new ConfigurationException("A bucket name is required to delete a bucket");
    }

    List<Path> removed = new ArrayList<>();
    if (removeLocal) {
      for (LocalMirror each : allMirrors) {
        if (bucket == null ? each.removeRoot() : each.removeAll(bucket)) {
          removed.add(bucket == null ? each.root() : each.root().resolve(bucket));
        }
      }
      logger.info("Removed {} mirror tree(s)", removed.size());
    }

    if (!removeBucket) {
      return new CleanupReport(removed, 0, BucketDeletion.NOT_REQUESTED);
    }
    if (!mode.allowsBucketDeletion()) {
      logger.warn("Refusing to delete bucket {} on the {} backend", bucket, mode.id());
      return new CleanupReport(removed, 0, BucketDeletion.REFUSED_BY_POLICY);
    }
    int deleted = emptyBucket(bucket);
    client.deleteBucket(bucket);
    accessContext.forgetBucket(bucket);
    logger.info("Deleted bucket {} after removing {} object(s)", bucket, deleted);
    return new CleanupReport(removed, deleted, BucketDeletion.DELETED);
  }

  @Override
  public void close() {
    client.close();
  }

  private int emptyBucket(String bucket) throws StorageException {
    int deleted = 0;
    try {
      Iterable<String> keys = client.listObjects(bucket, "");
      for (List<String> batch : Iterables.partition(keys, ObjectStorageClient.MAX_DELETE_BATCH)) {
        List<String> failed = client.deleteObjects(bucket, batch);
        deleted += batch.size() - failed.size();
        logger.debug("Deleted batch of {} object(s) from {}", batch.size(), bucket);
      }
    } catch (UncheckedStorageException e) {
      throw e.getCause();
    }
    return deleted;
  }

  private String effectiveUser(String userId) {
    return userId != null ? userId : defaultUserId;
  }

  private String authorizeWrite(String bucket, String key, String userId)
      throws StorageException {
    String user = effectiveUser(userId);
    accessContext.require(bucket, key, user, PermissionLevel.WRITE);
    return user;
  }

  private void recordOwner(String bucket, String key, String user) {
    if (user != null && !accessContext.hasObjectEntries(bucket, key)) {
      accessContext.grant(bucket, key, user, PermissionLevel.OWNER);
    }
  }

  private TransferResult mirrorCopy(Path source, String bucket, String key, long size) {
    try {
      Path mirrored = mirror.copyIn(source, bucket, key);
      return new TransferResult(bucket, key, size, mirrored, null);
    } catch (LocalIOException e) {
      logger.warn(
          "Remote copy of {}/{} is stored but the mirror is not: {}",
          bucket,
          key,
          e.getMessage());
      return new TransferResult(bucket, key, size, null, e.getMessage());
    }
  }

  /**
   * Copies a remote stream to {@code destination}. Read failures are backend errors, write
   * failures are local ones.
   */
  private static long writeObject(InputStream in, Path destination, String bucket, String key)
      throws StorageException {
    Path parent = destination.toAbsolutePath().getParent();
    byte[] buffer = new byte[8192];
    long total = 0;
    try {
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (OutputStream out = Files.newOutputStream(destination)) {
        int read;
        while ((read = readChunk(in, buffer, bucket, key)) != -1) {
          out.write(buffer, 0, read);
          total += read;
        }
      }
    } catch (IOException e) {
      throw new LocalIOException(
          "Failed to write " + bucket + "/" + key + " to " + destination, e);
    }
    return total;
  }

  private static int readChunk(InputStream in, byte[] buffer, String bucket, String key)
      throws BackendException {
    try {
      return in.read(buffer);
    } catch (IOException e) {
      throw new BackendException("Failed to read " + bucket + "/" + key, e);
    }
  }

  private static long sourceSize(Path source) throws StorageException {
    if (!Files.isRegularFile(source)) {
      throw new NotFoundException("Source file does not exist: " + source);
    }
    try {
      return Files.size(source);
    } catch (IOException e) {
      throw new LocalIOException("Failed to read file: " + source, e);
    }
  }

  private static Path stage(String content) throws LocalIOException {
    try {
      Path staged = Files.createTempFile("s3sim-", ".upload");
      Files.writeString(staged, content, StandardCharsets.UTF_8);
      return staged;
    } catch (IOException e) {
      throw new LocalIOException("Failed to stage content for upload", e);
    }
  }

  private static void deleteStaged(Path staged) {
    try {
      Files.deleteIfExists(staged);
    } catch (IOException e) {
      logger.warn("Could not delete staging file {}", staged, e);
    }
  }
}
