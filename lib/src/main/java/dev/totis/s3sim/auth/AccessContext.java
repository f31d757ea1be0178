package dev.totis.s3sim.auth;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import dev.totis.s3sim.exception.PermissionDeniedException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory permission table for one facade instance. Entries are keyed by resource (a bucket, or
 * an object inside it) and user. Nothing is persisted and there is no synchronization.
 *
 * <p>Lookups check the object entry first and fall back to the bucket-wide entry. A bucket that
 * has no entries at all is unmanaged: every user passes.
 */
public class AccessContext {
  private static final Logger logger = LoggerFactory.getLogger(AccessContext.class);

  private final Table<Resource, String, PermissionLevel> entries = HashBasedTable.create();

  private record Resource(String bucket, String key) {
    static Resource bucket(String bucket) {
      return new Resource(bucket, null);
    }

    static Resource object(String bucket, String key) {
      return new Resource(bucket, Objects.requireNonNull(key, "key"));
    }
  }

  public void grant(String bucket, String key, String userId, PermissionLevel level) {
    entries.put(Resource.object(bucket, key), userId, level);
  }

  public void grantBucket(String bucket, String userId, PermissionLevel level) {
    entries.put(Resource.bucket(bucket), userId, level);
  }

  public boolean check(String bucket, String key, String userId, PermissionLevel required) {
    if (!isManaged(bucket)) {
      return true;
    }
    Optional<PermissionLevel> level =
        key == null ? Optional.empty() : lookup(Resource.object(bucket, key), userId);
    if (level.isEmpty()) {
      level = lookup(Resource.bucket(bucket), userId);
    }
    return level.map(l -> l.satisfies(required)).orElse(false);
  }

  /**
   * Throws unless {@code userId} holds {@code required} on the resource. A null user skips the
   * check.
   */
  public void require(String bucket, String key, String userId, PermissionLevel required)
      throws PermissionDeniedException {
    if (userId == null) {
      return;
    }
    if (!check(bucket, key, userId, required)) {
      String resource = key == null ? bucket : bucket + "/" + key;
      logger.debug("User {} lacks {} on {}", userId, required, resource);
      throw new PermissionDeniedException(
          "User '" + userId + "' does not have " + required + " permission on " + resource);
    }
  }

  public boolean hasObjectEntries(String bucket, String key) {
    return entries.containsRow(Resource.object(bucket, key));
  }

  /** Drops the entries of one object. */
  public void forget(String bucket, String key) {
    entries.row(Resource.object(bucket, key)).clear();
  }

  /** Drops every entry of a bucket, including its objects. */
  public void forgetBucket(String bucket) {
    entries.rowKeySet().removeIf(resource -> resource.bucket().equals(bucket));
  }

  public boolean isManaged(String bucket) {
    return entries.rowKeySet().stream().anyMatch(resource -> resource.bucket().equals(bucket));
  }

  private Optional<PermissionLevel> lookup(Resource resource, String userId) {
    Map<String, PermissionLevel> row = entries.row(resource);
    return Optional.ofNullable(row.get(userId));
  }
}
