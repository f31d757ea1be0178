package dev.totis.s3sim.io;

import dev.totis.s3sim.exception.LocalIOException;
import java.nio.file.Path;

/**
 * Shadow copy of bucket contents under a root directory, laid out as {@code
 * <root>/<bucket>/<key>}. The mirror is a best-effort cache and never the source of truth; writes
 * are not rolled back on failure.
 */
public interface LocalMirror {
  Path root();

  /** Creates the directory and its parents. Succeeds if it already exists. */
  void ensureDir(Path path) throws LocalIOException;

  Path pathOf(String bucket, String key) throws LocalIOException;

  boolean exists(String bucket, String key) throws LocalIOException;

  /** Copies {@code source} into the mirror and returns the mirrored path. */
  Path copyIn(Path source, String bucket, String key) throws LocalIOException;

  /** Copies the mirrored object out to {@code destination}. */
  void copyOut(String bucket, String key, Path destination) throws LocalIOException;

  /**
   * Removes one mirrored object.
   *
   * @return false if there was nothing to remove
   */
  boolean remove(String bucket, String key) throws LocalIOException;

  /**
   * Removes a mirrored bucket tree.
   *
   * @return false if the bucket was not mirrored
   */
  boolean removeAll(String bucket) throws LocalIOException;

  /**
   * Removes the whole mirror root.
   *
   * @return false if the root did not exist
   */
  boolean removeRoot() throws LocalIOException;
}
