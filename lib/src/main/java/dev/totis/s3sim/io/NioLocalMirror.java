package dev.totis.s3sim.io;

import dev.totis.s3sim.exception.LocalIOException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NioLocalMirror implements LocalMirror {
  private static final Logger logger = LoggerFactory.getLogger(NioLocalMirror.class);

  private final Path root;

  public NioLocalMirror(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public Path root() {
    return root;
  }

  @Override
  public void ensureDir(Path path) throws LocalIOException {
    try {
      Files.createDirectories(path);
    } catch (IOException e) {
      throw new LocalIOException("Failed to create directory: " + path, e);
    }
  }

  @Override
  public Path pathOf(String bucket, String key) throws LocalIOException {
    Path bucketDir = bucketDir(bucket);
    Path path = bucketDir.resolve(key).normalize();
    if (!path.startsWith(bucketDir) || path.equals(bucketDir)) {
      throw new LocalIOException("Object key escapes the mirror: " + bucket + "/" + key);
    }
    return path;
  }

  @Override
  public boolean exists(String bucket, String key) throws LocalIOException {
    return Files.isRegularFile(pathOf(bucket, key));
  }

  @Override
  public Path copyIn(Path source, String bucket, String key) throws LocalIOException {
    if (!Files.isRegularFile(source)) {
      throw new LocalIOException("Source file does not exist: " + source);
    }
    Path target = pathOf(bucket, key);
    if (source.toAbsolutePath().normalize().equals(target)) {
      return target;
    }
    ensureDir(target.getParent());
    try {
      Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new LocalIOException("Failed to copy " + source + " to " + target, e);
    }
    logger.debug("Mirrored {} to {}", source, target);
    return target;
  }

  @Override
  public void copyOut(String bucket, String key, Path destination) throws LocalIOException {
    Path source = pathOf(bucket, key);
    if (!Files.isRegularFile(source)) {
      throw new LocalIOException("Object is not mirrored: " + bucket + "/" + key);
    }
    Path parent = destination.toAbsolutePath().getParent();
    if (parent != null) {
      ensureDir(parent);
    }
    try {
      Files.copy(source, destination, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new LocalIOException("Failed to copy " + source + " to " + destination, e);
    }
  }

  @Override
  public boolean remove(String bucket, String key) throws LocalIOException {
    Path path = pathOf(bucket, key);
    try {
      return Files.deleteIfExists(path);
    } catch (IOException e) {
      throw new LocalIOException("Failed to delete: " + path, e);
    }
  }

  @Override
  public boolean removeAll(String bucket) throws LocalIOException {
    return deleteTree(bucketDir(bucket));
  }

  @Override
  public boolean removeRoot() throws LocalIOException {
    return deleteTree(root);
  }

  private Path bucketDir(String bucket) throws LocalIOException {
    Path dir = root.resolve(bucket).normalize();
    if (bucket.isEmpty() || !root.equals(dir.getParent())) {
      throw new LocalIOException("Invalid bucket name for mirror: " + bucket);
    }
    return dir;
  }

  private static boolean deleteTree(Path dir) throws LocalIOException {
    if (!Files.exists(dir)) {
      return false;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths
          .sorted(Comparator.reverseOrder())
          .forEach(
              path -> {
                try {
                  Files.delete(path);
                } catch (IOException e) {
                  throw new UncheckedIOException(e);
                }
              });
    } catch (IOException | UncheckedIOException e) {
      throw new LocalIOException("Failed to delete directory: " + dir, e);
    }
    logger.debug("Removed mirror tree {}", dir);
    return true;
  }
}
