package dev.totis.s3sim.response;

import java.nio.file.Path;
import java.util.List;

public record CleanupReport(
    List<Path> removedMirrorPaths, int objectsDeleted, BucketDeletion bucketDeletion) {

  public CleanupReport {
    removedMirrorPaths = List.copyOf(removedMirrorPaths);
  }
}
