package dev.totis.s3sim.response;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of an upload or download. The remote side succeeded; {@code mirrorWarning} is set when
 * the local mirror copy could not be written, in which case {@code mirrorPath} is null.
 */
public record TransferResult(
    String bucket, String key, long size, Path mirrorPath, String mirrorWarning) {

  public boolean mirrored() {
    return mirrorWarning == null;
  }

  public Optional<String> warning() {
    return Optional.ofNullable(mirrorWarning);
  }
}
