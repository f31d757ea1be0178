package dev.totis.s3sim.response;

public enum BucketCreation {
  CREATED,
  /** The bucket already existed and belongs to the caller. */
  ALREADY_OWNED
}
