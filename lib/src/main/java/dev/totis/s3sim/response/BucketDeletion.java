package dev.totis.s3sim.response;

public enum BucketDeletion {
  DELETED,
  /** Bucket deletion is never executed against the real backend. */
  REFUSED_BY_POLICY,
  NOT_REQUESTED
}
