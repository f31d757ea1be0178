package dev.totis.s3sim.auth;

/** Ordered access levels: OWNER includes WRITE, WRITE includes READ. */
public enum PermissionLevel {
  READ,
  WRITE,
  OWNER;

  public boolean satisfies(PermissionLevel required) {
    return compareTo(required) >= 0;
  }
}
