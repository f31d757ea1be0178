package dev.totis.s3sim.response;

public enum Deletion {
  DELETED,
  ALREADY_ABSENT
}
