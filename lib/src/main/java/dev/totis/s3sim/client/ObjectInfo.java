package dev.totis.s3sim.client;

import java.util.Map;

public record ObjectInfo(String bucket, String key, long size, Map<String, String> userMetadata) {
  public ObjectInfo {
    userMetadata = userMetadata == null ? Map.of() : Map.copyOf(userMetadata);
  }
}
