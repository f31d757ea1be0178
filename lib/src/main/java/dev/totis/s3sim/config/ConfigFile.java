package dev.totis.s3sim.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Recognized keys of the JSON configuration file. Every key is optional. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConfigFile(
    @JsonProperty("endpoint_url") String endpointUrl,
    @JsonProperty("region") String region,
    @JsonProperty("default_user_id") String defaultUserId) {

  public static final ConfigFile EMPTY = new ConfigFile(null, null, null);
}
