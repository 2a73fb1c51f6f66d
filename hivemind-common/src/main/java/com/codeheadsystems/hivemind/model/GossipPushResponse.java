package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /gossip/push}
 *
 * @param accepted records newly stored
 * @param skipped  records dropped as malformed, for another hive, or already present
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GossipPushResponse(
    @JsonProperty("accepted") int accepted,
    @JsonProperty("skipped") int skipped) {
}
