package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code GET /gossip/messages}
 *
 * @param hiveId       hive the feed was read from
 * @param serverTimeMs the serving peer's clock, epoch milliseconds
 * @param messages     messages at or after the requested time, oldest first
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GossipFeedResponse(
    @JsonProperty("hive_id") String hiveId,
    @JsonProperty("server_time_ms") long serverTimeMs,
    @JsonProperty("messages") List<HiveMessage> messages) {
}
