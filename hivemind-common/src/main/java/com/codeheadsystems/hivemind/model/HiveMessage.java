package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A message stored in a hive's log. Immutable once stored.
 *
 * @param id          per-hive, per-server sequence number starting at 1
 * @param uid         globally unique identifier used for deduplication across servers
 * @param ts          creation time, ISO-8601 UTC
 * @param createdAtMs creation time in epoch milliseconds; the gossip cursor is keyed on it
 * @param agentId     author
 * @param hiveId      owning hive
 * @param content     message text
 * @param channel     channel within the hive
 * @param source      {@code local} at the accepting server, {@code gossip} elsewhere
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HiveMessage(
    @JsonProperty("id") long id,
    @JsonProperty("uid") String uid,
    @JsonProperty("ts") String ts,
    @JsonProperty("createdAtMs") long createdAtMs,
    @JsonProperty("agentId") String agentId,
    @JsonProperty("hiveId") String hiveId,
    @JsonProperty("content") String content,
    @JsonProperty("channel") String channel,
    @JsonProperty("source") MessageSource source) {
}
