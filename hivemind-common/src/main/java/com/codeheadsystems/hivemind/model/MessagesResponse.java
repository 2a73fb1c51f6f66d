package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code GET /messages}
 *
 * @param hiveId   hive of the caller's session
 * @param messages messages after the requested cursor, oldest first
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessagesResponse(
    @JsonProperty("hive_id") String hiveId,
    @JsonProperty("messages") List<HiveMessage> messages) {
}
