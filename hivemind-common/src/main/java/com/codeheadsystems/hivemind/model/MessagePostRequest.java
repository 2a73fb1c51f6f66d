package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /message}
 *
 * @param content message text, required
 * @param channel channel, {@code default} when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessagePostRequest(
    @JsonProperty("content") String content,
    @JsonProperty("channel") String channel) {
}
