package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code GET /health}
 *
 * @param status   always {@code ok}
 * @param protocol protocol version
 * @param hiveId   the server's default hive
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthResponse(
    @JsonProperty("status") String status,
    @JsonProperty("protocol") String protocol,
    @JsonProperty("hive_id") String hiveId) {
}
