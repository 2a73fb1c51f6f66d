package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a successful join.
 *
 * @param sessionToken opaque bearer token for {@code /message} and {@code /messages}
 * @param expiresAt    session expiry, ISO-8601 UTC
 * @param agentId      authenticated agent
 * @param hiveId       hive the session belongs to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JoinResponse(
    @JsonProperty("session_token") String sessionToken,
    @JsonProperty("expires_at") String expiresAt,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("hive_id") String hiveId) {
}
