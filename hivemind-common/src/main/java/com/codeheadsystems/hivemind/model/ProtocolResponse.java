package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Protocol constants an agent needs before joining.
 * <p>
 * Used by: {@code GET /protocol}
 *
 * @param protocolVersion protocol version
 * @param hiveId          the server's default hive
 * @param challengeTtlMs  challenge lifetime
 * @param sessionTtlMs    session lifetime
 * @param maxClockSkewMs  tolerated difference between the agent's timestamp and the server clock
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProtocolResponse(
    @JsonProperty("protocol_version") String protocolVersion,
    @JsonProperty("hive_id") String hiveId,
    @JsonProperty("challenge_ttl_ms") long challengeTtlMs,
    @JsonProperty("session_ttl_ms") long sessionTtlMs,
    @JsonProperty("max_clock_skew_ms") long maxClockSkewMs) {
}
