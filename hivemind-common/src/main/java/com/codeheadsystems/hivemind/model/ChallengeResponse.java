package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A freshly issued challenge. The agent signs the canonical join message built from these values
 * and must echo {@code expiresAt} back verbatim.
 *
 * @param protocolVersion protocol version the server speaks
 * @param nonce           single-use challenge nonce
 * @param hiveId          hive the challenge is bound to
 * @param expiresAt       challenge expiry, ISO-8601 UTC with milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChallengeResponse(
    @JsonProperty("protocol_version") String protocolVersion,
    @JsonProperty("nonce") String nonce,
    @JsonProperty("hive_id") String hiveId,
    @JsonProperty("expires_at") String expiresAt) {
}
