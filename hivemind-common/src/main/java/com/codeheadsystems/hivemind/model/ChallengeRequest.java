package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request to start a join: the agent announces its identity and the hive it wants to join.
 * <p>
 * Used by: {@code POST /challenge}
 *
 * @param agentId agent identifier chosen by the agent
 * @param pubkey  base58-encoded Ed25519 public key
 * @param hiveId  hive to join; the server's default hive when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChallengeRequest(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("pubkey") String pubkey,
    @JsonProperty("hive_id") String hiveId) {
}
