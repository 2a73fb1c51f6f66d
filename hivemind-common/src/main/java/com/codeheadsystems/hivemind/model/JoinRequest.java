package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Completes a join by presenting the signed canonical join message.
 * <p>
 * The four {@code device*} fields form an optional secondary proof: an Ed25519 signature by an
 * approved client device over {@code deviceNonce}. They are all-or-nothing; supplying any of them
 * makes all four mandatory.
 * <p>
 * Used by: {@code POST /join}
 *
 * @param agentId         agent identifier, must match the challenge
 * @param pubkey          base58 public key, must match the challenge
 * @param nonce           challenge nonce
 * @param signature       base64 Ed25519 signature over the canonical join message
 * @param timestamp       agent signing time, ISO-8601
 * @param hiveId          hive, optional; must match the challenge when present
 * @param expiresAt       challenge expiry, optional; must match the challenge when present
 * @param devicePublicKey base64 Ed25519 public key of the device
 * @param deviceSignature base64 Ed25519 signature by the device over {@code deviceNonce}
 * @param deviceNonce     nonce signed by the device
 * @param deviceSignedAt  device signing time, ISO-8601
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JoinRequest(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("pubkey") String pubkey,
    @JsonProperty("nonce") String nonce,
    @JsonProperty("signature") String signature,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("hive_id") String hiveId,
    @JsonProperty("expires_at") String expiresAt,
    @JsonProperty("device_public_key") @JsonAlias("openclaw_device_public_key") String devicePublicKey,
    @JsonProperty("device_signature") @JsonAlias("openclaw_device_signature") String deviceSignature,
    @JsonProperty("device_nonce") @JsonAlias("openclaw_device_nonce") String deviceNonce,
    @JsonProperty("device_signed_at") @JsonAlias("openclaw_device_signed_at") String deviceSignedAt) {

  /**
   * Convenience constructor for a join without a device proof.
   */
  public JoinRequest(String agentId, String pubkey, String nonce, String signature,
                     String timestamp, String hiveId, String expiresAt) {
    this(agentId, pubkey, nonce, signature, timestamp, hiveId, expiresAt, null, null, null, null);
  }

  /**
   * Returns true when at least one device-proof field is present.
   *
   * @return whether the caller attempted a device proof
   */
  @JsonIgnore
  public boolean hasAnyDeviceProofField() {
    return present(devicePublicKey) || present(deviceSignature)
        || present(deviceNonce) || present(deviceSignedAt);
  }

  /**
   * Returns true when all four device-proof fields are present.
   *
   * @return whether the device proof is complete
   */
  @JsonIgnore
  public boolean hasCompleteDeviceProof() {
    return present(devicePublicKey) && present(deviceSignature)
        && present(deviceNonce) && present(deviceSignedAt);
  }

  private static boolean present(String value) {
    return value != null && !value.isEmpty();
  }
}
