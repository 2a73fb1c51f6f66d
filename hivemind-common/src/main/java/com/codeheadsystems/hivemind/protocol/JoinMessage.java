package com.codeheadsystems.hivemind.protocol;

import java.nio.charset.StandardCharsets;

/**
 * The canonical message an agent signs to prove possession of its key during {@code POST /join}.
 * <p>
 * The signed text is the newline-joined sequence, in this exact order:
 * <pre>
 * OPENCLAW_HIVEMIND_V1
 * agentId
 * pubkey            (base58)
 * nonce
 * hiveId
 * challengeExpiresAt (verbatim from the challenge response)
 * timestamp          (agent clock, ISO-8601)
 * </pre>
 * Binding the challenge expiry and hive into the signature prevents a signature produced for one
 * hive or challenge from being replayed against another.
 *
 * @param agentId            agent identifier the challenge was issued to
 * @param pubkey             base58-encoded Ed25519 public key of the agent
 * @param nonce              challenge nonce
 * @param hiveId             hive the challenge binds to
 * @param challengeExpiresAt challenge expiry exactly as returned by the server
 * @param timestamp          signing time reported by the agent
 */
public record JoinMessage(
    String agentId,
    String pubkey,
    String nonce,
    String hiveId,
    String challengeExpiresAt,
    String timestamp) {

  /**
   * Returns the canonical newline-joined text.
   *
   * @return the text that is signed
   */
  public String canonical() {
    return String.join("\n",
        HivemindProtocol.PROTOCOL_VERSION,
        agentId,
        pubkey,
        nonce,
        hiveId,
        challengeExpiresAt,
        timestamp);
  }

  /**
   * Returns the UTF-8 bytes of {@link #canonical()}.
   *
   * @return the bytes that are signed
   */
  public byte[] bytes() {
    return canonical().getBytes(StandardCharsets.UTF_8);
  }
}
