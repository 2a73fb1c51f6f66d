package com.codeheadsystems.hivemind.server.store;

import java.time.Instant;

/**
 * A single-use join challenge.
 *
 * @param agentId   agent the challenge was issued to
 * @param pubkey    base58 public key the agent announced
 * @param nonce     the nonce, also the storage key
 * @param hiveId    hive the challenge binds to
 * @param expiresAt expiry; the wire form is signed by the agent
 */
public record Challenge(String agentId, String pubkey, String nonce, String hiveId, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return expiresAt.isBefore(now);
  }
}
