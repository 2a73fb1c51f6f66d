package com.codeheadsystems.hivemind.server.store;

import java.time.Instant;

/**
 * An authenticated agent session, keyed by its bearer token.
 *
 * @param agentId   authenticated agent
 * @param pubkey    base58 public key proven at join
 * @param hiveId    hive the session may read and post to
 * @param expiresAt expiry; never renewed
 */
public record Session(String agentId, String pubkey, String hiveId, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return expiresAt.isBefore(now);
  }
}
