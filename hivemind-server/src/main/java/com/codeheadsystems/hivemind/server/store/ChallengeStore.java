package com.codeheadsystems.hivemind.server.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Outstanding challenges of one hive, keyed by nonce.
 * <p>
 * Accessed only through {@link com.codeheadsystems.hivemind.server.hive.Hive#exclusive}.
 */
public interface ChallengeStore {

  /**
   * Stores a challenge. A nonce collision overwrites the previous entry.
   *
   * @param challenge the challenge
   */
  void put(Challenge challenge);

  /**
   * Looks a challenge up without checking expiry.
   *
   * @param nonce the nonce
   * @return the challenge, or empty
   */
  Optional<Challenge> get(String nonce);

  /**
   * Deletes a challenge; a no-op when absent.
   *
   * @param nonce the nonce
   */
  void delete(String nonce);

  /**
   * Deletes every challenge whose expiry is before {@code now}.
   *
   * @param now current time
   * @return number of challenges removed
   */
  int evictExpired(Instant now);
}
