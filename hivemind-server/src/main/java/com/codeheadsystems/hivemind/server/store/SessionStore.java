package com.codeheadsystems.hivemind.server.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Sessions of one hive, keyed by bearer token.
 * <p>
 * Accessed only through {@link com.codeheadsystems.hivemind.server.hive.Hive#exclusive}.
 */
public interface SessionStore {

  /**
   * Stores a session under its token.
   *
   * @param token   bearer token
   * @param session session data
   */
  void store(String token, Session session);

  /**
   * Loads a session. A session past its expiry is deleted and reported as absent.
   *
   * @param token bearer token
   * @param now   current time
   * @return the live session, or empty
   */
  Optional<Session> load(String token, Instant now);

  /**
   * Deletes a session; a no-op when absent.
   *
   * @param token bearer token
   */
  void revoke(String token);
}
