package com.codeheadsystems.hivemind.server.auth;

import com.codeheadsystems.hivemind.server.hive.HiveRegistry;
import com.codeheadsystems.hivemind.server.store.Session;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves bearer tokens to sessions. Sessions are never renewed; an expired one is deleted the
 * first time it is presented.
 */
@Singleton
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final HiveRegistry hiveRegistry;
  private final Clock clock;

  /**
   * Instantiates a new Session manager.
   *
   * @param hiveRegistry hive routing
   * @param clock        time source
   */
  @Inject
  public SessionManager(final HiveRegistry hiveRegistry, final Clock clock) {
    this.hiveRegistry = hiveRegistry;
    this.clock = clock;
  }

  /**
   * Validates a token.
   *
   * @param token bearer token, may be null
   * @return the live session, or empty
   */
  public Optional<Session> validate(final String token) {
    Optional<Session> session = SessionTokens.hiveOf(token)
        .flatMap(hiveRegistry::find)
        .flatMap(hive -> hive.exclusive(storage -> storage.sessions().load(token, clock.instant())));
    if (session.isEmpty()) {
      log.debug("validate: unknown or expired token");
    }
    return session;
  }

  /**
   * Revokes a session. Unknown tokens are ignored.
   *
   * @param token bearer token
   */
  public void revoke(final String token) {
    SessionTokens.hiveOf(token)
        .flatMap(hiveRegistry::find)
        .ifPresent(hive -> hive.exclusive(storage -> {
          storage.sessions().revoke(token);
          return null;
        }));
  }
}
