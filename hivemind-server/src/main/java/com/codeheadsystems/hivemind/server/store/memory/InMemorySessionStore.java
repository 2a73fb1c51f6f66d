package com.codeheadsystems.hivemind.server.store.memory;

import com.codeheadsystems.hivemind.server.store.Session;
import com.codeheadsystems.hivemind.server.store.SessionStore;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired sessions are lazily evicted on {@link #load}. All sessions are lost on server restart.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

  @Override
  public void store(String token, Session session) {
    sessions.put(token, session);
    log.debug("Stored session agent={} hive={}", session.agentId(), session.hiveId());
  }

  @Override
  public Optional<Session> load(String token, Instant now) {
    Session session = sessions.get(token);
    if (session == null) {
      return Optional.empty();
    }
    if (session.isExpired(now)) {
      sessions.remove(token);
      log.debug("Evicted expired session agent={}", session.agentId());
      return Optional.empty();
    }
    return Optional.of(session);
  }

  @Override
  public void revoke(String token) {
    if (sessions.remove(token) != null) {
      log.debug("Revoked session");
    }
  }
}
