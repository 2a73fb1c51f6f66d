package com.codeheadsystems.hivemind.server.store.mvstore;

import com.codeheadsystems.hivemind.server.store.Session;
import com.codeheadsystems.hivemind.server.store.SessionStore;
import java.time.Instant;
import java.util.Optional;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

/**
 * {@link SessionStore} in an MVStore map of token to JSON. Expired sessions are evicted on load.
 */
public class MVStoreSessionStore implements SessionStore {

  private final MVStore store;
  private final MVMap<String, String> sessions;
  private final JsonValueCodec codec;

  MVStoreSessionStore(MVStore store, String mapName, JsonValueCodec codec) {
    this.store = store;
    this.sessions = store.openMap(mapName);
    this.codec = codec;
  }

  @Override
  public void store(String token, Session session) {
    sessions.put(token, codec.write(session));
    store.commit();
  }

  @Override
  public Optional<Session> load(String token, Instant now) {
    String json = sessions.get(token);
    if (json == null) {
      return Optional.empty();
    }
    Session session = codec.read(json, Session.class);
    if (session.isExpired(now)) {
      revoke(token);
      return Optional.empty();
    }
    return Optional.of(session);
  }

  @Override
  public void revoke(String token) {
    if (sessions.remove(token) != null) {
      store.commit();
    }
  }
}
