package com.codeheadsystems.hivemind.server.store.mvstore;

import com.codeheadsystems.hivemind.server.store.PeerCursorStore;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

/**
 * {@link PeerCursorStore} in an MVStore map of peer to cursor.
 */
public class MVStorePeerCursorStore implements PeerCursorStore {

  private final MVStore store;
  private final MVMap<String, Long> cursors;

  MVStorePeerCursorStore(MVStore store, String mapName) {
    this.store = store;
    this.cursors = store.openMap(mapName);
  }

  @Override
  public long get(String peer) {
    Long cursor = cursors.get(peer);
    return cursor == null ? 0L : cursor;
  }

  @Override
  public long advance(String peer, long sinceMs) {
    long current = get(peer);
    if (sinceMs <= current) {
      return current;
    }
    cursors.put(peer, sinceMs);
    store.commit();
    return sinceMs;
  }
}
