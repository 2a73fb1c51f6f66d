package com.codeheadsystems.hivemind.server.store.memory;

import com.codeheadsystems.hivemind.server.store.PeerCursorStore;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent {@link PeerCursorStore}. Cursors reset to 0 on restart, which only costs a
 * re-fetch that deduplication absorbs.
 */
public class InMemoryPeerCursorStore implements PeerCursorStore {

  private final ConcurrentHashMap<String, Long> cursors = new ConcurrentHashMap<>();

  @Override
  public long get(String peer) {
    return cursors.getOrDefault(peer, 0L);
  }

  @Override
  public long advance(String peer, long sinceMs) {
    return cursors.merge(peer, sinceMs, Math::max);
  }
}
