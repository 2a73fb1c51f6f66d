package com.codeheadsystems.hivemind.server.store;

/**
 * Per-peer gossip high-water marks of one hive, in epoch milliseconds.
 */
public interface PeerCursorStore {

  /**
   * Returns the cursor for a peer.
   *
   * @param peer peer base URL
   * @return the cursor, 0 when the peer was never polled
   */
  long get(String peer);

  /**
   * Moves the cursor forward. A value lower than the current cursor is ignored.
   *
   * @param peer    peer base URL
   * @param sinceMs new high-water mark
   * @return the cursor after the call
   */
  long advance(String peer, long sinceMs);
}
