package com.codeheadsystems.hivemind.server.gossip;

import com.codeheadsystems.hivemind.model.GossipBatch;

/**
 * Fetches a page of a peer's gossip feed.
 */
public interface GossipPeerClient {

  /**
   * Reads a peer's messages for a hive created at or after {@code sinceMs}.
   *
   * @param peer    peer base URL without trailing slash
   * @param hiveId  hive to read
   * @param sinceMs inclusive lower bound
   * @return the raw batch
   * @throws GossipPeerException on transport failure, non-2xx status or an unreadable body
   */
  GossipBatch fetch(String peer, String hiveId, long sinceMs);
}
