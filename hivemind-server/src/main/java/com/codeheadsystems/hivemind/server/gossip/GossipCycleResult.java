package com.codeheadsystems.hivemind.server.gossip;

/**
 * Totals of one gossip cycle across all (peer, hive) pairs.
 *
 * @param accepted    records newly stored
 * @param skipped     records dropped as malformed, for another hive, or already present
 * @param failedPeers distinct peers that failed for at least one hive
 */
public record GossipCycleResult(int accepted, int skipped, int failedPeers) {

  public static final GossipCycleResult EMPTY = new GossipCycleResult(0, 0, 0);
}
