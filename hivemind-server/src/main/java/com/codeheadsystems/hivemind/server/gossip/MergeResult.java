package com.codeheadsystems.hivemind.server.gossip;

/**
 * Outcome of merging one batch of peer records into a hive.
 *
 * @param accepted           records newly stored
 * @param skipped            records dropped as malformed, for another hive, or already present
 * @param maxAcceptedCreated highest {@code createdAtMs} among newly stored records, or -1
 */
public record MergeResult(int accepted, int skipped, long maxAcceptedCreated) {

  public static final MergeResult EMPTY = new MergeResult(0, 0, -1L);

  public boolean hasAccepted() {
    return maxAcceptedCreated >= 0;
  }
}
