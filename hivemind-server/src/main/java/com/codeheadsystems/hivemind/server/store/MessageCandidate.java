package com.codeheadsystems.hivemind.server.store;

import com.codeheadsystems.hivemind.model.HiveMessage;
import com.codeheadsystems.hivemind.model.MessageSource;

/**
 * A message waiting for its per-hive id.
 *
 * @param uid         global identifier used for deduplication
 * @param ts          creation time, wire form
 * @param createdAtMs creation time, epoch milliseconds
 * @param agentId     author
 * @param hiveId      owning hive
 * @param content     message text
 * @param channel     channel
 * @param source      where the message came from
 */
public record MessageCandidate(
    String uid,
    String ts,
    long createdAtMs,
    String agentId,
    String hiveId,
    String content,
    String channel,
    MessageSource source) {

  /**
   * Binds the candidate to an allocated id.
   *
   * @param id the id
   * @return the stored form
   */
  public HiveMessage withId(long id) {
    return new HiveMessage(id, uid, ts, createdAtMs, agentId, hiveId, content, channel, source);
  }
}
