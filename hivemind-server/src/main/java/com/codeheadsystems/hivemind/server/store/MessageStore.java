package com.codeheadsystems.hivemind.server.store;

import com.codeheadsystems.hivemind.model.HiveMessage;
import java.util.List;
import java.util.Optional;

/**
 * Append-only message log of one hive.
 * <p>
 * Ids start at 1 and are allocated without gaps in insertion order. A {@code uid} is stored at
 * most once. Accessed only through {@link com.codeheadsystems.hivemind.server.hive.Hive#exclusive},
 * which makes the dedup check, id allocation and insert a single step.
 */
public interface MessageStore {

  /**
   * Appends a message unless its uid is already present.
   *
   * @param candidate message without id
   * @return the stored message, or empty if the uid was already present
   */
  Optional<HiveMessage> append(MessageCandidate candidate);

  /**
   * Messages with {@code id > sinceId}, oldest first.
   *
   * @param sinceId exclusive lower bound
   * @param limit   maximum number of messages
   * @return the messages
   */
  List<HiveMessage> readSince(long sinceId, int limit);

  /**
   * Messages with {@code createdAtMs >= sinceMs}, ordered by creation time then id.
   *
   * @param sinceMs inclusive lower bound, epoch milliseconds
   * @param limit   maximum number of messages
   * @return the messages
   */
  List<HiveMessage> readSinceTime(long sinceMs, int limit);

  long count();

  boolean contains(String uid);
}
