package com.codeheadsystems.hivemind.server.gossip;

import com.codeheadsystems.hivemind.model.GossipBatch;
import com.codeheadsystems.hivemind.model.GossipFeedResponse;
import com.codeheadsystems.hivemind.model.GossipPushResponse;
import com.codeheadsystems.hivemind.model.HiveMessage;
import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import com.codeheadsystems.hivemind.server.hive.Hive;
import com.codeheadsystems.hivemind.server.hive.HiveIds;
import com.codeheadsystems.hivemind.server.hive.HiveRegistry;
import com.codeheadsystems.hivemind.server.store.HiveStorage;
import com.codeheadsystems.hivemind.server.store.MessageCandidate;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the peer-facing side of gossip: the pull feed and the push endpoint. Also merges pulled
 * batches for the {@link GossipEngine}.
 */
@Singleton
public class GossipManager {

  private static final Logger log = LoggerFactory.getLogger(GossipManager.class);

  public static final int MAX_BATCH = 500;

  private final HivemindServerConfig config;
  private final HiveRegistry hiveRegistry;
  private final Clock clock;

  /**
   * Instantiates a new Gossip manager.
   *
   * @param config       server settings
   * @param hiveRegistry hive routing
   * @param clock        time source
   */
  @Inject
  public GossipManager(final HivemindServerConfig config,
                       final HiveRegistry hiveRegistry,
                       final Clock clock) {
    this.config = config;
    this.hiveRegistry = hiveRegistry;
    this.clock = clock;
  }

  /**
   * Messages of a hive created at or after {@code sinceMs}, oldest first.
   *
   * @param hiveId  hive, the default hive when blank
   * @param sinceMs inclusive lower bound
   * @param limit   page size, clamped to [1, 500]
   * @return the feed page
   */
  public GossipFeedResponse feed(final String hiveId, final long sinceMs, final int limit) {
    String target = resolveHive(hiveId);
    int clamped = Math.min(MAX_BATCH, Math.max(1, limit));
    List<HiveMessage> messages = hiveRegistry.find(target)
        .map(hive -> hive.exclusive(storage -> storage.messages().readSinceTime(sinceMs, clamped)))
        .orElse(List.of());
    return new GossipFeedResponse(target, clock.millis(), messages);
  }

  /**
   * Accepts a batch pushed by a peer.
   *
   * @param batch the batch, may be null
   * @return counts of accepted and skipped records
   */
  public GossipPushResponse push(final GossipBatch batch) {
    if (batch == null) {
      return new GossipPushResponse(0, 0);
    }
    List<JsonNode> records = batch.records();
    if (records.isEmpty()) {
      return new GossipPushResponse(0, 0);
    }
    MergeResult result = merge(resolveHive(batch.hiveId()), records);
    log.debug("push(hive={}, accepted={}, skipped={})", batch.hiveId(), result.accepted(), result.skipped());
    return new GossipPushResponse(result.accepted(), result.skipped());
  }

  /**
   * Normalizes and appends records to a hive in one exclusive step. A hive not yet known locally is
   * created only when the batch holds at least one well-formed record for it.
   *
   * @param hiveId  target hive
   * @param records raw records
   * @return the merge outcome
   */
  public MergeResult merge(final String hiveId, final List<JsonNode> records) {
    if (records.isEmpty()) {
      return MergeResult.EMPTY;
    }
    Optional<Hive> hive = hiveRegistry.find(hiveId);
    if (hive.isEmpty()) {
      if (!HiveIds.isValid(hiveId) || !holdsWellFormedRecord(hiveId, records)) {
        log.debug("merge: nothing usable for unknown hive, {} record(s) skipped", records.size());
        return new MergeResult(0, records.size(), -1L);
      }
      hive = Optional.of(hiveRegistry.hive(hiveId));
    }
    return hive.get().exclusive(storage -> mergeInto(storage, hiveId, records));
  }

  private static boolean holdsWellFormedRecord(String hiveId, List<JsonNode> records) {
    return records.stream().anyMatch(record -> GossipRecords.normalize(record, hiveId).isPresent());
  }

  private static MergeResult mergeInto(HiveStorage storage, String hiveId, List<JsonNode> records) {
    int accepted = 0;
    int skipped = 0;
    long maxAccepted = -1L;
    for (JsonNode record : records) {
      Optional<MessageCandidate> candidate = GossipRecords.normalize(record, hiveId);
      if (candidate.isEmpty()) {
        skipped++;
        continue;
      }
      if (storage.messages().append(candidate.get()).isPresent()) {
        accepted++;
        maxAccepted = Math.max(maxAccepted, candidate.get().createdAtMs());
      } else {
        skipped++;
      }
    }
    return new MergeResult(accepted, skipped, maxAccepted);
  }

  private String resolveHive(String hiveId) {
    return hiveId == null || hiveId.isBlank() ? config.hiveId() : hiveId;
  }
}
