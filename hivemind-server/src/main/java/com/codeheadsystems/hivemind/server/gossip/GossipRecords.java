package com.codeheadsystems.hivemind.server.gossip;

import com.codeheadsystems.hivemind.model.MessageSource;
import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import com.codeheadsystems.hivemind.protocol.Timestamps;
import com.codeheadsystems.hivemind.server.store.MessageCandidate;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Turns a raw record received from a peer into a {@link MessageCandidate}. Pull and push share
 * these rules.
 * <p>
 * A record must carry {@code uid}, {@code agentId}, {@code hiveId} and {@code content} as
 * non-blank strings, belong to the target hive, and have a creation time either as a numeric
 * {@code createdAtMs} or a parseable {@code ts}. The sender's {@code id} and {@code source} are
 * discarded.
 */
public final class GossipRecords {

  private GossipRecords() {
  }

  /**
   * Normalizes a record for the given hive.
   *
   * @param record raw JSON record
   * @param hiveId hive the record must belong to
   * @return the candidate, or empty if the record is unusable
   */
  public static Optional<MessageCandidate> normalize(JsonNode record, String hiveId) {
    if (record == null || !record.isObject()) {
      return Optional.empty();
    }
    Optional<String> uid = text(record, "uid");
    Optional<String> agentId = text(record, "agentId");
    Optional<String> recordHive = text(record, "hiveId");
    Optional<String> content = text(record, "content");
    if (uid.isEmpty() || agentId.isEmpty() || recordHive.isEmpty() || content.isEmpty()) {
      return Optional.empty();
    }
    if (!recordHive.get().equals(hiveId)) {
      return Optional.empty();
    }
    Optional<String> ts = text(record, "ts");
    OptionalLong createdAtMs = createdAtMs(record, ts);
    if (createdAtMs.isEmpty()) {
      return Optional.empty();
    }
    long created = createdAtMs.getAsLong();
    return Optional.of(new MessageCandidate(
        uid.get(),
        ts.orElseGet(() -> Timestamps.format(created)),
        created,
        agentId.get(),
        hiveId,
        content.get(),
        text(record, "channel").orElse(HivemindProtocol.DEFAULT_CHANNEL),
        MessageSource.GOSSIP));
  }

  private static OptionalLong createdAtMs(JsonNode record, Optional<String> ts) {
    JsonNode numeric = record.get("createdAtMs");
    if (numeric != null && numeric.isNumber()) {
      return OptionalLong.of(numeric.asLong());
    }
    return ts.flatMap(Timestamps::parse)
        .map(Instant::toEpochMilli)
        .map(OptionalLong::of)
        .orElseGet(OptionalLong::empty);
  }

  private static Optional<String> text(JsonNode record, String field) {
    JsonNode node = record.get(field);
    if (node == null || !node.isTextual() || node.asText().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(node.asText());
  }
}
