package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * A batch of messages exchanged between peer servers, either pushed to
 * {@code POST /gossip/push} or read back from a peer's {@code GET /gossip/messages} feed.
 * <p>
 * Records are kept as raw JSON so a single malformed record, or a {@code messages} value that is
 * not an array at all, is dropped without failing the whole request.
 *
 * @param hiveId   hive the batch belongs to; the receiver's default hive when absent
 * @param messages raw message records, expected to be an array
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GossipBatch(
    @JsonProperty("hive_id") String hiveId,
    @JsonProperty("messages") JsonNode messages) {

  /**
   * Returns the individual records, or an empty list when {@code messages} is missing or not an
   * array.
   *
   * @return the raw records
   */
  @JsonIgnore
  public List<JsonNode> records() {
    List<JsonNode> records = new ArrayList<>();
    if (messages != null && messages.isArray()) {
      messages.forEach(records::add);
    }
    return records;
  }
}
