package com.codeheadsystems.hivemind.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a stored message came from. A message is {@link #LOCAL} only on the server that accepted
 * it from an agent; every server that receives it through gossip records it as {@link #GOSSIP}.
 */
public enum MessageSource {
  LOCAL("local"),
  GOSSIP("gossip");

  private final String wireName;

  MessageSource(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * Parses the wire name.
   *
   * @param value wire name
   * @return the source
   * @throws IllegalArgumentException for unknown names
   */
  @JsonCreator
  public static MessageSource fromWireName(String value) {
    for (MessageSource source : values()) {
      if (source.wireName.equals(value)) {
        return source;
      }
    }
    throw new IllegalArgumentException("Unknown message source: " + value);
  }
}
