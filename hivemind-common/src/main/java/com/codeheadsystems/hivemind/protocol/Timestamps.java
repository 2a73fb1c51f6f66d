package com.codeheadsystems.hivemind.protocol;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Wire timestamp handling. Timestamps are always emitted as UTC with exactly three fractional
 * digits ({@code 2025-01-01T00:00:00.000Z}) because challenge expiries are signed verbatim and must
 * render identically every time.
 */
public final class Timestamps {

  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private Timestamps() {
  }

  /**
   * Formats an instant, truncated to milliseconds.
   *
   * @param instant the instant
   * @return the wire form
   */
  public static String format(Instant instant) {
    return FORMAT.format(instant.truncatedTo(ChronoUnit.MILLIS));
  }

  /**
   * Formats epoch milliseconds.
   *
   * @param epochMillis milliseconds since the epoch
   * @return the wire form
   */
  public static String format(long epochMillis) {
    return format(Instant.ofEpochMilli(epochMillis));
  }

  /**
   * Parses an ISO-8601 timestamp with a zone designator. Never throws.
   *
   * @param text the text, may be null
   * @return the instant, or empty if the text is missing or unparseable
   */
  public static Optional<Instant> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.parse(text));
    } catch (DateTimeParseException e) {
      try {
        return Optional.of(OffsetDateTime.parse(text).toInstant());
      } catch (DateTimeParseException ignored) {
        return Optional.empty();
      }
    }
  }
}
