package com.codeheadsystems.hivemind.server.resource;

/**
 * Lenient numeric query parameters: anything unparseable falls back to the default instead of
 * failing the request.
 */
public final class QueryParams {

  private QueryParams() {
  }

  public static long longOr(String value, long defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  public static int intOr(String value, int defaultValue) {
    long parsed = longOr(value, defaultValue);
    return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, parsed));
  }
}
