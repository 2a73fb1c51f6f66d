package com.codeheadsystems.hivemind.server.hive;

import java.util.regex.Pattern;

/**
 * Hive id rules shared by every entry point that names a hive.
 */
public final class HiveIds {

  public static final int MAX_LENGTH = 64;

  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._:-]*");

  private HiveIds() {
  }

  /**
   * Trims a requested hive id, falling back when it is blank.
   *
   * @param requested the id from the request, may be null
   * @param fallback  the configured hive
   * @return the hive id to use
   * @throws IllegalArgumentException if the id is too long or uses other characters
   */
  public static String resolve(String requested, String fallback) {
    if (requested == null || requested.isBlank()) {
      return fallback;
    }
    String hiveId = requested.trim();
    if (!isValid(hiveId)) {
      throw new IllegalArgumentException("hive_id must be 1-" + MAX_LENGTH
          + " characters of letters, digits, '.', '_', ':' or '-'");
    }
    return hiveId;
  }

  public static boolean isValid(String hiveId) {
    return hiveId != null && hiveId.length() <= MAX_LENGTH && ALLOWED.matcher(hiveId).matches();
  }
}
