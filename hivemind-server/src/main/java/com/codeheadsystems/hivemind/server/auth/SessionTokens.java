package com.codeheadsystems.hivemind.server.auth;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Session token format: {@code <hiveId>.<base64url(32 random bytes)>}. The hive prefix lets a
 * token be routed to its hive without a global index; callers treat the whole token as opaque.
 */
public final class SessionTokens {

  private static final int RANDOM_BYTES = 32;

  private SessionTokens() {
  }

  /**
   * Mints a new token for a hive.
   *
   * @param hiveId the hive
   * @param random randomness source
   * @return the token
   */
  public static String mint(String hiveId, SecureRandom random) {
    byte[] bytes = new byte[RANDOM_BYTES];
    random.nextBytes(bytes);
    return hiveId + "." + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  /**
   * Extracts the hive id from a token.
   *
   * @param token the token, may be null
   * @return the hive id, or empty if the token is not in the expected form
   */
  public static Optional<String> hiveOf(String token) {
    if (token == null) {
      return Optional.empty();
    }
    int dot = token.lastIndexOf('.');
    if (dot <= 0 || dot == token.length() - 1) {
      return Optional.empty();
    }
    return Optional.of(token.substring(0, dot));
  }
}
