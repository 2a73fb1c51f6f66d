package com.codeheadsystems.hivemind.server.gossip;

import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the gossip endpoints with the shared secret. With no secret configured the endpoints are
 * open.
 */
@Singleton
public class GossipAuthorizer {

  private final byte[] secret;

  @Inject
  public GossipAuthorizer(final HivemindServerConfig config) {
    this.secret = config.gossipSecret().getBytes(StandardCharsets.UTF_8);
  }

  public boolean isOpen() {
    return secret.length == 0;
  }

  /**
   * Checks the secret header value.
   *
   * @param presented header value, may be null
   * @throws SecurityException if a secret is configured and the value does not match
   */
  public void authorize(final String presented) {
    if (isOpen()) {
      return;
    }
    byte[] candidate = presented == null ? new byte[0] : presented.getBytes(StandardCharsets.UTF_8);
    if (!MessageDigest.isEqual(secret, candidate)) {
      throw new SecurityException("invalid gossip token");
    }
  }
}
