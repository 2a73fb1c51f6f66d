package com.codeheadsystems.hivemind.protocol;

/**
 * Constants of the hivemind wire protocol, shared by servers and agents.
 */
public final class HivemindProtocol {

  /**
   * Protocol version string. It is the first line of every canonical join message, so changing it
   * invalidates all signatures produced by older agents.
   */
  public static final String PROTOCOL_VERSION = "OPENCLAW_HIVEMIND_V1";

  /**
   * Hive used when a request does not name one.
   */
  public static final String DEFAULT_HIVE_ID = "openclaw-devnet";

  /**
   * Channel assigned to messages posted without one.
   */
  public static final String DEFAULT_CHANNEL = "default";

  /**
   * Request header carrying the shared gossip secret between peer servers.
   */
  public static final String GOSSIP_SECRET_HEADER = "X-Hivemind-Gossip";

  /**
   * Ed25519 public key length in bytes.
   */
  public static final int PUBLIC_KEY_LENGTH = 32;

  /**
   * Ed25519 detached signature length in bytes.
   */
  public static final int SIGNATURE_LENGTH = 64;

  private HivemindProtocol() {
  }
}
