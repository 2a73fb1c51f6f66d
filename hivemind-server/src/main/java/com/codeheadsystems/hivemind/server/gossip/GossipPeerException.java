package com.codeheadsystems.hivemind.server.gossip;

/**
 * A peer could not be read. Never escapes a gossip cycle.
 */
public class GossipPeerException extends RuntimeException {

  /**
   * Instantiates a new Gossip peer exception.
   *
   * @param message the message
   * @param cause   the cause, may be null
   */
  public GossipPeerException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
