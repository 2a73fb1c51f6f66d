package com.codeheadsystems.hivemind.client.exceptions;

/**
 * Transport failure or unexpected status talking to a hive server.
 */
public class HivemindAccessorException extends RuntimeException {

  private final int statusCode;

  /**
   * Instantiates a new Hivemind accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public HivemindAccessorException(final String message, final Throwable cause) {
    this(message, cause, 0);
  }

  /**
   * Instantiates a new Hivemind accessor exception for an HTTP status.
   *
   * @param message    the message
   * @param cause      the cause
   * @param statusCode the HTTP status, 0 when no response was received
   */
  public HivemindAccessorException(final String message, final Throwable cause, final int statusCode) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
