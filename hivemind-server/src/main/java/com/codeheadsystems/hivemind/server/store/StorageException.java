package com.codeheadsystems.hivemind.server.store;

/**
 * A write the store should have accepted did not happen. Reported to callers as a server error.
 */
public class StorageException extends RuntimeException {

  /**
   * Instantiates a new Storage exception.
   *
   * @param message the message
   */
  public StorageException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Storage exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StorageException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
