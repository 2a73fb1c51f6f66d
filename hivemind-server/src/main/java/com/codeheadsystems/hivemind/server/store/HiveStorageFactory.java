package com.codeheadsystems.hivemind.server.store;

import java.util.Set;

/**
 * Creates the storage for a hive the first time it is used.
 * <p>
 * Implementations decide durability. The core never depends on a concrete backend.
 */
public interface HiveStorageFactory extends AutoCloseable {

  /**
   * Opens or creates storage for a hive.
   *
   * @param hiveId the hive
   * @return its storage
   */
  HiveStorage open(String hiveId);

  /**
   * Hives that already hold state when the server starts.
   *
   * @return hive ids
   */
  Set<String> existingHives();

  @Override
  default void close() {
  }
}
