package com.codeheadsystems.hivemind.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.hivemind.server.hive.HiveRegistry;
import com.codeheadsystems.hivemind.server.store.StorageException;

/**
 * Health check that reads the default hive's message count through its storage.
 */
public class HiveStorageHealthCheck extends HealthCheck {

  private final HiveRegistry hiveRegistry;
  private final String hiveId;

  /**
   * Instantiates a new Hive storage health check.
   *
   * @param hiveRegistry hive routing
   * @param hiveId       the default hive
   */
  public HiveStorageHealthCheck(HiveRegistry hiveRegistry, String hiveId) {
    this.hiveRegistry = hiveRegistry;
    this.hiveId = hiveId;
  }

  @Override
  protected Result check() {
    try {
      long count = hiveRegistry.hive(hiveId).exclusive(storage -> storage.messages().count());
      return Result.healthy("hive=%s messages=%d hives=%d", hiveId, count, hiveRegistry.hiveIds().size());
    } catch (StorageException e) {
      return Result.unhealthy(e);
    }
  }
}
