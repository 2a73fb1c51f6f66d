package com.codeheadsystems.hivemind.server.hive;

import com.codeheadsystems.hivemind.server.store.HiveStorageFactory;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a hive id to its single {@link Hive}. Hives are created on first use; hives that already
 * hold durable state are registered at startup so gossip keeps serving them.
 */
@Singleton
public class HiveRegistry {

  private static final Logger log = LoggerFactory.getLogger(HiveRegistry.class);

  private final HiveStorageFactory storageFactory;
  private final ConcurrentHashMap<String, Hive> hives = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Hive registry.
   *
   * @param storageFactory creates storage for new hives
   */
  @Inject
  public HiveRegistry(final HiveStorageFactory storageFactory) {
    this.storageFactory = storageFactory;
    storageFactory.existingHives().forEach(this::hive);
    log.info("HiveRegistry({}, existing={})", storageFactory.getClass().getSimpleName(), hives.keySet());
  }

  /**
   * Returns the hive, creating it if needed.
   *
   * @param hiveId the hive id
   * @return the hive
   * @throws IllegalArgumentException if the id is blank
   */
  public Hive hive(String hiveId) {
    if (hiveId == null || hiveId.isBlank()) {
      throw new IllegalArgumentException("hive_id must not be blank");
    }
    return hives.computeIfAbsent(hiveId, id -> {
      log.debug("Creating hive {}", id);
      return new Hive(id, storageFactory.open(id));
    });
  }

  /**
   * Returns the hive only if it already exists.
   *
   * @param hiveId the hive id
   * @return the hive, or empty
   */
  public Optional<Hive> find(String hiveId) {
    return hiveId == null ? Optional.empty() : Optional.ofNullable(hives.get(hiveId));
  }

  /**
   * Snapshot of the hives known locally.
   *
   * @return hive ids
   */
  public Set<String> hiveIds() {
    return Set.copyOf(hives.keySet());
  }
}
