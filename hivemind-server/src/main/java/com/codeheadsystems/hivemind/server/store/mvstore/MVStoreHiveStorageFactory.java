package com.codeheadsystems.hivemind.server.store.mvstore;

import com.codeheadsystems.hivemind.server.store.HiveStorage;
import com.codeheadsystems.hivemind.server.store.HiveStorageFactory;
import java.util.Set;
import java.util.stream.Collectors;
import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable hive storage in a single H2 MVStore. Each hive gets its own set of maps named
 * {@code hivemind#<hiveId>#<kind>}.
 * <p>
 * Every write is committed before it returns.
 */
public class MVStoreHiveStorageFactory implements HiveStorageFactory {

  private static final Logger log = LoggerFactory.getLogger(MVStoreHiveStorageFactory.class);

  static final String PREFIX = "hivemind#";
  static final String MESSAGES = "#messages";

  private final MVStore store;
  private final JsonValueCodec codec = new JsonValueCodec();

  /**
   * Opens (or creates) the store file.
   *
   * @param fileName store file; null for a purely in-memory store
   */
  public MVStoreHiveStorageFactory(String fileName) {
    this(MVStore.open(fileName));
    log.info("MVStoreHiveStorageFactory({})", fileName);
  }

  /**
   * Uses an already opened store. The factory closes it on {@link #close()}.
   *
   * @param store the store
   */
  public MVStoreHiveStorageFactory(MVStore store) {
    this.store = store;
  }

  @Override
  public HiveStorage open(String hiveId) {
    String base = PREFIX + hiveId;
    return new MVStoreHiveStorage(hiveId,
        new MVStoreChallengeStore(store, base + "#challenges", codec),
        new MVStoreSessionStore(store, base + "#sessions", codec),
        new MVStoreMessageStore(store, base + MESSAGES, base + "#uids", base + "#bytime", codec),
        new MVStorePeerCursorStore(store, base + "#cursors"));
  }

  @Override
  public Set<String> existingHives() {
    return store.getMapNames().stream()
        .filter(name -> name.startsWith(PREFIX) && name.endsWith(MESSAGES))
        .map(name -> name.substring(PREFIX.length(), name.length() - MESSAGES.length()))
        .filter(hiveId -> !hiveId.isEmpty())
        .collect(Collectors.toSet());
  }

  @Override
  public void close() {
    if (!store.isClosed()) {
      store.close();
      log.info("MVStore closed");
    }
  }
}
