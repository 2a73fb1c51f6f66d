package com.codeheadsystems.hivemind.server.store.memory;

import com.codeheadsystems.hivemind.server.store.ChallengeStore;
import com.codeheadsystems.hivemind.server.store.HiveStorage;
import com.codeheadsystems.hivemind.server.store.HiveStorageFactory;
import com.codeheadsystems.hivemind.server.store.MessageStore;
import com.codeheadsystems.hivemind.server.store.PeerCursorStore;
import com.codeheadsystems.hivemind.server.store.SessionStore;
import java.util.Set;

/**
 * Creates in-memory hive storage. Everything is lost on restart; suitable for development and
 * tests only.
 */
public class InMemoryHiveStorageFactory implements HiveStorageFactory {

  @Override
  public HiveStorage open(String hiveId) {
    return new InMemoryHiveStorage(hiveId, new InMemoryChallengeStore(), new InMemorySessionStore(),
        new InMemoryMessageStore(), new InMemoryPeerCursorStore());
  }

  @Override
  public Set<String> existingHives() {
    return Set.of();
  }

  record InMemoryHiveStorage(String hiveId,
                             ChallengeStore challenges,
                             SessionStore sessions,
                             MessageStore messages,
                             PeerCursorStore cursors) implements HiveStorage {
  }
}
