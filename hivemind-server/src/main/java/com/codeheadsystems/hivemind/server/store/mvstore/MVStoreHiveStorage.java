package com.codeheadsystems.hivemind.server.store.mvstore;

import com.codeheadsystems.hivemind.server.store.ChallengeStore;
import com.codeheadsystems.hivemind.server.store.HiveStorage;
import com.codeheadsystems.hivemind.server.store.MessageStore;
import com.codeheadsystems.hivemind.server.store.PeerCursorStore;
import com.codeheadsystems.hivemind.server.store.SessionStore;

record MVStoreHiveStorage(String hiveId,
                          ChallengeStore challenges,
                          SessionStore sessions,
                          MessageStore messages,
                          PeerCursorStore cursors) implements HiveStorage {
}
