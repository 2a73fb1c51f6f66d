package com.codeheadsystems.hivemind.server.store;

/**
 * All state owned by one hive.
 */
public interface HiveStorage {

  String hiveId();

  ChallengeStore challenges();

  SessionStore sessions();

  MessageStore messages();

  PeerCursorStore cursors();
}
