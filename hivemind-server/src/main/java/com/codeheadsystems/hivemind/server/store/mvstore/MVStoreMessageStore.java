package com.codeheadsystems.hivemind.server.store.mvstore;

import com.codeheadsystems.hivemind.model.HiveMessage;
import com.codeheadsystems.hivemind.server.store.MessageCandidate;
import com.codeheadsystems.hivemind.server.store.MessageStore;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

/**
 * {@link MessageStore} in three MVStore maps: id to JSON message, uid to id, and a creation-time
 * key to id.
 * <p>
 * Creation-time keys are the sign-flipped {@code createdAtMs} and the id, each as 16 hex digits, so
 * their string order is (createdAtMs, id) order.
 */
public class MVStoreMessageStore implements MessageStore {

  private final MVStore store;
  private final MVMap<Long, String> messages;
  private final MVMap<String, Long> idsByUid;
  private final MVMap<String, Long> idsByCreation;
  private final JsonValueCodec codec;

  MVStoreMessageStore(MVStore store,
                      String messagesMapName,
                      String uidsMapName,
                      String creationMapName,
                      JsonValueCodec codec) {
    this.store = store;
    this.messages = store.openMap(messagesMapName);
    this.idsByUid = store.openMap(uidsMapName);
    this.idsByCreation = store.openMap(creationMapName);
    this.codec = codec;
    if (idsByCreation.isEmpty() && !messages.isEmpty()) {
      rebuildCreationIndex();
    }
  }

  static String creationKey(long createdAtMs, long id) {
    return String.format("%016x%016x", createdAtMs ^ Long.MIN_VALUE, id);
  }

  private void rebuildCreationIndex() {
    messages.forEach((id, json) ->
        idsByCreation.put(creationKey(codec.read(json, HiveMessage.class).createdAtMs(), id), id));
    store.commit();
  }

  @Override
  public Optional<HiveMessage> append(MessageCandidate candidate) {
    if (idsByUid.containsKey(candidate.uid())) {
      return Optional.empty();
    }
    long id = messages.isEmpty() ? 1L : messages.lastKey() + 1L;
    HiveMessage message = candidate.withId(id);
    messages.put(id, codec.write(message));
    idsByUid.put(message.uid(), id);
    idsByCreation.put(creationKey(message.createdAtMs(), id), id);
    store.commit();
    return Optional.of(message);
  }

  @Override
  public List<HiveMessage> readSince(long sinceId, int limit) {
    List<HiveMessage> result = new ArrayList<>();
    if (messages.isEmpty() || limit <= 0) {
      return result;
    }
    Iterator<Long> ids = messages.keyIterator(Math.max(sinceId, 0L) + 1L);
    while (ids.hasNext() && result.size() < limit) {
      result.add(codec.read(messages.get(ids.next()), HiveMessage.class));
    }
    return result;
  }

  @Override
  public List<HiveMessage> readSinceTime(long sinceMs, int limit) {
    List<HiveMessage> result = new ArrayList<>();
    if (idsByCreation.isEmpty() || limit <= 0) {
      return result;
    }
    Iterator<String> keys = idsByCreation.keyIterator(creationKey(sinceMs, 0L));
    while (keys.hasNext() && result.size() < limit) {
      result.add(codec.read(messages.get(idsByCreation.get(keys.next())), HiveMessage.class));
    }
    return result;
  }

  @Override
  public long count() {
    return messages.sizeAsLong();
  }

  @Override
  public boolean contains(String uid) {
    return idsByUid.containsKey(uid);
  }
}
