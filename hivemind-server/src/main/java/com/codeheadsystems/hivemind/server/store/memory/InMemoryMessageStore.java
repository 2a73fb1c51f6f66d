package com.codeheadsystems.hivemind.server.store.memory;

import com.codeheadsystems.hivemind.model.HiveMessage;
import com.codeheadsystems.hivemind.server.store.MessageCandidate;
import com.codeheadsystems.hivemind.server.store.MessageStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Non-persistent {@link MessageStore}. The log is a list indexed by {@code id - 1}, with a second
 * index by {@code createdAtMs} for peer feeds.
 * <p>
 * Not thread-safe on its own; the owning hive serializes all access.
 */
public class InMemoryMessageStore implements MessageStore {

  private final List<HiveMessage> log = new ArrayList<>();
  private final Map<String, Long> idsByUid = new HashMap<>();
  // Lists keep id order within one millisecond.
  private final NavigableMap<Long, List<HiveMessage>> byCreation = new TreeMap<>();

  @Override
  public Optional<HiveMessage> append(MessageCandidate candidate) {
    if (idsByUid.containsKey(candidate.uid())) {
      return Optional.empty();
    }
    HiveMessage message = candidate.withId(log.size() + 1L);
    log.add(message);
    idsByUid.put(message.uid(), message.id());
    byCreation.computeIfAbsent(message.createdAtMs(), ms -> new ArrayList<>()).add(message);
    return Optional.of(message);
  }

  @Override
  public List<HiveMessage> readSince(long sinceId, int limit) {
    int from = (int) Math.min(Math.max(sinceId, 0L), log.size());
    int to = (int) Math.min((long) from + Math.max(limit, 0), log.size());
    return List.copyOf(log.subList(from, to));
  }

  @Override
  public List<HiveMessage> readSinceTime(long sinceMs, int limit) {
    List<HiveMessage> result = new ArrayList<>();
    for (List<HiveMessage> sameMillis : byCreation.tailMap(sinceMs, true).values()) {
      for (HiveMessage message : sameMillis) {
        if (result.size() >= limit) {
          return result;
        }
        result.add(message);
      }
    }
    return result;
  }

  @Override
  public long count() {
    return log.size();
  }

  @Override
  public boolean contains(String uid) {
    return idsByUid.containsKey(uid);
  }
}
