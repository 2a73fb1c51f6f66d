package com.codeheadsystems.hivemind.server.store.mvstore;

import com.codeheadsystems.hivemind.server.store.Challenge;
import com.codeheadsystems.hivemind.server.store.ChallengeStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

/**
 * {@link ChallengeStore} in an MVStore map of nonce to JSON.
 */
public class MVStoreChallengeStore implements ChallengeStore {

  private final MVStore store;
  private final MVMap<String, String> challenges;
  private final JsonValueCodec codec;

  MVStoreChallengeStore(MVStore store, String mapName, JsonValueCodec codec) {
    this.store = store;
    this.challenges = store.openMap(mapName);
    this.codec = codec;
  }

  @Override
  public void put(Challenge challenge) {
    challenges.put(challenge.nonce(), codec.write(challenge));
    store.commit();
  }

  @Override
  public Optional<Challenge> get(String nonce) {
    return Optional.ofNullable(challenges.get(nonce)).map(json -> codec.read(json, Challenge.class));
  }

  @Override
  public void delete(String nonce) {
    if (challenges.remove(nonce) != null) {
      store.commit();
    }
  }

  @Override
  public int evictExpired(Instant now) {
    List<String> expired = challenges.entrySet().stream()
        .filter(entry -> codec.read(entry.getValue(), Challenge.class).isExpired(now))
        .map(Map.Entry::getKey)
        .toList();
    expired.forEach(challenges::remove);
    if (!expired.isEmpty()) {
      store.commit();
    }
    return expired.size();
  }
}
