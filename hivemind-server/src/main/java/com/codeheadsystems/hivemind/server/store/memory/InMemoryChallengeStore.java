package com.codeheadsystems.hivemind.server.store.memory;

import com.codeheadsystems.hivemind.server.store.Challenge;
import com.codeheadsystems.hivemind.server.store.ChallengeStore;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent {@link ChallengeStore}.
 */
public class InMemoryChallengeStore implements ChallengeStore {

  private final ConcurrentHashMap<String, Challenge> challenges = new ConcurrentHashMap<>();

  @Override
  public void put(Challenge challenge) {
    challenges.put(challenge.nonce(), challenge);
  }

  @Override
  public Optional<Challenge> get(String nonce) {
    return Optional.ofNullable(challenges.get(nonce));
  }

  @Override
  public void delete(String nonce) {
    challenges.remove(nonce);
  }

  @Override
  public int evictExpired(Instant now) {
    int before = challenges.size();
    challenges.values().removeIf(challenge -> challenge.isExpired(now));
    return before - challenges.size();
  }
}
