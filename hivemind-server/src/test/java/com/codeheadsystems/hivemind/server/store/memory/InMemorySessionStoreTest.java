package com.codeheadsystems.hivemind.server.store.memory;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.hivemind.server.store.Challenge;
import com.codeheadsystems.hivemind.server.store.Session;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemorySessionStoreTest {

  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

  @Test
  void load_expired_returnsEmptyAndEvicts() {
    InMemorySessionStore store = new InMemorySessionStore();
    store.store("tok", new Session("a", "pk", "h1", NOW.minusSeconds(1)));

    assertThat(store.load("tok", NOW)).isEmpty();
    assertThat(store.load("tok", NOW.minusSeconds(3600))).isEmpty();
  }

  @Test
  void load_live_returnsSession() {
    InMemorySessionStore store = new InMemorySessionStore();
    Session session = new Session("a", "pk", "h1", NOW.plusSeconds(60));
    store.store("tok", session);

    assertThat(store.load("tok", NOW)).contains(session);
  }

  @Test
  void challengeStore_evictExpired_onlyRemovesExpired() {
    InMemoryChallengeStore store = new InMemoryChallengeStore();
    store.put(new Challenge("a", "pk", "old", "h1", NOW.minusSeconds(1)));
    store.put(new Challenge("a", "pk", "new", "h1", NOW.plusSeconds(60)));

    assertThat(store.evictExpired(NOW)).isEqualTo(1);
    assertThat(store.get("old")).isEmpty();
    assertThat(store.get("new")).isPresent();
  }

  @Test
  void peerCursor_neverMovesBackwards() {
    InMemoryPeerCursorStore store = new InMemoryPeerCursorStore();

    assertThat(store.get("http://peer")).isZero();
    assertThat(store.advance("http://peer", 500)).isEqualTo(500);
    assertThat(store.advance("http://peer", 100)).isEqualTo(500);
    assertThat(store.get("http://peer")).isEqualTo(500);
  }
}
