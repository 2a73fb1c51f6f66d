package com.codeheadsystems.hivemind.server.gossip;

import com.codeheadsystems.hivemind.model.GossipBatch;
import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import com.codeheadsystems.hivemind.server.hive.Hive;
import com.codeheadsystems.hivemind.server.hive.HiveRegistry;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pull-based anti-entropy. Each cycle fetches, for every configured peer, the configured hive and
 * every local hive holding messages, the peer's messages created since the last cursor and merges
 * them into the local hive.
 * <p>
 * Fetches run on a bounded worker pool, outside any hive lock. A (peer, hive) pair whose previous
 * fetch has not finished is skipped, so one slow peer cannot pile up work or hold back other
 * peers. Peer failures are logged and counted, never thrown.
 */
@Singleton
public class GossipEngine implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(GossipEngine.class);

  private static final int MAX_WORKERS = 8;

  private final HivemindServerConfig config;
  private final HiveRegistry hiveRegistry;
  private final GossipManager gossipManager;
  private final GossipPeerClient peerClient;
  private final ExecutorService workers;
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  /**
   * Instantiates a new Gossip engine with its own daemon worker pool.
   *
   * @param config        peers and the default hive
   * @param hiveRegistry  hive routing
   * @param gossipManager merges fetched records
   * @param peerClient    fetches peer feeds
   */
  @Inject
  public GossipEngine(final HivemindServerConfig config,
                      final HiveRegistry hiveRegistry,
                      final GossipManager gossipManager,
                      final GossipPeerClient peerClient) {
    this(config, hiveRegistry, gossipManager, peerClient,
        Executors.newFixedThreadPool(
            Math.max(1, Math.min(MAX_WORKERS, config.gossipPeers().size())),
            new DaemonThreadFactory("hivemind-gossip-worker")));
  }

  GossipEngine(final HivemindServerConfig config,
               final HiveRegistry hiveRegistry,
               final GossipManager gossipManager,
               final GossipPeerClient peerClient,
               final ExecutorService workers) {
    this.config = config;
    this.hiveRegistry = hiveRegistry;
    this.gossipManager = gossipManager;
    this.peerClient = peerClient;
    this.workers = workers;
    log.info("GossipEngine(peers={})", config.gossipPeers());
  }

  /**
   * Runs one cycle over every (peer, hive) pair not already in flight.
   *
   * @return completes with the cycle totals once every started fetch has finished
   */
  public CompletableFuture<GossipCycleResult> pollOnce() {
    List<String> peers = config.gossipPeers();
    if (peers.isEmpty()) {
      return CompletableFuture.completedFuture(GossipCycleResult.EMPTY);
    }
    Set<String> hives = new TreeSet<>();
    hives.add(config.hiveId());
    hiveRegistry.hiveIds().stream()
        .filter(this::holdsMessages)
        .forEach(hives::add);

    List<CompletableFuture<PairOutcome>> pairs = new ArrayList<>();
    for (String peer : peers) {
      for (String hiveId : hives) {
        String key = peer + "|" + hiveId;
        if (!inFlight.add(key)) {
          log.debug("Skipping {} for hive {}: previous fetch still running", peer, hiveId);
          continue;
        }
        try {
          pairs.add(CompletableFuture.supplyAsync(() -> pollPair(key, peer, hiveId), workers));
        } catch (RejectedExecutionException e) {
          inFlight.remove(key);
          log.debug("Gossip workers stopped; not polling {}", peer);
        }
      }
    }

    return CompletableFuture.allOf(pairs.toArray(new CompletableFuture<?>[0]))
        .thenApply(ignored -> total(pairs));
  }

  // Hives without messages are not polled.
  private boolean holdsMessages(String hiveId) {
    return hiveRegistry.find(hiveId)
        .map(hive -> hive.exclusive(storage -> storage.messages().count() > 0))
        .orElse(false);
  }

  private PairOutcome pollPair(String key, String peer, String hiveId) {
    try {
      Hive hive = hiveRegistry.hive(hiveId);
      long cursor = hive.exclusive(storage -> storage.cursors().get(peer));
      GossipBatch batch = peerClient.fetch(peer, hiveId, cursor);
      MergeResult result = gossipManager.merge(hiveId, batch.records());
      // Only accepted records move the cursor.
      if (result.hasAccepted() && result.maxAcceptedCreated() > cursor) {
        hive.exclusive(storage -> storage.cursors().advance(peer, result.maxAcceptedCreated()));
      }
      if (result.accepted() > 0) {
        log.debug("Pulled {} new message(s) from {} for hive {}", result.accepted(), peer, hiveId);
      }
      return new PairOutcome(peer, result.accepted(), result.skipped(), false);
    } catch (GossipPeerException e) {
      log.debug("Gossip peer {} unavailable for hive {}: {}", peer, hiveId, e.getMessage());
      return new PairOutcome(peer, 0, 0, true);
    } catch (RuntimeException e) {
      log.warn("Gossip with {} for hive {} failed", peer, hiveId, e);
      return new PairOutcome(peer, 0, 0, true);
    } finally {
      inFlight.remove(key);
    }
  }

  private static GossipCycleResult total(List<CompletableFuture<PairOutcome>> pairs) {
    List<PairOutcome> outcomes = pairs.stream().map(CompletableFuture::join).toList();
    int accepted = outcomes.stream().mapToInt(PairOutcome::accepted).sum();
    int skipped = outcomes.stream().mapToInt(PairOutcome::skipped).sum();
    int failedPeers = outcomes.stream()
        .filter(PairOutcome::failed)
        .map(PairOutcome::peer)
        .collect(Collectors.toSet())
        .size();
    return new GossipCycleResult(accepted, skipped, failedPeers);
  }

  @Override
  public void close() {
    workers.shutdownNow();
  }

  private record PairOutcome(String peer, int accepted, int skipped, boolean failed) {
  }
}
