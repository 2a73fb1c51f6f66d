package com.codeheadsystems.hivemind.server.gossip;

import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link GossipEngine#pollOnce()} with a fixed delay between cycles, the first one
 * immediately. Nothing is scheduled when no peers are configured.
 */
@Singleton
public class GossipScheduler {

  private static final Logger log = LoggerFactory.getLogger(GossipScheduler.class);

  private final HivemindServerConfig config;
  private final GossipEngine engine;
  private ScheduledExecutorService scheduler;

  @Inject
  public GossipScheduler(final HivemindServerConfig config, final GossipEngine engine) {
    this.config = config;
    this.engine = engine;
  }

  /**
   * Starts the schedule if peers are configured. Calling it twice has no further effect.
   */
  public synchronized void start() {
    if (scheduler != null) {
      return;
    }
    if (config.gossipPeers().isEmpty()) {
      log.info("No gossip peers configured; gossip disabled");
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("hivemind-gossip"));
    scheduler.scheduleWithFixedDelay(this::runCycle, 0L, config.gossipInterval().toMillis(), TimeUnit.MILLISECONDS);
    log.info("Gossip started: peers={} interval={}", config.gossipPeers(), config.gossipInterval());
  }

  /**
   * Stops the schedule and the engine's workers.
   */
  public synchronized void stop() {
    if (scheduler != null) {
      scheduler.shutdownNow();
      scheduler = null;
      log.info("Gossip stopped");
    }
    engine.close();
  }

  public synchronized boolean isRunning() {
    return scheduler != null;
  }

  // A scheduled task that throws is never run again, so nothing may escape.
  void runCycle() {
    Duration wait = config.gossipTimeout().multipliedBy(2);
    try {
      GossipCycleResult result = engine.pollOnce().get(wait.toMillis(), TimeUnit.MILLISECONDS);
      if (result.accepted() > 0 || result.failedPeers() > 0) {
        log.info("Gossip cycle: accepted={} skipped={} failedPeers={}",
            result.accepted(), result.skipped(), result.failedPeers());
      }
    } catch (TimeoutException e) {
      log.debug("Gossip cycle still running after {}; slow pairs will be skipped next cycle", wait);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException | RuntimeException e) {
      log.warn("Gossip cycle failed", e);
    }
  }
}
