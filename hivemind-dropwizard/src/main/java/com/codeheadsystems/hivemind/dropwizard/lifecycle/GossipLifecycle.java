package com.codeheadsystems.hivemind.dropwizard.lifecycle;

import com.codeheadsystems.hivemind.server.gossip.GossipScheduler;
import com.codeheadsystems.hivemind.server.store.HiveStorageFactory;
import io.dropwizard.lifecycle.Managed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts gossip with the server and, on shutdown, stops it before closing storage.
 */
public class GossipLifecycle implements Managed {

  private static final Logger log = LoggerFactory.getLogger(GossipLifecycle.class);

  private final GossipScheduler gossipScheduler;
  private final HiveStorageFactory storageFactory;

  /**
   * Instantiates a new Gossip lifecycle.
   *
   * @param gossipScheduler the scheduler
   * @param storageFactory  closed after gossip stops
   */
  public GossipLifecycle(GossipScheduler gossipScheduler, HiveStorageFactory storageFactory) {
    this.gossipScheduler = gossipScheduler;
    this.storageFactory = storageFactory;
  }

  @Override
  public void start() {
    gossipScheduler.start();
  }

  @Override
  public void stop() throws Exception {
    gossipScheduler.stop();
    storageFactory.close();
    log.info("Hive storage closed");
  }
}
