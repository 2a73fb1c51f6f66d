package com.codeheadsystems.hivemind.dropwizard;

import com.codeheadsystems.hivemind.dropwizard.auth.HivemindAuthenticator;
import com.codeheadsystems.hivemind.dropwizard.auth.HivemindPrincipal;
import com.codeheadsystems.hivemind.dropwizard.health.HiveStorageHealthCheck;
import com.codeheadsystems.hivemind.dropwizard.lifecycle.GossipLifecycle;
import com.codeheadsystems.hivemind.dropwizard.resource.MessageResource;
import com.codeheadsystems.hivemind.server.auth.ChallengeManager;
import com.codeheadsystems.hivemind.server.auth.JoinAuthenticator;
import com.codeheadsystems.hivemind.server.auth.SessionManager;
import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import com.codeheadsystems.hivemind.server.crypto.SignatureVerifier;
import com.codeheadsystems.hivemind.server.gossip.GossipAuthorizer;
import com.codeheadsystems.hivemind.server.gossip.GossipEngine;
import com.codeheadsystems.hivemind.server.gossip.GossipManager;
import com.codeheadsystems.hivemind.server.gossip.GossipScheduler;
import com.codeheadsystems.hivemind.server.gossip.HttpGossipPeerClient;
import com.codeheadsystems.hivemind.server.hive.HiveRegistry;
import com.codeheadsystems.hivemind.server.message.MessageManager;
import com.codeheadsystems.hivemind.server.resource.GossipResource;
import com.codeheadsystems.hivemind.server.resource.HiveResource;
import com.codeheadsystems.hivemind.server.store.HiveStorageFactory;
import com.codeheadsystems.hivemind.server.store.memory.InMemoryHiveStorageFactory;
import com.codeheadsystems.hivemind.server.store.mvstore.MVStoreHiveStorageFactory;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires a hive server into an existing Dropwizard application.
 * <p>
 * Registers the join, message and gossip resources, the bearer-token auth filter, a storage
 * health check, and a managed lifecycle for the gossip scheduler. Requires a
 * {@link HivemindConfiguration} block in the application's YAML config.
 * <p>
 * Embed with the storage backend chosen by the configuration:
 * <pre>{@code
 *   bootstrap.addBundle(new HivemindBundle<>());
 * }</pre>
 * <p>
 * Or supply your own storage:
 * <pre>{@code
 *   bootstrap.addBundle(new HivemindBundle<>(myStorageFactory));
 * }</pre>
 */
@Singleton
public class HivemindBundle<C extends HivemindConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(HivemindBundle.class);

  private final HiveStorageFactory storageFactory;

  /**
   * Creates a bundle whose storage is chosen by {@code storage} in the configuration.
   */
  public HivemindBundle() {
    this.storageFactory = null;
  }

  /**
   * Creates a bundle backed by the supplied storage; {@code storage} in the configuration is
   * ignored. The bundle closes the factory on shutdown.
   *
   * @param storageFactory per-hive storage
   */
  @Inject
  public HivemindBundle(HiveStorageFactory storageFactory) {
    this.storageFactory = storageFactory;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    HivemindServerConfig config = configuration.toServerConfig();
    HiveStorageFactory factory = storageFactory != null ? storageFactory : buildStorageFactory(configuration);
    HiveRegistry hiveRegistry = new HiveRegistry(factory);
    Clock clock = Clock.systemUTC();
    SignatureVerifier signatureVerifier = new SignatureVerifier();

    ChallengeManager challengeManager = new ChallengeManager(config, hiveRegistry, signatureVerifier, clock);
    JoinAuthenticator joinAuthenticator =
        new JoinAuthenticator(config, hiveRegistry, signatureVerifier, clock, new SecureRandom());
    environment.jersey().register(new HiveResource(config, challengeManager, joinAuthenticator));

    // Bearer session auth for the message endpoints
    SessionManager sessionManager = new SessionManager(hiveRegistry, clock);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<HivemindPrincipal>()
            .setAuthenticator(new HivemindAuthenticator(sessionManager))
            .setPrefix("Bearer")
            .setRealm("hivemind")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(HivemindPrincipal.class));
    environment.jersey().register(new MessageResource(new MessageManager(hiveRegistry, clock)));

    // Gossip
    GossipManager gossipManager = new GossipManager(config, hiveRegistry, clock);
    environment.jersey().register(new GossipResource(new GossipAuthorizer(config), gossipManager));
    HttpGossipPeerClient peerClient = new HttpGossipPeerClient(
        config, HttpGossipPeerClient.defaultHttpClient(config), environment.getObjectMapper());
    GossipEngine gossipEngine = new GossipEngine(config, hiveRegistry, gossipManager, peerClient);
    environment.lifecycle().manage(new GossipLifecycle(new GossipScheduler(config, gossipEngine), factory));

    environment.healthChecks().register("hive-storage", new HiveStorageHealthCheck(hiveRegistry, config.hiveId()));
    log.info("Hivemind bundle ready: hive={} peers={} deviceProofRequired={}",
        config.hiveId(), config.gossipPeers(), config.deviceProofRequired());
  }

  private HiveStorageFactory buildStorageFactory(C configuration) {
    if ("mvstore".equals(configuration.getStorage())) {
      log.info("Using MVStore hive storage at {}", configuration.getMvStorePath());
      return new MVStoreHiveStorageFactory(configuration.getMvStorePath());
    }
    log.warn("""
        #################################################################
        # WARNING: Using in-memory hive storage. Challenges, sessions,  #
        # messages and gossip cursors will be lost on restart.          #
        # Set storage: mvstore for durable storage.                     #
        #################################################################
        """);
    return new InMemoryHiveStorageFactory();
  }
}
