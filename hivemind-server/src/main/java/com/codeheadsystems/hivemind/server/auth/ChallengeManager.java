package com.codeheadsystems.hivemind.server.auth;

import com.codeheadsystems.hivemind.model.ChallengeRequest;
import com.codeheadsystems.hivemind.model.ChallengeResponse;
import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import com.codeheadsystems.hivemind.protocol.Timestamps;
import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import com.codeheadsystems.hivemind.server.crypto.SignatureVerifier;
import com.codeheadsystems.hivemind.server.hive.HiveIds;
import com.codeheadsystems.hivemind.server.hive.HiveRegistry;
import com.codeheadsystems.hivemind.server.store.Challenge;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues single-use join challenges.
 */
@Singleton
public class ChallengeManager {

  private static final Logger log = LoggerFactory.getLogger(ChallengeManager.class);

  private final HivemindServerConfig config;
  private final HiveRegistry hiveRegistry;
  private final SignatureVerifier signatureVerifier;
  private final Clock clock;
  private final Supplier<String> nonceSupplier;

  /**
   * Instantiates a new Challenge manager with random UUID nonces.
   *
   * @param config            server settings
   * @param hiveRegistry      hive routing
   * @param signatureVerifier validates announced keys
   * @param clock             time source
   */
  @Inject
  public ChallengeManager(final HivemindServerConfig config,
                          final HiveRegistry hiveRegistry,
                          final SignatureVerifier signatureVerifier,
                          final Clock clock) {
    this(config, hiveRegistry, signatureVerifier, clock, () -> UUID.randomUUID().toString());
  }

  ChallengeManager(final HivemindServerConfig config,
                   final HiveRegistry hiveRegistry,
                   final SignatureVerifier signatureVerifier,
                   final Clock clock,
                   final Supplier<String> nonceSupplier) {
    this.config = config;
    this.hiveRegistry = hiveRegistry;
    this.signatureVerifier = signatureVerifier;
    this.clock = clock;
    this.nonceSupplier = nonceSupplier;
  }

  /**
   * Issues a challenge binding the agent and its key to a hive.
   *
   * @param request the challenge request
   * @return the nonce and expiry the agent must sign
   * @throws IllegalArgumentException if the agent id or key is missing, the key is malformed or the
   *                                  hive id is not acceptable
   */
  public ChallengeResponse issue(final ChallengeRequest request) {
    if (request == null || isBlank(request.agentId()) || isBlank(request.pubkey())) {
      throw new IllegalArgumentException("agent_id and pubkey are required");
    }
    if (!signatureVerifier.isValidPublicKey(request.pubkey())) {
      throw new IllegalArgumentException("pubkey is not a valid base58 Ed25519 public key");
    }
    String hiveId = HiveIds.resolve(request.hiveId(), config.hiveId());
    Instant now = clock.instant();
    Challenge challenge = new Challenge(request.agentId(), request.pubkey(), nonceSupplier.get(),
        hiveId, now.plus(config.challengeTtl()));

    int evicted = hiveRegistry.hive(hiveId).exclusive(storage -> {
      int removed = storage.challenges().evictExpired(now);
      storage.challenges().put(challenge);
      return removed;
    });
    log.debug("issue(agent={}, hive={}, evicted={})", challenge.agentId(), hiveId, evicted);

    return new ChallengeResponse(HivemindProtocol.PROTOCOL_VERSION, challenge.nonce(), hiveId,
        Timestamps.format(challenge.expiresAt()));
  }

  static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
