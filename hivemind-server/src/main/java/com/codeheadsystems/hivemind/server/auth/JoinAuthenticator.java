package com.codeheadsystems.hivemind.server.auth;

import static com.codeheadsystems.hivemind.server.auth.ChallengeManager.isBlank;

import com.codeheadsystems.hivemind.model.JoinRequest;
import com.codeheadsystems.hivemind.model.JoinResponse;
import com.codeheadsystems.hivemind.protocol.JoinMessage;
import com.codeheadsystems.hivemind.protocol.Timestamps;
import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import com.codeheadsystems.hivemind.server.crypto.SignatureVerifier;
import com.codeheadsystems.hivemind.server.hive.Hive;
import com.codeheadsystems.hivemind.server.hive.HiveIds;
import com.codeheadsystems.hivemind.server.hive.HiveRegistry;
import com.codeheadsystems.hivemind.server.store.Challenge;
import com.codeheadsystems.hivemind.server.store.HiveStorage;
import com.codeheadsystems.hivemind.server.store.Session;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completes a join: consumes a challenge, checks the agent's signature (and the device proof when
 * one is supplied or required) and issues a session.
 * <p>
 * All checks run inside the hive's exclusive section, so a nonce can be redeemed at most once even
 * under concurrent joins. Validation failures raise {@link IllegalArgumentException}; proof
 * failures raise {@link SecurityException}. Only a successful join or an expired challenge removes
 * the challenge.
 */
@Singleton
public class JoinAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(JoinAuthenticator.class);

  static final String CHALLENGE_NOT_FOUND = "challenge not found or expired";

  private final HivemindServerConfig config;
  private final HiveRegistry hiveRegistry;
  private final SignatureVerifier signatureVerifier;
  private final Clock clock;
  private final SecureRandom secureRandom;

  /**
   * Instantiates a new Join authenticator.
   *
   * @param config            server settings
   * @param hiveRegistry      hive routing
   * @param signatureVerifier Ed25519 verification
   * @param clock             time source
   * @param secureRandom      token randomness
   */
  @Inject
  public JoinAuthenticator(final HivemindServerConfig config,
                           final HiveRegistry hiveRegistry,
                           final SignatureVerifier signatureVerifier,
                           final Clock clock,
                           final SecureRandom secureRandom) {
    this.config = config;
    this.hiveRegistry = hiveRegistry;
    this.signatureVerifier = signatureVerifier;
    this.clock = clock;
    this.secureRandom = secureRandom;
  }

  /**
   * Verifies a join request and issues a session.
   *
   * @param request the join request
   * @return the session token and its expiry
   * @throws IllegalArgumentException if a required field is missing, the hive id is not acceptable or
   *                                  the timestamp is unparseable
   * @throws SecurityException        if the challenge or any proof does not check out
   */
  public JoinResponse join(final JoinRequest request) {
    requireFields(request);
    String requestedHive = HiveIds.resolve(request.hiveId(), null);
    Hive hive = locateChallenge(request, requestedHive).orElseThrow(() -> {
      log.debug("join: no challenge for agent={}", request.agentId());
      return new SecurityException(CHALLENGE_NOT_FOUND);
    });
    JoinResponse response = hive.exclusive(storage -> redeem(storage, request, requestedHive));
    log.info("join: agent={} joined hive={}", response.agentId(), response.hiveId());
    return response;
  }

  private JoinResponse redeem(HiveStorage storage, JoinRequest request, String requestedHive) {
    Challenge challenge = storage.challenges().get(request.nonce())
        .orElseThrow(() -> new SecurityException(CHALLENGE_NOT_FOUND));
    String challengeExpiresAt = Timestamps.format(challenge.expiresAt());

    if (!challenge.agentId().equals(request.agentId()) || !challenge.pubkey().equals(request.pubkey())) {
      throw new SecurityException("challenge does not match agent or pubkey");
    }
    String hiveId = requestedHive == null ? challenge.hiveId() : requestedHive;
    if (!challenge.hiveId().equals(hiveId)) {
      throw new SecurityException("challenge does not match hive_id");
    }
    String expiresAt = isBlank(request.expiresAt()) ? challengeExpiresAt : request.expiresAt();
    if (!challengeExpiresAt.equals(expiresAt)) {
      throw new SecurityException("challenge does not match expires_at");
    }

    Instant now = clock.instant();
    if (challenge.isExpired(now)) {
      storage.challenges().delete(challenge.nonce());
      throw new SecurityException(CHALLENGE_NOT_FOUND);
    }

    Instant timestamp = Timestamps.parse(request.timestamp())
        .orElseThrow(() -> new IllegalArgumentException("timestamp is not a valid ISO-8601 instant"));
    if (outsideWindow(timestamp, now, config.maxClockSkew())) {
      throw new SecurityException("timestamp outside allowed clock skew");
    }

    verifyDeviceProof(request, now);

    JoinMessage message = new JoinMessage(request.agentId(), request.pubkey(), request.nonce(),
        challenge.hiveId(), challengeExpiresAt, request.timestamp());
    if (!signatureVerifier.verifyBase58Key(message.bytes(), request.signature(), request.pubkey())) {
      throw new SecurityException("invalid signature");
    }

    storage.challenges().delete(challenge.nonce());
    String token = SessionTokens.mint(challenge.hiveId(), secureRandom);
    Session session = new Session(challenge.agentId(), challenge.pubkey(), challenge.hiveId(),
        now.plus(config.sessionTtl()));
    storage.sessions().store(token, session);
    return new JoinResponse(token, Timestamps.format(session.expiresAt()), session.agentId(), session.hiveId());
  }

  private void verifyDeviceProof(JoinRequest request, Instant now) {
    if (!config.deviceProofRequired() && !request.hasAnyDeviceProofField()) {
      return;
    }
    if (!request.hasCompleteDeviceProof()) {
      throw new SecurityException("device proof required");
    }
    Instant signedAt = Timestamps.parse(request.deviceSignedAt())
        .orElseThrow(() -> new SecurityException("device_signed_at is not a valid timestamp"));
    if (outsideWindow(signedAt, now, config.deviceProofTtl())) {
      throw new SecurityException("device proof expired");
    }
    byte[] signed = request.deviceNonce().getBytes(StandardCharsets.UTF_8);
    if (!signatureVerifier.verifyBase64Key(signed, request.deviceSignature(), request.devicePublicKey())) {
      throw new SecurityException("invalid device proof");
    }
  }

  // Searches the named hive, or every known hive starting with the default one.
  private Optional<Hive> locateChallenge(JoinRequest request, String requestedHive) {
    if (requestedHive != null) {
      return hiveRegistry.find(requestedHive);
    }
    Optional<Hive> preferred = hiveRegistry.find(config.hiveId()).filter(hive -> holds(hive, request.nonce()));
    if (preferred.isPresent()) {
      return preferred;
    }
    return hiveRegistry.hiveIds().stream()
        .map(hiveRegistry::find)
        .flatMap(Optional::stream)
        .filter(hive -> holds(hive, request.nonce()))
        .findFirst();
  }

  private static boolean holds(Hive hive, String nonce) {
    return hive.exclusive(storage -> storage.challenges().get(nonce).isPresent());
  }

  private static boolean outsideWindow(Instant instant, Instant now, Duration window) {
    return Duration.between(instant, now).abs().compareTo(window) > 0;
  }

  private static void requireFields(JoinRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("request body is required");
    }
    require("agent_id", request.agentId());
    require("pubkey", request.pubkey());
    require("nonce", request.nonce());
    require("signature", request.signature());
    require("timestamp", request.timestamp());
  }

  private static void require(String field, String value) {
    if (isBlank(value)) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
  }
}
