package com.codeheadsystems.hivemind.server.config;

import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Framework-agnostic server settings, built by whatever hosts the server (the Dropwizard bundle in
 * production, tests directly).
 *
 * @param hiveId              hive used when a request omits {@code hive_id}
 * @param challengeTtl        lifetime of an issued challenge
 * @param sessionTtl          lifetime of a session token
 * @param maxClockSkew        tolerated difference between an agent's join timestamp and now
 * @param deviceProofRequired whether every join must carry a device proof
 * @param deviceProofTtl      freshness window for {@code device_signed_at}
 * @param gossipPeers         peer base URLs, normalized
 * @param gossipSecret        shared secret for the gossip endpoints; empty means open
 * @param gossipInterval      delay between gossip cycles, at least one second
 * @param gossipTimeout       connect and request timeout for peer fetches
 */
public record HivemindServerConfig(
    String hiveId,
    Duration challengeTtl,
    Duration sessionTtl,
    Duration maxClockSkew,
    boolean deviceProofRequired,
    Duration deviceProofTtl,
    List<String> gossipPeers,
    String gossipSecret,
    Duration gossipInterval,
    Duration gossipTimeout) {

  public static final Duration DEFAULT_CHALLENGE_TTL = Duration.ofMinutes(2);
  public static final Duration DEFAULT_SESSION_TTL = Duration.ofHours(24);
  public static final Duration DEFAULT_MAX_CLOCK_SKEW = Duration.ofMinutes(2);
  public static final Duration DEFAULT_DEVICE_PROOF_TTL = Duration.ofMinutes(5);
  public static final Duration DEFAULT_GOSSIP_INTERVAL = Duration.ofSeconds(5);
  public static final Duration MIN_GOSSIP_INTERVAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_GOSSIP_TIMEOUT = Duration.ofSeconds(10);

  public HivemindServerConfig {
    hiveId = hiveId == null || hiveId.isBlank() ? HivemindProtocol.DEFAULT_HIVE_ID : hiveId.trim();
    challengeTtl = Objects.requireNonNullElse(challengeTtl, DEFAULT_CHALLENGE_TTL);
    sessionTtl = Objects.requireNonNullElse(sessionTtl, DEFAULT_SESSION_TTL);
    maxClockSkew = Objects.requireNonNullElse(maxClockSkew, DEFAULT_MAX_CLOCK_SKEW);
    deviceProofTtl = Objects.requireNonNullElse(deviceProofTtl, DEFAULT_DEVICE_PROOF_TTL);
    gossipPeers = normalizePeers(gossipPeers);
    gossipSecret = gossipSecret == null ? "" : gossipSecret;
    gossipInterval = Objects.requireNonNullElse(gossipInterval, DEFAULT_GOSSIP_INTERVAL);
    if (gossipInterval.compareTo(MIN_GOSSIP_INTERVAL) < 0) {
      gossipInterval = MIN_GOSSIP_INTERVAL;
    }
    gossipTimeout = Objects.requireNonNullElse(gossipTimeout, DEFAULT_GOSSIP_TIMEOUT);
  }

  /**
   * Defaults for the given hive with no peers and no device proof requirement.
   *
   * @param hiveId default hive
   * @return the config
   */
  public static HivemindServerConfig defaults(String hiveId) {
    return new HivemindServerConfig(hiveId, null, null, null, false, null, List.of(), "", null, null);
  }

  /**
   * Copy with different peers and gossip secret.
   *
   * @param peers  peer base URLs
   * @param secret shared secret
   * @return the config
   */
  public HivemindServerConfig withGossip(List<String> peers, String secret) {
    return new HivemindServerConfig(hiveId, challengeTtl, sessionTtl, maxClockSkew,
        deviceProofRequired, deviceProofTtl, peers, secret, gossipInterval, gossipTimeout);
  }

  /**
   * Copy with the device proof made mandatory or optional.
   *
   * @param required whether a device proof is mandatory
   * @return the config
   */
  public HivemindServerConfig withDeviceProofRequired(boolean required) {
    return new HivemindServerConfig(hiveId, challengeTtl, sessionTtl, maxClockSkew,
        required, deviceProofTtl, gossipPeers, gossipSecret, gossipInterval, gossipTimeout);
  }

  public boolean gossipSecretConfigured() {
    return !gossipSecret.isEmpty();
  }

  /**
   * Strips trailing slashes and drops blanks.
   *
   * @param peers raw peer list, may be null
   * @return immutable normalized list
   */
  public static List<String> normalizePeers(List<String> peers) {
    if (peers == null) {
      return List.of();
    }
    return peers.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .map(peer -> peer.replaceAll("/+$", ""))
        .filter(peer -> !peer.isEmpty())
        .toList();
  }
}
