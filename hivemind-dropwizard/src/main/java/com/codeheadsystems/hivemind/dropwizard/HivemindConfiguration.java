package com.codeheadsystems.hivemind.dropwizard;

import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Dropwizard configuration for a hive server.
 * <p>
 * {@code storage: memory} keeps everything in process and loses it on restart (dev/test only).
 * {@code storage: mvstore} persists every hive to the single MVStore file at {@code mvStorePath}.
 * <p>
 * When {@code gossipPeers} is non-empty the server pulls from each peer every
 * {@code gossipIntervalMs}. Set the same {@code gossipSecret} on every peer to close the
 * {@code /gossip} endpoints to outsiders.
 */
public class HivemindConfiguration extends Configuration {

  /**
   * Hive used when a request does not name one.
   */
  @NotEmpty
  private String hiveId = HivemindProtocol.DEFAULT_HIVE_ID;

  @Min(1)
  private long challengeTtlMs = HivemindServerConfig.DEFAULT_CHALLENGE_TTL.toMillis();

  @Min(1)
  private long sessionTtlMs = HivemindServerConfig.DEFAULT_SESSION_TTL.toMillis();

  @Min(0)
  private long maxClockSkewMs = HivemindServerConfig.DEFAULT_MAX_CLOCK_SKEW.toMillis();

  /**
   * When true every join must carry a device proof.
   */
  private boolean deviceProofRequired = false;

  @Min(1)
  private long deviceProofTtlMs = HivemindServerConfig.DEFAULT_DEVICE_PROOF_TTL.toMillis();

  /**
   * Peer base URLs, e.g. {@code http://peer-a:8080}.
   */
  @NotNull
  private List<String> gossipPeers = new ArrayList<>();

  /**
   * Shared secret expected in the {@code X-Hivemind-Gossip} header. Empty leaves gossip open.
   */
  @NotNull
  private String gossipSecret = "";

  /**
   * Delay between gossip cycles. Values below one second are raised to one second.
   */
  @Min(1)
  private long gossipIntervalMs = HivemindServerConfig.DEFAULT_GOSSIP_INTERVAL.toMillis();

  @Min(1)
  private long gossipTimeoutMs = HivemindServerConfig.DEFAULT_GOSSIP_TIMEOUT.toMillis();

  /**
   * Storage backend: {@code memory} or {@code mvstore}.
   */
  @NotNull
  @Pattern(regexp = "memory|mvstore")
  private String storage = "memory";

  @NotEmpty
  private String mvStorePath = "hivemind.mv.db";

  /**
   * Builds the framework-agnostic server settings.
   *
   * @return the server config
   */
  public HivemindServerConfig toServerConfig() {
    return new HivemindServerConfig(
        hiveId,
        Duration.ofMillis(challengeTtlMs),
        Duration.ofMillis(sessionTtlMs),
        Duration.ofMillis(maxClockSkewMs),
        deviceProofRequired,
        Duration.ofMillis(deviceProofTtlMs),
        gossipPeers,
        gossipSecret,
        Duration.ofMillis(gossipIntervalMs),
        Duration.ofMillis(gossipTimeoutMs));
  }

  @JsonProperty
  public String getHiveId() {
    return hiveId;
  }

  @JsonProperty
  public void setHiveId(String hiveId) {
    this.hiveId = hiveId;
  }

  @JsonProperty
  public long getChallengeTtlMs() {
    return challengeTtlMs;
  }

  @JsonProperty
  public void setChallengeTtlMs(long challengeTtlMs) {
    this.challengeTtlMs = challengeTtlMs;
  }

  @JsonProperty
  public long getSessionTtlMs() {
    return sessionTtlMs;
  }

  @JsonProperty
  public void setSessionTtlMs(long sessionTtlMs) {
    this.sessionTtlMs = sessionTtlMs;
  }

  @JsonProperty
  public long getMaxClockSkewMs() {
    return maxClockSkewMs;
  }

  @JsonProperty
  public void setMaxClockSkewMs(long maxClockSkewMs) {
    this.maxClockSkewMs = maxClockSkewMs;
  }

  @JsonProperty
  public boolean isDeviceProofRequired() {
    return deviceProofRequired;
  }

  @JsonProperty
  public void setDeviceProofRequired(boolean deviceProofRequired) {
    this.deviceProofRequired = deviceProofRequired;
  }

  @JsonProperty
  public long getDeviceProofTtlMs() {
    return deviceProofTtlMs;
  }

  @JsonProperty
  public void setDeviceProofTtlMs(long deviceProofTtlMs) {
    this.deviceProofTtlMs = deviceProofTtlMs;
  }

  @JsonProperty
  public List<String> getGossipPeers() {
    return gossipPeers;
  }

  @JsonProperty
  public void setGossipPeers(List<String> gossipPeers) {
    this.gossipPeers = gossipPeers;
  }

  @JsonProperty
  public String getGossipSecret() {
    return gossipSecret;
  }

  @JsonProperty
  public void setGossipSecret(String gossipSecret) {
    this.gossipSecret = gossipSecret;
  }

  @JsonProperty
  public long getGossipIntervalMs() {
    return gossipIntervalMs;
  }

  @JsonProperty
  public void setGossipIntervalMs(long gossipIntervalMs) {
    this.gossipIntervalMs = gossipIntervalMs;
  }

  @JsonProperty
  public long getGossipTimeoutMs() {
    return gossipTimeoutMs;
  }

  @JsonProperty
  public void setGossipTimeoutMs(long gossipTimeoutMs) {
    this.gossipTimeoutMs = gossipTimeoutMs;
  }

  @JsonProperty
  public String getStorage() {
    return storage;
  }

  @JsonProperty
  public void setStorage(String storage) {
    this.storage = storage;
  }

  @JsonProperty
  public String getMvStorePath() {
    return mvStorePath;
  }

  @JsonProperty
  public void setMvStorePath(String mvStorePath) {
    this.mvStorePath = mvStorePath;
  }
}
