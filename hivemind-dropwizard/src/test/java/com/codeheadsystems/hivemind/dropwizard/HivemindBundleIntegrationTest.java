package com.codeheadsystems.hivemind.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.hivemind.client.accessor.HivemindAccessor;
import com.codeheadsystems.hivemind.client.crypto.AgentKeyPair;
import com.codeheadsystems.hivemind.client.manager.HivemindClientManager;
import com.codeheadsystems.hivemind.client.model.AgentSession;
import com.codeheadsystems.hivemind.client.model.ServerConnectionInfo;
import com.codeheadsystems.hivemind.client.model.ServerIdentifier;
import com.codeheadsystems.hivemind.model.ChallengeRequest;
import com.codeheadsystems.hivemind.model.ChallengeResponse;
import com.codeheadsystems.hivemind.model.GossipBatch;
import com.codeheadsystems.hivemind.model.HiveMessage;
import com.codeheadsystems.hivemind.model.JoinRequest;
import com.codeheadsystems.hivemind.model.MessageSource;
import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import com.codeheadsystems.hivemind.protocol.JoinMessage;
import com.codeheadsystems.hivemind.protocol.Timestamps;
import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import com.codeheadsystems.hivemind.server.gossip.HttpGossipPeerClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.Invocation;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import java.net.http.HttpClient;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Dropwizard integration tests for {@link HivemindBundle}.
 * <p>
 * Starts a real embedded Jetty server with in-memory storage and exercises join, messaging and
 * the gossip endpoints over HTTP. Each test uses its own hive so tests do not see each other's
 * messages.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class HivemindBundleIntegrationTest {

  static final DropwizardAppExtension<HivemindConfiguration> APP =
      new DropwizardAppExtension<>(
          HivemindApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final ServerIdentifier SERVER_ID = new ServerIdentifier("local");
  private static final SecureRandom RANDOM = new SecureRandom();

  private HivemindAccessor accessor;
  private HivemindClientManager clientManager;

  @BeforeEach
  void setUp() {
    accessor = new HivemindAccessor(HttpClient.newHttpClient(), MAPPER,
        Map.of(SERVER_ID, new ServerConnectionInfo(URI.create(baseUrl()))));
    clientManager = new HivemindClientManager(accessor, Clock.systemUTC());
  }

  // ── Server description ───────────────────────────────────────────────────

  @Test
  void healthCheckReportsHealthy() {
    Response response = APP.client()
        .target(String.format("http://localhost:%d/healthcheck", APP.getAdminPort()))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.readEntity(String.class)).contains("hive-storage");
  }

  @Test
  void health_reportsProtocolAndDefaultHive() throws Exception {
    JsonNode body = getJson("/health", null, 200);

    assertThat(body.get("status").asText()).isEqualTo("ok");
    assertThat(body.get("protocol").asText()).isEqualTo(HivemindProtocol.PROTOCOL_VERSION);
    assertThat(body.get("hive_id").asText()).isEqualTo("h1");
  }

  @Test
  void protocol_reportsConfiguredTimings() throws Exception {
    JsonNode body = getJson("/protocol", null, 200);

    assertThat(body.get("protocol_version").asText()).isEqualTo(HivemindProtocol.PROTOCOL_VERSION);
    assertThat(body.get("challenge_ttl_ms").asLong()).isEqualTo(120_000L);
    assertThat(body.get("session_ttl_ms").asLong()).isEqualTo(86_400_000L);
    assertThat(body.get("max_clock_skew_ms").asLong()).isEqualTo(120_000L);
  }

  @Test
  void unknownRoute_returns404() {
    Response response = APP.client().target(baseUrl() + "/no-such-route").request().get();

    assertThat(response.getStatus()).isEqualTo(404);
  }

  // ── Join and messaging ───────────────────────────────────────────────────

  @Test
  void joinPostRead_endToEnd() {
    AgentKeyPair agent = AgentKeyPair.generate(RANDOM);

    AgentSession session = clientManager.join(SERVER_ID, "agent-001", agent, "h1");
    clientManager.post(session, "hello");
    List<HiveMessage> messages = clientManager.read(session, 0L, 50);

    assertThat(session.token()).startsWith("h1.");
    assertThat(messages).singleElement().satisfies(message -> {
      assertThat(message.id()).isEqualTo(1L);
      assertThat(message.content()).isEqualTo("hello");
      assertThat(message.agentId()).isEqualTo("agent-001");
      assertThat(message.hiveId()).isEqualTo("h1");
      assertThat(message.channel()).isEqualTo("default");
      assertThat(message.source()).isEqualTo(MessageSource.LOCAL);
    });
    assertThat(clientManager.read(session, 1L, 50)).isEmpty();
  }

  @Test
  void join_replayedNonce_isRejected() {
    AgentKeyPair agent = AgentKeyPair.generate(RANDOM);
    JoinRequest request = signedJoin(agent, "agent-replay", "replay-hive");

    assertThat(accessor.join(SERVER_ID, request).sessionToken()).startsWith("replay-hive.");
    assertThatThrownBy(() -> accessor.join(SERVER_ID, request))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("challenge not found");
  }

  @Test
  void join_badSignature_leavesChallengeUsable() {
    AgentKeyPair agent = AgentKeyPair.generate(RANDOM);
    AgentKeyPair impostor = AgentKeyPair.generate(RANDOM);
    JoinRequest genuine = signedJoin(agent, "agent-sig", "sig-hive");
    JoinRequest forged = new JoinRequest(genuine.agentId(), genuine.pubkey(), genuine.nonce(),
        impostor.signBase64("anything"), genuine.timestamp(), genuine.hiveId(), genuine.expiresAt());

    assertThatThrownBy(() -> accessor.join(SERVER_ID, forged))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("invalid signature");
    assertThat(accessor.join(SERVER_ID, genuine).agentId()).isEqualTo("agent-sig");
  }

  @Test
  void join_missingFields_returns400() throws Exception {
    Response response = postRaw("/join", "{\"agent_id\":\"a\"}");

    assertThat(response.getStatus()).isEqualTo(400);
    assertThat(MAPPER.readTree(response.readEntity(String.class)).get("message").asText())
        .contains("required");
  }

  @Test
  void challenge_invalidPublicKey_returns400() {
    Response response = postRaw("/challenge", "{\"agent_id\":\"a\",\"pubkey\":\"0OIl\"}");

    assertThat(response.getStatus()).isEqualTo(400);
  }

  @Test
  void challenge_malformedJson_returns400() {
    Response response = postRaw("/challenge", "{not json");

    assertThat(response.getStatus()).isEqualTo(400);
  }

  @Test
  void messages_noToken_returns401() {
    Response response = APP.client().target(baseUrl() + "/messages").request().get();

    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void messages_bogusToken_returns401() {
    Response response = APP.client().target(baseUrl() + "/messages")
        .request()
        .header("Authorization", "Bearer h1.not-a-real-token")
        .get();

    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void message_blankContent_returns400() {
    AgentSession session = clientManager.join(SERVER_ID, "agent-blank", AgentKeyPair.generate(RANDOM), "blank-hive");

    Response response = APP.client().target(baseUrl() + "/message")
        .request()
        .header("Authorization", "Bearer " + session.token())
        .post(Entity.entity("{\"content\":\"  \"}", MediaType.APPLICATION_JSON_TYPE));

    assertThat(response.getStatus()).isEqualTo(400);
  }

  @Test
  void messages_nonNumericCursor_readsFromStart() throws Exception {
    AgentSession session = clientManager.join(SERVER_ID, "agent-cursor", AgentKeyPair.generate(RANDOM), "cursor-hive");
    clientManager.post(session, "one", "ops");

    JsonNode body = getJson("/messages?since=abc&limit=0", session.token(), 200);

    assertThat(body.get("hive_id").asText()).isEqualTo("cursor-hive");
    assertThat(body.get("messages")).hasSize(1);
    assertThat(body.get("messages").get(0).get("channel").asText()).isEqualTo("ops");
  }

  // ── Gossip endpoints ─────────────────────────────────────────────────────

  @Test
  void gossipPush_oneGoodOneMalformed_acceptsOne() throws Exception {
    String batch = """
        {"hive_id":"push-hive","messages":[
          {"uid":"p-1","agentId":"agent-x","hiveId":"push-hive","content":"hi","createdAtMs":1700000000000,
           "source":"local"},
          {"uid":"p-2"}
        ]}
        """;

    JsonNode pushed = MAPPER.readTree(postRaw("/gossip/push", batch).readEntity(String.class));
    JsonNode feed = getJson("/gossip/messages?hive_id=push-hive&since_ms=0", null, 200);

    assertThat(pushed.get("accepted").asInt()).isEqualTo(1);
    assertThat(pushed.get("skipped").asInt()).isEqualTo(1);
    assertThat(feed.get("hive_id").asText()).isEqualTo("push-hive");
    assertThat(feed.get("server_time_ms").asLong()).isPositive();
    assertThat(feed.get("messages")).singleElement().satisfies(record -> {
      assertThat(record.get("uid").asText()).isEqualTo("p-1");
      assertThat(record.get("source").asText()).isEqualTo("gossip");
      assertThat(record.get("ts").asText()).isEqualTo(Timestamps.format(1700000000000L));
    });
  }

  @Test
  void gossipPush_nonArrayMessages_acceptsNothing() throws Exception {
    JsonNode pushed = MAPPER.readTree(
        postRaw("/gossip/push", "{\"hive_id\":\"odd-hive\",\"messages\":\"nope\"}").readEntity(String.class));

    assertThat(pushed.get("accepted").asInt()).isZero();
    assertThat(pushed.get("skipped").asInt()).isZero();
  }

  @Test
  void gossipFeed_unknownHive_isEmpty() throws Exception {
    JsonNode feed = getJson("/gossip/messages?hive_id=never-seen", null, 200);

    assertThat(feed.get("messages")).isEmpty();
  }

  @Test
  void httpPeerClient_pullsFeedFromRunningServer() {
    AgentSession session = clientManager.join(SERVER_ID, "agent-feed", AgentKeyPair.generate(RANDOM), "feed-hive");
    HiveMessage posted = clientManager.post(session, "for peers");
    HivemindServerConfig peerConfig = HivemindServerConfig.defaults("feed-hive");
    HttpGossipPeerClient peerClient = new HttpGossipPeerClient(
        peerConfig, HttpGossipPeerClient.defaultHttpClient(peerConfig), MAPPER);

    GossipBatch batch = peerClient.fetch(baseUrl(), "feed-hive", 0L);
    GossipBatch later = peerClient.fetch(baseUrl(), "feed-hive", posted.createdAtMs() + 1);

    assertThat(batch.hiveId()).isEqualTo("feed-hive");
    assertThat(batch.records()).singleElement()
        .satisfies(record -> assertThat(record.get("uid").asText()).isEqualTo(posted.uid()));
    assertThat(later.records()).isEmpty();
  }

  // ── Helpers ──────────────────────────────────────────────────────────────

  private JoinRequest signedJoin(AgentKeyPair agent, String agentId, String hiveId) {
    ChallengeResponse challenge = accessor.challenge(SERVER_ID,
        new ChallengeRequest(agentId, agent.publicKeyBase58(), hiveId));
    String timestamp = Timestamps.format(Instant.now());
    JoinMessage message = new JoinMessage(agentId, agent.publicKeyBase58(), challenge.nonce(),
        challenge.hiveId(), challenge.expiresAt(), timestamp);
    return new JoinRequest(agentId, agent.publicKeyBase58(), challenge.nonce(),
        agent.signBase64(message.canonical()), timestamp, challenge.hiveId(), challenge.expiresAt());
  }

  private Response postRaw(String path, String json) {
    return APP.client().target(baseUrl() + path)
        .request()
        .post(Entity.entity(json, MediaType.APPLICATION_JSON_TYPE));
  }

  private JsonNode getJson(String path, String token, int expectedStatus) throws Exception {
    Invocation.Builder request = APP.client().target(baseUrl() + path).request();
    if (token != null) {
      request = request.header("Authorization", "Bearer " + token);
    }
    Response response = request.get();
    assertThat(response.getStatus()).isEqualTo(expectedStatus);
    return MAPPER.readTree(response.readEntity(String.class));
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
