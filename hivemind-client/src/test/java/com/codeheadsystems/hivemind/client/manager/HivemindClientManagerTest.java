package com.codeheadsystems.hivemind.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.hivemind.client.accessor.HivemindAccessor;
import com.codeheadsystems.hivemind.client.crypto.AgentKeyPair;
import com.codeheadsystems.hivemind.client.model.AgentSession;
import com.codeheadsystems.hivemind.client.model.DeviceProof;
import com.codeheadsystems.hivemind.client.model.ServerIdentifier;
import com.codeheadsystems.hivemind.model.ChallengeRequest;
import com.codeheadsystems.hivemind.model.ChallengeResponse;
import com.codeheadsystems.hivemind.model.HiveMessage;
import com.codeheadsystems.hivemind.model.JoinRequest;
import com.codeheadsystems.hivemind.model.JoinResponse;
import com.codeheadsystems.hivemind.model.MessagePostRequest;
import com.codeheadsystems.hivemind.model.MessagePostResponse;
import com.codeheadsystems.hivemind.model.MessageSource;
import com.codeheadsystems.hivemind.model.MessagesResponse;
import com.codeheadsystems.hivemind.protocol.Base58;
import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import com.codeheadsystems.hivemind.protocol.JoinMessage;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HivemindClientManagerTest {

  private static final ServerIdentifier SERVER_ID = new ServerIdentifier("local");
  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00.123Z");
  private static final String EXPIRES_AT = "2025-01-01T00:02:00.123Z";
  private static final AgentKeyPair AGENT = AgentKeyPair.generate(new SecureRandom());

  @Mock private HivemindAccessor hivemindAccessor;

  private HivemindClientManager manager;

  @BeforeEach
  void setUp() {
    manager = new HivemindClientManager(hivemindAccessor, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private void stubChallengeAndJoin() {
    when(hivemindAccessor.challenge(eq(SERVER_ID), any(ChallengeRequest.class)))
        .thenReturn(new ChallengeResponse(HivemindProtocol.PROTOCOL_VERSION, "nonce-1", "h1", EXPIRES_AT));
    when(hivemindAccessor.join(eq(SERVER_ID), any(JoinRequest.class)))
        .thenReturn(new JoinResponse("h1.tok", "2025-01-02T00:00:00.123Z", "agent-001", "h1"));
  }

  @Test
  void join_signsCanonicalMessageWithChallengeValues() {
    stubChallengeAndJoin();

    AgentSession session = manager.join(SERVER_ID, "agent-001", AGENT, "h1");

    ArgumentCaptor<ChallengeRequest> challenge = ArgumentCaptor.forClass(ChallengeRequest.class);
    verify(hivemindAccessor).challenge(eq(SERVER_ID), challenge.capture());
    assertThat(challenge.getValue().pubkey()).isEqualTo(AGENT.publicKeyBase58());

    ArgumentCaptor<JoinRequest> join = ArgumentCaptor.forClass(JoinRequest.class);
    verify(hivemindAccessor).join(eq(SERVER_ID), join.capture());
    JoinRequest request = join.getValue();
    assertThat(request.nonce()).isEqualTo("nonce-1");
    assertThat(request.hiveId()).isEqualTo("h1");
    assertThat(request.expiresAt()).isEqualTo(EXPIRES_AT);
    assertThat(request.timestamp()).isEqualTo("2025-01-01T00:00:00.123Z");
    assertThat(request.hasAnyDeviceProofField()).isFalse();

    JoinMessage expected = new JoinMessage("agent-001", AGENT.publicKeyBase58(), "nonce-1", "h1", EXPIRES_AT,
        request.timestamp());
    assertThat(verifies(expected.bytes(), request.signature(), Base58.decode(request.pubkey()))).isTrue();

    assertThat(session.token()).isEqualTo("h1.tok");
    assertThat(session.hiveId()).isEqualTo("h1");
    assertThat(session.toString()).doesNotContain("h1.tok");
  }

  @Test
  void join_withDeviceProof_sendsAllFourFields() {
    stubChallengeAndJoin();
    AgentKeyPair device = AgentKeyPair.generate(new SecureRandom());
    DeviceProof proof = DeviceProof.sign(device, "device-nonce", NOW);

    manager.join(SERVER_ID, "agent-001", AGENT, "h1", proof);

    ArgumentCaptor<JoinRequest> join = ArgumentCaptor.forClass(JoinRequest.class);
    verify(hivemindAccessor).join(eq(SERVER_ID), join.capture());
    JoinRequest request = join.getValue();
    assertThat(request.hasCompleteDeviceProof()).isTrue();
    assertThat(request.deviceSignedAt()).isEqualTo("2025-01-01T00:00:00.123Z");
    assertThat(verifies("device-nonce".getBytes(StandardCharsets.UTF_8), request.deviceSignature(),
        Base64.getDecoder().decode(request.devicePublicKey()))).isTrue();
  }

  @Test
  void join_rejected_propagatesSecurityException() {
    when(hivemindAccessor.challenge(eq(SERVER_ID), any(ChallengeRequest.class)))
        .thenReturn(new ChallengeResponse(HivemindProtocol.PROTOCOL_VERSION, "nonce-1", "h1", EXPIRES_AT));
    when(hivemindAccessor.join(eq(SERVER_ID), any(JoinRequest.class)))
        .thenThrow(new SecurityException("invalid signature"));

    assertThatThrownBy(() -> manager.join(SERVER_ID, "agent-001", AGENT, "h1"))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void postAndRead_useSessionToken() {
    AgentSession session = new AgentSession(SERVER_ID, "agent-001", "h1", "h1.tok", EXPIRES_AT);
    HiveMessage stored = new HiveMessage(1L, "u1", "2025-01-01T00:00:00.123Z", NOW.toEpochMilli(),
        "agent-001", "h1", "hello", "default", MessageSource.LOCAL);
    when(hivemindAccessor.postMessage(eq(SERVER_ID), eq("h1.tok"), any(MessagePostRequest.class)))
        .thenReturn(new MessagePostResponse(true, stored));
    when(hivemindAccessor.readMessages(SERVER_ID, "h1.tok", 0L, 50))
        .thenReturn(new MessagesResponse("h1", List.of(stored)));

    assertThat(manager.post(session, "hello")).isEqualTo(stored);
    assertThat(manager.read(session, 0L, 50)).containsExactly(stored);

    ArgumentCaptor<MessagePostRequest> post = ArgumentCaptor.forClass(MessagePostRequest.class);
    verify(hivemindAccessor).postMessage(eq(SERVER_ID), anyString(), post.capture());
    assertThat(post.getValue().content()).isEqualTo("hello");
    assertThat(post.getValue().channel()).isNull();
  }

  private static boolean verifies(byte[] message, String signatureBase64, byte[] publicKey) {
    Ed25519Signer verifier = new Ed25519Signer();
    verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
    verifier.update(message, 0, message.length);
    return verifier.verifySignature(Base64.getDecoder().decode(signatureBase64));
  }
}
