package com.codeheadsystems.hivemind.client.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.hivemind.protocol.Base58;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AgentKeyPairTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final SecureRandom RANDOM = new SecureRandom();

  @TempDir
  Path tempDir;

  @Test
  void signBase64_verifiesAgainstPublicKey() {
    AgentKeyPair keyPair = AgentKeyPair.generate(RANDOM);

    byte[] signature = Base64.getDecoder().decode(keyPair.signBase64("hello hive"));

    Ed25519Signer verifier = new Ed25519Signer();
    verifier.init(false, new Ed25519PublicKeyParameters(Base58.decode(keyPair.publicKeyBase58()), 0));
    byte[] message = "hello hive".getBytes(StandardCharsets.UTF_8);
    verifier.update(message, 0, message.length);
    assertThat(signature).hasSize(64);
    assertThat(verifier.verifySignature(signature)).isTrue();
  }

  @Test
  void secretKey_isSeedFollowedByPublicKey() {
    AgentKeyPair keyPair = AgentKeyPair.generate(RANDOM);

    byte[] secretKey = keyPair.secretKey();

    assertThat(secretKey).hasSize(64);
    assertThat(Arrays.copyOfRange(secretKey, 32, 64)).isEqualTo(keyPair.publicKey());
    assertThat(AgentKeyPair.fromSecretKey(secretKey).publicKeyBase58()).isEqualTo(keyPair.publicKeyBase58());
  }

  @Test
  void fromSecretKey_seedOnly_derivesSamePublicKey() {
    AgentKeyPair keyPair = AgentKeyPair.generate(RANDOM);
    byte[] seed = Arrays.copyOf(keyPair.secretKey(), 32);

    assertThat(AgentKeyPair.fromSecretKey(seed).publicKey()).isEqualTo(keyPair.publicKey());
  }

  @Test
  void fromSecretKey_mismatchedPublicHalf_isRejected() {
    byte[] secretKey = AgentKeyPair.generate(RANDOM).secretKey();
    secretKey[40] ^= 0x01;

    assertThatThrownBy(() -> AgentKeyPair.fromSecretKey(secretKey))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("does not match");
  }

  @Test
  void fromSecretKey_wrongLength_isRejected() {
    assertThatThrownBy(() -> AgentKeyPair.fromSecretKey(new byte[31]))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> AgentKeyPair.fromSecretKey(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void saveThenLoad_restoresSameIdentity() throws Exception {
    AgentKeyPair keyPair = AgentKeyPair.generate(RANDOM);
    Path file = tempDir.resolve("agent.json");

    keyPair.save(file, MAPPER);
    AgentKeyPair loaded = AgentKeyPair.load(file, MAPPER);

    assertThat(Files.readString(file)).startsWith("[").doesNotContain("-");
    assertThat(loaded.publicKeyBase58()).isEqualTo(keyPair.publicKeyBase58());
    assertThat(loaded.signBase64("x")).isEqualTo(keyPair.signBase64("x"));
  }

  @Test
  void load_valueOutOfByteRange_isRejected() throws Exception {
    Path file = tempDir.resolve("bad.json");
    Files.writeString(file, "[256" + ",0".repeat(63) + "]");

    assertThatThrownBy(() -> AgentKeyPair.load(file, MAPPER))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("index 0");
  }

  @Test
  void load_notAnArray_throwsIoException() throws Exception {
    Path file = tempDir.resolve("object.json");
    Files.writeString(file, "{\"secretKey\":\"abc\"}");

    assertThatThrownBy(() -> AgentKeyPair.load(file, MAPPER)).isInstanceOf(IOException.class);
  }
}
