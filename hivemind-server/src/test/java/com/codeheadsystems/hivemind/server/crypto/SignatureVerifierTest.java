package com.codeheadsystems.hivemind.server.crypto;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.hivemind.protocol.Base58;
import com.codeheadsystems.hivemind.server.TestAgent;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class SignatureVerifierTest {

  private static final byte[] MESSAGE = "hello hive".getBytes(StandardCharsets.UTF_8);

  private final SignatureVerifier verifier = new SignatureVerifier();
  private final TestAgent agent = TestAgent.generate();

  @Test
  void verify_validSignature_returnsTrue() {
    assertThat(verifier.verify(MESSAGE, agent.sign(MESSAGE), agent.publicKey())).isTrue();
  }

  @Test
  void verify_tamperedMessage_returnsFalse() {
    byte[] signature = agent.sign(MESSAGE);

    assertThat(verifier.verify("hello hivf".getBytes(StandardCharsets.UTF_8), signature, agent.publicKey()))
        .isFalse();
  }

  @Test
  void verify_otherKey_returnsFalse() {
    TestAgent other = TestAgent.generate();

    assertThat(verifier.verify(MESSAGE, agent.sign(MESSAGE), other.publicKey())).isFalse();
  }

  @Test
  void verify_wrongLengths_returnFalse() {
    assertThat(verifier.verify(MESSAGE, new byte[63], agent.publicKey())).isFalse();
    assertThat(verifier.verify(MESSAGE, agent.sign(MESSAGE), new byte[31])).isFalse();
    assertThat(verifier.verify(MESSAGE, null, agent.publicKey())).isFalse();
  }

  @Test
  void verifyBase58Key_roundTrip() {
    assertThat(verifier.verifyBase58Key(MESSAGE, agent.signBase64(MESSAGE), agent.publicKeyBase58())).isTrue();
  }

  @Test
  void verifyBase58Key_garbageInputs_returnFalseWithoutThrowing() {
    assertThat(verifier.verifyBase58Key(MESSAGE, "***not base64***", agent.publicKeyBase58())).isFalse();
    assertThat(verifier.verifyBase58Key(MESSAGE, agent.signBase64(MESSAGE), "0OIl")).isFalse();
    assertThat(verifier.verifyBase58Key(MESSAGE, "", "")).isFalse();
  }

  @Test
  void verifyBase64Key_roundTrip() {
    assertThat(verifier.verifyBase64Key(MESSAGE, agent.signBase64(MESSAGE), agent.publicKeyBase64())).isTrue();
    assertThat(verifier.verifyBase64Key(MESSAGE, agent.signBase64(MESSAGE), agent.publicKeyBase58())).isFalse();
  }

  @Test
  void isValidPublicKey() {
    assertThat(verifier.isValidPublicKey(agent.publicKeyBase58())).isTrue();
    assertThat(verifier.isValidPublicKey(Base58.encode(new byte[16]))).isFalse();
    assertThat(verifier.isValidPublicKey(Base64.getEncoder().encodeToString(agent.publicKey()) + "+/")).isFalse();
    assertThat(verifier.isValidPublicKey(null)).isFalse();
  }

  @Test
  void isValidPublicKey_acceptsLongestEncodingOf32Bytes() {
    byte[] highest = new byte[32];
    Arrays.fill(highest, (byte) 0xff);
    String encoded = Base58.encode(highest);

    assertThat(encoded).hasSize(SignatureVerifier.MAX_BASE58_KEY_CHARS);
    assertThat(verifier.isValidPublicKey(encoded)).isTrue();
  }

  @Test
  @Timeout(value = 1, unit = TimeUnit.SECONDS)
  void oversizedInputs_areRejectedWithoutDecoding() {
    String hugeBase58 = "2".repeat(60_000);
    String hugeBase64 = "A".repeat(60_000);

    assertThat(verifier.isValidPublicKey(hugeBase58)).isFalse();
    assertThat(verifier.isValidPublicKey("1" + agent.publicKeyBase58() + "1".repeat(44))).isFalse();
    assertThat(verifier.verifyBase58Key(MESSAGE, agent.signBase64(MESSAGE), hugeBase58)).isFalse();
    assertThat(verifier.verifyBase64Key(MESSAGE, hugeBase64, agent.publicKeyBase64())).isFalse();
    assertThat(verifier.verifyBase64Key(MESSAGE, agent.signBase64(MESSAGE), hugeBase64)).isFalse();
  }
}
