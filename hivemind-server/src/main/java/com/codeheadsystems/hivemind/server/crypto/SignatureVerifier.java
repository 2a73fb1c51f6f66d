package com.codeheadsystems.hivemind.server.crypto;

import com.codeheadsystems.hivemind.protocol.Base58;
import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import jakarta.inject.Singleton;
import java.util.Base64;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies detached Ed25519 signatures.
 * <p>
 * Every method answers {@code false} rather than throwing: a key or signature that cannot be
 * decoded is simply not a valid proof.
 */
@Singleton
public class SignatureVerifier {

  private static final Logger log = LoggerFactory.getLogger(SignatureVerifier.class);

  /**
   * Longest base58 form of a 32-byte key.
   */
  static final int MAX_BASE58_KEY_CHARS = 44;

  /**
   * Longest padded base64 form of a 64-byte signature; keys are shorter.
   */
  static final int MAX_BASE64_CHARS = 88;

  /**
   * Verifies a raw signature over a message.
   *
   * @param message   signed bytes
   * @param signature 64-byte signature
   * @param publicKey 32-byte public key
   * @return true if the signature is valid
   */
  public boolean verify(byte[] message, byte[] signature, byte[] publicKey) {
    if (message == null || signature == null || publicKey == null) {
      return false;
    }
    if (publicKey.length != HivemindProtocol.PUBLIC_KEY_LENGTH
        || signature.length != HivemindProtocol.SIGNATURE_LENGTH) {
      log.debug("verify: bad lengths key={} signature={}", publicKey.length, signature.length);
      return false;
    }
    try {
      Ed25519Signer signer = new Ed25519Signer();
      signer.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
      signer.update(message, 0, message.length);
      return signer.verifySignature(signature);
    } catch (IllegalArgumentException e) {
      log.debug("verify: rejected key material: {}", e.getMessage());
      return false;
    }
  }

  /**
   * Verifies a base64 signature against a base58 agent public key.
   *
   * @param message         signed bytes
   * @param signatureBase64 base64 signature
   * @param publicKeyBase58 base58 public key
   * @return true if the signature is valid
   */
  public boolean verifyBase58Key(byte[] message, String signatureBase64, String publicKeyBase58) {
    byte[] publicKey = decodeBase58(publicKeyBase58);
    byte[] signature = decodeBase64(signatureBase64);
    return publicKey != null && signature != null && verify(message, signature, publicKey);
  }

  /**
   * Verifies a base64 signature against a base64 device public key.
   *
   * @param message         signed bytes
   * @param signatureBase64 base64 signature
   * @param publicKeyBase64 base64 public key
   * @return true if the signature is valid
   */
  public boolean verifyBase64Key(byte[] message, String signatureBase64, String publicKeyBase64) {
    byte[] publicKey = decodeBase64(publicKeyBase64);
    byte[] signature = decodeBase64(signatureBase64);
    return publicKey != null && signature != null && verify(message, signature, publicKey);
  }

  /**
   * Checks that the string is base58 and decodes to a 32-byte key.
   *
   * @param publicKeyBase58 candidate key
   * @return true if well-formed
   */
  public boolean isValidPublicKey(String publicKeyBase58) {
    byte[] publicKey = decodeBase58(publicKeyBase58);
    return publicKey != null && publicKey.length == HivemindProtocol.PUBLIC_KEY_LENGTH;
  }

  private static byte[] decodeBase58(String value) {
    if (value == null || value.isEmpty() || value.length() > MAX_BASE58_KEY_CHARS) {
      return null;
    }
    try {
      return Base58.decode(value);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static byte[] decodeBase64(String value) {
    if (value == null || value.isEmpty() || value.length() > MAX_BASE64_CHARS) {
      return null;
    }
    try {
      return Base64.getDecoder().decode(value);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
