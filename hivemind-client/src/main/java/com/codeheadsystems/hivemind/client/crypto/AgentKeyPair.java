package com.codeheadsystems.hivemind.client.crypto;

import com.codeheadsystems.hivemind.protocol.Base58;
import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

/**
 * An agent's Ed25519 identity.
 * <p>
 * The secret key is kept in the 64-byte layout used by Solana key files: the 32-byte seed followed
 * by the 32-byte public key. Key files are JSON arrays of those 64 unsigned byte values.
 */
public final class AgentKeyPair {

  private static final int SEED_LENGTH = 32;
  private static final int SECRET_KEY_LENGTH = SEED_LENGTH + HivemindProtocol.PUBLIC_KEY_LENGTH;

  private final Ed25519PrivateKeyParameters privateKey;
  private final Ed25519PublicKeyParameters publicKey;

  private AgentKeyPair(Ed25519PrivateKeyParameters privateKey) {
    this.privateKey = privateKey;
    this.publicKey = privateKey.generatePublicKey();
  }

  /**
   * Generates a fresh key pair.
   *
   * @param random randomness source
   * @return the key pair
   */
  public static AgentKeyPair generate(SecureRandom random) {
    return new AgentKeyPair(new Ed25519PrivateKeyParameters(random));
  }

  /**
   * Restores a key pair from a 32-byte seed or a 64-byte seed-plus-public-key secret key.
   *
   * @param secretKey the key bytes
   * @return the key pair
   * @throws IllegalArgumentException if the length is wrong or the embedded public key does not
   *                                  belong to the seed
   */
  public static AgentKeyPair fromSecretKey(byte[] secretKey) {
    if (secretKey == null || (secretKey.length != SEED_LENGTH && secretKey.length != SECRET_KEY_LENGTH)) {
      throw new IllegalArgumentException("secret key must be 32 or 64 bytes");
    }
    AgentKeyPair keyPair = new AgentKeyPair(
        new Ed25519PrivateKeyParameters(Arrays.copyOfRange(secretKey, 0, SEED_LENGTH), 0));
    if (secretKey.length == SECRET_KEY_LENGTH) {
      byte[] embedded = Arrays.copyOfRange(secretKey, SEED_LENGTH, SECRET_KEY_LENGTH);
      if (!MessageDigest.isEqual(embedded, keyPair.publicKey())) {
        throw new IllegalArgumentException("public half of secret key does not match its seed");
      }
    }
    return keyPair;
  }

  /**
   * Loads a key file holding a JSON array of 64 byte values.
   *
   * @param path         the key file
   * @param objectMapper json reader
   * @return the key pair
   * @throws IOException              if the file cannot be read or is not a JSON array of integers
   * @throws IllegalArgumentException if the key material is invalid
   */
  public static AgentKeyPair load(Path path, ObjectMapper objectMapper) throws IOException {
    int[] values = objectMapper.readValue(path.toFile(), int[].class);
    byte[] secretKey = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      if (values[i] < 0 || values[i] > 255) {
        throw new IllegalArgumentException("key file value out of byte range at index " + i);
      }
      secretKey[i] = (byte) values[i];
    }
    return fromSecretKey(secretKey);
  }

  /**
   * Writes this key pair as a JSON array of 64 byte values.
   *
   * @param path         target file, replaced if present
   * @param objectMapper json writer
   * @throws IOException if the file cannot be written
   */
  public void save(Path path, ObjectMapper objectMapper) throws IOException {
    byte[] secretKey = secretKey();
    int[] values = new int[secretKey.length];
    for (int i = 0; i < secretKey.length; i++) {
      values[i] = secretKey[i] & 0xff;
    }
    Files.writeString(path, objectMapper.writeValueAsString(values), StandardCharsets.UTF_8);
  }

  /**
   * The 64-byte secret key: seed followed by public key.
   *
   * @return a fresh copy
   */
  public byte[] secretKey() {
    byte[] secretKey = new byte[SECRET_KEY_LENGTH];
    System.arraycopy(privateKey.getEncoded(), 0, secretKey, 0, SEED_LENGTH);
    System.arraycopy(publicKey(), 0, secretKey, SEED_LENGTH, HivemindProtocol.PUBLIC_KEY_LENGTH);
    return secretKey;
  }

  public byte[] publicKey() {
    return publicKey.getEncoded();
  }

  public String publicKeyBase58() {
    return Base58.encode(publicKey());
  }

  public String publicKeyBase64() {
    return Base64.getEncoder().encodeToString(publicKey());
  }

  /**
   * Detached Ed25519 signature.
   *
   * @param message bytes to sign
   * @return the 64-byte signature
   */
  public byte[] sign(byte[] message) {
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, privateKey);
    signer.update(message, 0, message.length);
    return signer.generateSignature();
  }

  /**
   * Signs the UTF-8 bytes of a text.
   *
   * @param text text to sign
   * @return base64 signature
   */
  public String signBase64(String text) {
    return Base64.getEncoder().encodeToString(sign(text.getBytes(StandardCharsets.UTF_8)));
  }

  @Override
  public String toString() {
    return "AgentKeyPair{" + publicKeyBase58() + "}";
  }
}
