package com.codeheadsystems.hivemind.client.model;

import com.codeheadsystems.hivemind.client.crypto.AgentKeyPair;
import com.codeheadsystems.hivemind.protocol.Timestamps;
import java.time.Instant;

/**
 * A device's signature over a nonce, attached to a join as a secondary proof.
 *
 * @param publicKeyBase64 device public key
 * @param signatureBase64 device signature over the UTF-8 nonce
 * @param nonce           the signed nonce
 * @param signedAt        signing time, ISO-8601
 */
public record DeviceProof(String publicKeyBase64, String signatureBase64, String nonce, String signedAt) {

  /**
   * Signs a nonce with a device key.
   *
   * @param device   the device key
   * @param nonce    the nonce
   * @param signedAt signing time
   * @return the proof
   */
  public static DeviceProof sign(AgentKeyPair device, String nonce, Instant signedAt) {
    return new DeviceProof(device.publicKeyBase64(), device.signBase64(nonce), nonce, Timestamps.format(signedAt));
  }
}
