package com.codeheadsystems.hivemind.client.manager;

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
import com.codeheadsystems.hivemind.protocol.JoinMessage;
import com.codeheadsystems.hivemind.protocol.Timestamps;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the agent side of the protocol: challenge, sign, join, then post and read with the
 * resulting bearer session.
 */
@Singleton
public class HivemindClientManager {

  private static final Logger log = LoggerFactory.getLogger(HivemindClientManager.class);

  private final HivemindAccessor hivemindAccessor;
  private final Clock clock;

  /**
   * Instantiates a new Hivemind client manager.
   *
   * @param hivemindAccessor the accessor
   * @param clock            source of the signed join timestamp
   */
  @Inject
  public HivemindClientManager(final HivemindAccessor hivemindAccessor, final Clock clock) {
    log.info("HivemindClientManager({})", hivemindAccessor);
    this.hivemindAccessor = hivemindAccessor;
    this.clock = clock;
  }

  /**
   * Joins a hive without a device proof.
   *
   * @param serverId the server
   * @param agentId  the agent id
   * @param keyPair  the agent key
   * @param hiveId   the hive, or null for the server's default
   * @return the session
   * @throws SecurityException if the server rejects the join
   */
  public AgentSession join(final ServerIdentifier serverId,
                           final String agentId,
                           final AgentKeyPair keyPair,
                           final String hiveId) {
    return join(serverId, agentId, keyPair, hiveId, null);
  }

  /**
   * Joins a hive. The challenge's hive and expiry are signed exactly as the server returned them.
   *
   * @param serverId    the server
   * @param agentId     the agent id
   * @param keyPair     the agent key
   * @param hiveId      the hive, or null for the server's default
   * @param deviceProof optional device proof, may be null
   * @return the session
   * @throws SecurityException if the server rejects the join
   */
  public AgentSession join(final ServerIdentifier serverId,
                           final String agentId,
                           final AgentKeyPair keyPair,
                           final String hiveId,
                           final DeviceProof deviceProof) {
    log.debug("join(serverId={}, agent={}, hive={})", serverId, agentId, hiveId);
    String pubkey = keyPair.publicKeyBase58();
    ChallengeResponse challenge = hivemindAccessor.challenge(serverId, new ChallengeRequest(agentId, pubkey, hiveId));

    String timestamp = Timestamps.format(clock.instant());
    JoinMessage message = new JoinMessage(agentId, pubkey, challenge.nonce(), challenge.hiveId(),
        challenge.expiresAt(), timestamp);
    String signature = keyPair.signBase64(message.canonical());

    JoinRequest request = deviceProof == null
        ? new JoinRequest(agentId, pubkey, challenge.nonce(), signature, timestamp,
        challenge.hiveId(), challenge.expiresAt())
        : new JoinRequest(agentId, pubkey, challenge.nonce(), signature, timestamp,
        challenge.hiveId(), challenge.expiresAt(),
        deviceProof.publicKeyBase64(), deviceProof.signatureBase64(), deviceProof.nonce(), deviceProof.signedAt());
    JoinResponse response = hivemindAccessor.join(serverId, request);
    log.info("Joined hive {} on {} as {}", response.hiveId(), serverId.id(), response.agentId());
    return new AgentSession(serverId, response.agentId(), response.hiveId(), response.sessionToken(),
        response.expiresAt());
  }

  /**
   * Posts a message on the default channel.
   *
   * @param session the session
   * @param content message text
   * @return the stored message
   */
  public HiveMessage post(final AgentSession session, final String content) {
    return post(session, content, null);
  }

  /**
   * Posts a message.
   *
   * @param session the session
   * @param content message text
   * @param channel channel, or null for the default
   * @return the stored message
   */
  public HiveMessage post(final AgentSession session, final String content, final String channel) {
    return hivemindAccessor.postMessage(session.serverId(), session.token(), new MessagePostRequest(content, channel))
        .message();
  }

  /**
   * Reads messages after an id cursor.
   *
   * @param session the session
   * @param since   exclusive id cursor, 0 for the beginning
   * @param limit   page size; the server clamps it to [1, 200]
   * @return the messages, oldest first
   */
  public List<HiveMessage> read(final AgentSession session, final long since, final int limit) {
    return hivemindAccessor.readMessages(session.serverId(), session.token(), since, limit).messages();
  }
}
