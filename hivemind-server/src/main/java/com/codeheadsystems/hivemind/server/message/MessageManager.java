package com.codeheadsystems.hivemind.server.message;

import com.codeheadsystems.hivemind.model.HiveMessage;
import com.codeheadsystems.hivemind.model.MessagePostRequest;
import com.codeheadsystems.hivemind.model.MessagePostResponse;
import com.codeheadsystems.hivemind.model.MessageSource;
import com.codeheadsystems.hivemind.model.MessagesResponse;
import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import com.codeheadsystems.hivemind.protocol.Timestamps;
import com.codeheadsystems.hivemind.server.hive.HiveRegistry;
import com.codeheadsystems.hivemind.server.store.MessageCandidate;
import com.codeheadsystems.hivemind.server.store.Session;
import com.codeheadsystems.hivemind.server.store.StorageException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts and reads messages on behalf of an authenticated session.
 */
@Singleton
public class MessageManager {

  private static final Logger log = LoggerFactory.getLogger(MessageManager.class);

  public static final int DEFAULT_READ_LIMIT = 50;
  public static final int MAX_READ_LIMIT = 200;

  private final HiveRegistry hiveRegistry;
  private final Clock clock;

  /**
   * Instantiates a new Message manager.
   *
   * @param hiveRegistry hive routing
   * @param clock        time source
   */
  @Inject
  public MessageManager(final HiveRegistry hiveRegistry, final Clock clock) {
    this.hiveRegistry = hiveRegistry;
    this.clock = clock;
  }

  /**
   * Stores a new local message in the session's hive.
   *
   * @param session the author's session
   * @param request content and optional channel
   * @return the stored message
   * @throws IllegalArgumentException if content is missing
   * @throws StorageException         if the store refused the message
   */
  public MessagePostResponse post(final Session session, final MessagePostRequest request) {
    if (request == null || request.content() == null || request.content().isBlank()) {
      throw new IllegalArgumentException("content is required");
    }
    String channel = request.channel() == null || request.channel().isBlank()
        ? HivemindProtocol.DEFAULT_CHANNEL : request.channel();
    long now = clock.millis();
    MessageCandidate candidate = new MessageCandidate(UUID.randomUUID().toString(), Timestamps.format(now),
        now, session.agentId(), session.hiveId(), request.content(), channel, MessageSource.LOCAL);

    HiveMessage message = hiveRegistry.hive(session.hiveId())
        .exclusive(storage -> storage.messages().append(candidate))
        .orElseThrow(() -> new StorageException("message was not stored"));
    log.debug("post(agent={}, hive={}, id={})", message.agentId(), message.hiveId(), message.id());
    return new MessagePostResponse(true, message);
  }

  /**
   * Reads messages of the session's hive after a cursor.
   *
   * @param session the reader's session
   * @param since   exclusive id cursor
   * @param limit   requested page size, clamped to [1, 200]
   * @return the page, oldest first
   */
  public MessagesResponse read(final Session session, final long since, final int limit) {
    List<HiveMessage> messages = hiveRegistry.hive(session.hiveId())
        .exclusive(storage -> storage.messages().readSince(since, clampLimit(limit)));
    return new MessagesResponse(session.hiveId(), messages);
  }

  /**
   * Clamps a requested read limit.
   *
   * @param limit requested limit
   * @return a limit in [1, 200]
   */
  public static int clampLimit(int limit) {
    return Math.min(MAX_READ_LIMIT, Math.max(1, limit));
  }
}
