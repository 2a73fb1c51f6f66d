package com.codeheadsystems.hivemind.client.accessor;

import com.codeheadsystems.hivemind.client.exceptions.HivemindAccessorException;
import com.codeheadsystems.hivemind.client.model.ServerConnectionInfo;
import com.codeheadsystems.hivemind.client.model.ServerIdentifier;
import com.codeheadsystems.hivemind.model.ChallengeRequest;
import com.codeheadsystems.hivemind.model.ChallengeResponse;
import com.codeheadsystems.hivemind.model.HealthResponse;
import com.codeheadsystems.hivemind.model.JoinRequest;
import com.codeheadsystems.hivemind.model.JoinResponse;
import com.codeheadsystems.hivemind.model.MessagePostRequest;
import com.codeheadsystems.hivemind.model.MessagePostResponse;
import com.codeheadsystems.hivemind.model.MessagesResponse;
import com.codeheadsystems.hivemind.model.ProtocolResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the agent-facing endpoints of a hive server.
 * <p>
 * The {@code endpoint} stored in {@link ServerConnectionInfo} is the base URL of the server;
 * path segments are appended per endpoint. A 401 from any endpoint is surfaced as a
 * {@link SecurityException}. Other error statuses, I/O errors and interruptions are wrapped in
 * {@link HivemindAccessorException}.
 */
@Singleton
public class HivemindAccessor {

  private static final Logger log = LoggerFactory.getLogger(HivemindAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Map<ServerIdentifier, ServerConnectionInfo> serverConnections;

  /**
   * Instantiates a new Hivemind accessor.
   *
   * @param httpClient        the http client
   * @param objectMapper      the object mapper
   * @param serverConnections the server connections
   */
  @Inject
  public HivemindAccessor(final HttpClient httpClient,
                          final ObjectMapper objectMapper,
                          final Map<ServerIdentifier, ServerConnectionInfo> serverConnections) {
    log.info("HivemindAccessor({})", serverConnections.keySet());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.serverConnections = serverConnections;
  }

  public HealthResponse health(final ServerIdentifier serverId) {
    log.debug("health(serverId={})", serverId);
    return send(serverId, get(uri(serverId, "/health"), null), HealthResponse.class);
  }

  public ProtocolResponse protocol(final ServerIdentifier serverId) {
    log.debug("protocol(serverId={})", serverId);
    return send(serverId, get(uri(serverId, "/protocol"), null), ProtocolResponse.class);
  }

  /**
   * Requests a join challenge.
   *
   * @param serverId the server id
   * @param request  agent id, public key and optional hive
   * @return the nonce and expiry to sign
   */
  public ChallengeResponse challenge(final ServerIdentifier serverId, final ChallengeRequest request) {
    log.debug("challenge(serverId={}, agent={})", serverId, request.agentId());
    return send(serverId, post(uri(serverId, "/challenge"), request, null), ChallengeResponse.class);
  }

  /**
   * Redeems a signed challenge for a session.
   *
   * @param serverId the server id
   * @param request  the signed join request
   * @return the session token
   * @throws SecurityException if the server rejects the proof (HTTP 401)
   */
  public JoinResponse join(final ServerIdentifier serverId, final JoinRequest request) {
    log.debug("join(serverId={}, agent={})", serverId, request.agentId());
    return send(serverId, post(uri(serverId, "/join"), request, null), JoinResponse.class);
  }

  /**
   * Posts a message to the session's hive.
   *
   * @param serverId     the server id
   * @param sessionToken bearer token from {@link #join}
   * @param request      the message
   * @return the stored message
   */
  public MessagePostResponse postMessage(final ServerIdentifier serverId,
                                         final String sessionToken,
                                         final MessagePostRequest request) {
    log.debug("postMessage(serverId={})", serverId);
    return send(serverId, post(uri(serverId, "/message"), request, sessionToken), MessagePostResponse.class);
  }

  /**
   * Reads messages of the session's hive after an id cursor.
   *
   * @param serverId     the server id
   * @param sessionToken bearer token from {@link #join}
   * @param since        exclusive id cursor
   * @param limit        page size
   * @return the page
   */
  public MessagesResponse readMessages(final ServerIdentifier serverId,
                                       final String sessionToken,
                                       final long since,
                                       final int limit) {
    log.debug("readMessages(serverId={}, since={}, limit={})", serverId, since, limit);
    return send(serverId, get(uri(serverId, "/messages?since=" + since + "&limit=" + limit), sessionToken),
        MessagesResponse.class);
  }

  private URI uri(ServerIdentifier serverId, String pathAndQuery) {
    ServerConnectionInfo info = serverConnections.get(serverId);
    if (info == null) {
      throw new IllegalArgumentException("No connection info for server: " + serverId);
    }
    String base = info.endpoint().toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + pathAndQuery);
  }

  private HttpRequest get(URI uri, String bearerToken) {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri)
        .header("Accept", "application/json")
        .GET();
    return authorize(builder, bearerToken).build();
  }

  private HttpRequest post(URI uri, Object body, String bearerToken) {
    String requestBody;
    try {
      requestBody = objectMapper.writeValueAsString(body);
    } catch (IOException e) {
      throw new HivemindAccessorException("Unable to serialize request for " + uri, e);
    }
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(requestBody));
    return authorize(builder, bearerToken).build();
  }

  private static HttpRequest.Builder authorize(HttpRequest.Builder builder, String bearerToken) {
    if (bearerToken != null) {
      builder.header("Authorization", "Bearer " + bearerToken);
    }
    return builder;
  }

  private <T> T send(ServerIdentifier serverId, HttpRequest request, Class<T> responseType) {
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(serverId, response);
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      throw new HivemindAccessorException("HTTP request failed for server: " + serverId, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HivemindAccessorException("HTTP request interrupted for server: " + serverId, e);
    }
  }

  private void checkStatus(ServerIdentifier serverId, HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode == 401) {
      throw new SecurityException("Server rejected request (401) for server: " + serverId
          + errorMessage(response.body()));
    }
    if (statusCode >= 400) {
      throw new HivemindAccessorException(
          "Server returned HTTP " + statusCode + " for server: " + serverId + errorMessage(response.body()),
          null, statusCode);
    }
  }

  // Dropwizard error bodies are {"code":..., "message":...}.
  private String errorMessage(String body) {
    if (body == null || body.isBlank()) {
      return "";
    }
    try {
      String message = objectMapper.readTree(body).path("message").asText("");
      return message.isEmpty() ? "" : ": " + message;
    } catch (IOException e) {
      return "";
    }
  }
}
