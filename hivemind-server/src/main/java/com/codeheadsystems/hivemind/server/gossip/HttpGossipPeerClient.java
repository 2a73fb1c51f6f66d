package com.codeheadsystems.hivemind.server.gossip;

import com.codeheadsystems.hivemind.model.GossipBatch;
import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GossipPeerClient} over {@link HttpClient}.
 */
@Singleton
public class HttpGossipPeerClient implements GossipPeerClient {

  private static final Logger log = LoggerFactory.getLogger(HttpGossipPeerClient.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String gossipSecret;
  private final Duration timeout;

  /**
   * Instantiates a new Http gossip peer client.
   *
   * @param config       supplies the shared secret and timeout
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   */
  @Inject
  public HttpGossipPeerClient(final HivemindServerConfig config,
                              final HttpClient httpClient,
                              final ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.gossipSecret = config.gossipSecret();
    this.timeout = config.gossipTimeout();
  }

  /**
   * Builds an {@link HttpClient} with the configured connect timeout.
   *
   * @param config server settings
   * @return the client
   */
  public static HttpClient defaultHttpClient(HivemindServerConfig config) {
    return HttpClient.newBuilder()
        .connectTimeout(config.gossipTimeout())
        .build();
  }

  @Override
  public GossipBatch fetch(final String peer, final String hiveId, final long sinceMs) {
    log.trace("fetch(peer={}, hive={}, sinceMs={})", peer, hiveId, sinceMs);
    try {
      final URI uri = URI.create(peer + "/gossip/messages?hive_id="
          + URLEncoder.encode(hiveId, StandardCharsets.UTF_8) + "&since_ms=" + sinceMs);
      final HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(uri)
          .timeout(timeout)
          .header("Accept", "application/json")
          .GET();
      if (!gossipSecret.isEmpty()) {
        builder.header(HivemindProtocol.GOSSIP_SECRET_HEADER, gossipSecret);
      }
      final HttpResponse<String> httpResponse = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      checkStatus(peer, httpResponse.statusCode());
      final GossipBatch batch = objectMapper.readValue(httpResponse.body(), GossipBatch.class);
      if (batch == null) {
        throw new GossipPeerException("Empty gossip feed from peer: " + peer, null);
      }
      return batch;
    } catch (IOException e) {
      throw new GossipPeerException("Gossip fetch failed for peer: " + peer, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GossipPeerException("Gossip fetch interrupted for peer: " + peer, e);
    } catch (IllegalArgumentException e) {
      throw new GossipPeerException("Invalid gossip request for peer: " + peer, e);
    }
  }

  private void checkStatus(String peer, int statusCode) {
    if (statusCode < 200 || statusCode >= 300) {
      throw new GossipPeerException("Peer returned HTTP " + statusCode + ": " + peer, null);
    }
  }
}
