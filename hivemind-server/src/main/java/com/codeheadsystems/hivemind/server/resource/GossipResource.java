package com.codeheadsystems.hivemind.server.resource;

import com.codeheadsystems.hivemind.model.GossipBatch;
import com.codeheadsystems.hivemind.model.GossipFeedResponse;
import com.codeheadsystems.hivemind.model.GossipPushResponse;
import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import com.codeheadsystems.hivemind.server.gossip.GossipAuthorizer;
import com.codeheadsystems.hivemind.server.gossip.GossipManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Peer-to-peer endpoints. Guarded by the shared gossip secret when one is configured.
 */
@Singleton
@Path("/gossip")
@Produces(MediaType.APPLICATION_JSON)
public class GossipResource {

  private static final Logger log = LoggerFactory.getLogger(GossipResource.class);

  private final GossipAuthorizer gossipAuthorizer;
  private final GossipManager gossipManager;

  /**
   * Instantiates a new Gossip resource.
   *
   * @param gossipAuthorizer checks the shared secret
   * @param gossipManager    serves feed and push
   */
  @Inject
  public GossipResource(final GossipAuthorizer gossipAuthorizer, final GossipManager gossipManager) {
    this.gossipAuthorizer = gossipAuthorizer;
    this.gossipManager = gossipManager;
    if (gossipAuthorizer.isOpen()) {
      log.warn("No gossip secret configured; /gossip endpoints are open to anyone");
    }
  }

  @GET
  @Path("messages")
  public GossipFeedResponse messages(@HeaderParam(HivemindProtocol.GOSSIP_SECRET_HEADER) final String secret,
                                     @QueryParam("hive_id") final String hiveId,
                                     @QueryParam("since_ms") final String sinceMs,
                                     @QueryParam("limit") final String limit) {
    authorize(secret);
    return gossipManager.feed(hiveId, QueryParams.longOr(sinceMs, 0L),
        QueryParams.intOr(limit, GossipManager.MAX_BATCH));
  }

  @POST
  @Path("push")
  @Consumes(MediaType.APPLICATION_JSON)
  public GossipPushResponse push(@HeaderParam(HivemindProtocol.GOSSIP_SECRET_HEADER) final String secret,
                                 final GossipBatch batch) {
    authorize(secret);
    return gossipManager.push(batch);
  }

  private void authorize(String secret) {
    try {
      gossipAuthorizer.authorize(secret);
    } catch (SecurityException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.UNAUTHORIZED);
    }
  }
}
