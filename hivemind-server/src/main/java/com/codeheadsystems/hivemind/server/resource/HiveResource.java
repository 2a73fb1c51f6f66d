package com.codeheadsystems.hivemind.server.resource;

import com.codeheadsystems.hivemind.model.ChallengeRequest;
import com.codeheadsystems.hivemind.model.ChallengeResponse;
import com.codeheadsystems.hivemind.model.HealthResponse;
import com.codeheadsystems.hivemind.model.JoinRequest;
import com.codeheadsystems.hivemind.model.JoinResponse;
import com.codeheadsystems.hivemind.model.ProtocolResponse;
import com.codeheadsystems.hivemind.protocol.HivemindProtocol;
import com.codeheadsystems.hivemind.server.auth.ChallengeManager;
import com.codeheadsystems.hivemind.server.auth.JoinAuthenticator;
import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unauthenticated endpoints: server description and the two-step join.
 */
@Singleton
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class HiveResource {

  private static final Logger log = LoggerFactory.getLogger(HiveResource.class);

  private final HivemindServerConfig config;
  private final ChallengeManager challengeManager;
  private final JoinAuthenticator joinAuthenticator;

  /**
   * Instantiates a new Hive resource.
   *
   * @param config            server settings
   * @param challengeManager  issues challenges
   * @param joinAuthenticator redeems challenges
   */
  @Inject
  public HiveResource(final HivemindServerConfig config,
                      final ChallengeManager challengeManager,
                      final JoinAuthenticator joinAuthenticator) {
    this.config = config;
    this.challengeManager = challengeManager;
    this.joinAuthenticator = joinAuthenticator;
    log.info("HiveResource({})", config.hiveId());
  }

  @GET
  @Path("health")
  public HealthResponse health() {
    return new HealthResponse("ok", HivemindProtocol.PROTOCOL_VERSION, config.hiveId());
  }

  @GET
  @Path("protocol")
  public ProtocolResponse protocol() {
    return new ProtocolResponse(HivemindProtocol.PROTOCOL_VERSION, config.hiveId(),
        config.challengeTtl().toMillis(), config.sessionTtl().toMillis(), config.maxClockSkew().toMillis());
  }

  /**
   * Issues a join challenge.
   *
   * @param request agent id, public key and optional hive
   * @return the challenge
   */
  @POST
  @Path("challenge")
  @Consumes(MediaType.APPLICATION_JSON)
  public ChallengeResponse challenge(final ChallengeRequest request) {
    try {
      return challengeManager.issue(request);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
  }

  /**
   * Redeems a challenge for a session token.
   *
   * @param request the signed join request
   * @return the session
   */
  @POST
  @Path("join")
  @Consumes(MediaType.APPLICATION_JSON)
  public JoinResponse join(final JoinRequest request) {
    try {
      return joinAuthenticator.join(request);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (SecurityException e) {
      log.debug("join rejected: {}", e.getMessage());
      throw new WebApplicationException(e.getMessage(), Response.Status.UNAUTHORIZED);
    }
  }
}
