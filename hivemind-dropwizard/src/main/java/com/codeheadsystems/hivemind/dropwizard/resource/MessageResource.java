package com.codeheadsystems.hivemind.dropwizard.resource;

import com.codeheadsystems.hivemind.dropwizard.auth.HivemindPrincipal;
import com.codeheadsystems.hivemind.model.MessagePostRequest;
import com.codeheadsystems.hivemind.model.MessagePostResponse;
import com.codeheadsystems.hivemind.model.MessagesResponse;
import com.codeheadsystems.hivemind.server.message.MessageManager;
import com.codeheadsystems.hivemind.server.resource.QueryParams;
import com.codeheadsystems.hivemind.server.store.StorageException;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
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
 * Session-protected message endpoints. The hive is always the one the session was issued for.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class MessageResource {

  private static final Logger log = LoggerFactory.getLogger(MessageResource.class);

  private final MessageManager messageManager;

  /**
   * Instantiates a new Message resource.
   *
   * @param messageManager posts and reads messages
   */
  public MessageResource(final MessageManager messageManager) {
    this.messageManager = messageManager;
  }

  /**
   * Posts a message to the caller's hive.
   *
   * @param principal the authenticated agent
   * @param request   content and optional channel
   * @return the stored message
   */
  @POST
  @Path("message")
  @Consumes(MediaType.APPLICATION_JSON)
  public MessagePostResponse post(@Auth final HivemindPrincipal principal, final MessagePostRequest request) {
    try {
      return messageManager.post(principal.session(), request);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (StorageException e) {
      log.error("Append failed for hive {}", principal.hiveId(), e);
      throw new WebApplicationException(e.getMessage(), Response.Status.INTERNAL_SERVER_ERROR);
    }
  }

  /**
   * Reads the caller's hive after an id cursor.
   *
   * @param principal the authenticated agent
   * @param since     exclusive id cursor; unparseable values read from the start
   * @param limit     page size, clamped to [1, 200]
   * @return the page
   */
  @GET
  @Path("messages")
  public MessagesResponse read(@Auth final HivemindPrincipal principal,
                               @QueryParam("since") final String since,
                               @QueryParam("limit") final String limit) {
    return messageManager.read(principal.session(),
        QueryParams.longOr(since, 0L),
        QueryParams.intOr(limit, MessageManager.DEFAULT_READ_LIMIT));
  }
}
