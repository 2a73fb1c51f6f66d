package com.codeheadsystems.hivemind.dropwizard.auth;

import com.codeheadsystems.hivemind.server.store.Session;
import java.security.Principal;

/**
 * Principal representing an agent holding a live session.
 *
 * @param session the session the bearer token resolved to
 */
public record HivemindPrincipal(Session session) implements Principal {

  @Override
  public String getName() {
    return session.agentId();
  }

  public String hiveId() {
    return session.hiveId();
  }
}
