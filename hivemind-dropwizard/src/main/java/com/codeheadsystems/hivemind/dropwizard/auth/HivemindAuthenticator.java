package com.codeheadsystems.hivemind.dropwizard.auth;

import com.codeheadsystems.hivemind.server.auth.SessionManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that resolves bearer session tokens using {@link SessionManager}.
 */
public class HivemindAuthenticator implements Authenticator<String, HivemindPrincipal> {

  private final SessionManager sessionManager;

  /**
   * Instantiates a new Hivemind authenticator.
   *
   * @param sessionManager the session manager
   */
  public HivemindAuthenticator(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @Override
  public Optional<HivemindPrincipal> authenticate(String token) throws AuthenticationException {
    return sessionManager.validate(token).map(HivemindPrincipal::new);
  }
}
