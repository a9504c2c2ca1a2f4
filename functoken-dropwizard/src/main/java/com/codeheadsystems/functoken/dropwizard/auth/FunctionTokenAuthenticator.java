package com.codeheadsystems.functoken.dropwizard.auth;

import com.codeheadsystems.functoken.FunctionAuthenticator;
import com.codeheadsystems.functoken.model.AuthFailure;
import com.codeheadsystems.functoken.model.AuthVerdict;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} backed by {@link FunctionAuthenticator}.
 * <p>
 * Rejected credentials yield an empty result (401). Failures caused by the function's own
 * configuration raise {@link AuthenticationException}, which Dropwizard answers with a 500.
 */
public class FunctionTokenAuthenticator implements Authenticator<String, FunctionPrincipal> {

  private final FunctionAuthenticator authenticator;

  /**
   * Instantiates a new Function token authenticator.
   *
   * @param authenticator the core authenticator
   */
  public FunctionTokenAuthenticator(FunctionAuthenticator authenticator) {
    this.authenticator = authenticator;
  }

  @Override
  public Optional<FunctionPrincipal> authenticate(String token) throws AuthenticationException {
    AuthVerdict verdict = authenticator.authenticate(token);
    if (verdict.isAllowed()) {
      return Optional.of(FunctionPrincipal.of(verdict));
    }
    AuthFailure failure = verdict.failure().orElseThrow();
    if (failure.isMisconfiguration()) {
      throw new AuthenticationException(failure.message());
    }
    return Optional.empty();
  }
}
