package com.codeheadsystems.functoken.springboot.security;

import com.codeheadsystems.functoken.FunctionAuthenticator;
import com.codeheadsystems.functoken.model.AuthFailure;
import com.codeheadsystems.functoken.model.AuthVerdict;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests from the function token header.
 * <p>
 * An allowed verdict populates the security context. On protected paths a token whose claims
 * name another function is answered with 403 and a misconfigured function with 500, both without
 * reaching the chain. Any other rejection, and every rejection on a permitted path, leaves the
 * context empty: protected paths fall through to the 401 entry point and permitted paths are
 * served as usual.
 */
public class FunctionTokenAuthenticationFilter extends OncePerRequestFilter {

  private final FunctionAuthenticator authenticator;
  private final RequestMatcher permitted;

  /**
   * Instantiates a new Function token authentication filter that treats every path as protected.
   *
   * @param authenticator the authenticator
   */
  public FunctionTokenAuthenticationFilter(FunctionAuthenticator authenticator) {
    this(authenticator, request -> false);
  }

  /**
   * Instantiates a new Function token authentication filter.
   *
   * @param authenticator the authenticator
   * @param permitted     paths reachable without authentication
   */
  public FunctionTokenAuthenticationFilter(FunctionAuthenticator authenticator, RequestMatcher permitted) {
    this.authenticator = authenticator;
    this.permitted = permitted;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    AuthVerdict verdict = authenticator.authenticate(request::getHeader);
    if (verdict.isAllowed()) {
      UsernamePasswordAuthenticationToken auth =
          new UsernamePasswordAuthenticationToken(FunctionPrincipal.of(verdict), null, List.of());
      SecurityContextHolder.getContext().setAuthentication(auth);
      filterChain.doFilter(request, response);
      return;
    }
    AuthFailure failure = verdict.failure().orElseThrow();
    if (permitted.matches(request)) {
      filterChain.doFilter(request, response);
      return;
    }
    if (failure.isMisconfiguration()) {
      response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
      return;
    }
    if (failure == AuthFailure.CLAIM_MISMATCH) {
      response.setStatus(HttpServletResponse.SC_FORBIDDEN);
      return;
    }
    filterChain.doFilter(request, response);
  }
}
