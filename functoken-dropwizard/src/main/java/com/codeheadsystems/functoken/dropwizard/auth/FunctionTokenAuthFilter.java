package com.codeheadsystems.functoken.dropwizard.auth;

import com.codeheadsystems.functoken.config.FunctionAuthConfig;
import io.dropwizard.auth.AuthFilter;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;

/**
 * Reads the function token from its request header and hands it to the authenticator.
 * <p>
 * An absent header is passed on as an empty token so that public functions still get a
 * principal and private ones are rejected by the authenticator rather than by this filter.
 */
@Priority(Priorities.AUTHENTICATION)
public class FunctionTokenAuthFilter extends AuthFilter<String, FunctionPrincipal> {

  private final String headerName;

  private FunctionTokenAuthFilter(String headerName) {
    this.headerName = headerName;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    String token = requestContext.getHeaderString(headerName);
    if (!authenticate(requestContext, token == null ? "" : token, prefix)) {
      throw new WebApplicationException(unauthorizedHandler.buildResponse(prefix, realm));
    }
  }

  /**
   * Builder for {@link FunctionTokenAuthFilter}. Set the header name before the inherited
   * properties.
   */
  public static class Builder extends AuthFilterBuilder<String, FunctionPrincipal, FunctionTokenAuthFilter> {

    private String headerName = FunctionAuthConfig.DEFAULT_TOKEN_HEADER;

    /**
     * Sets the request header carrying the token.
     *
     * @param headerName the header name
     * @return the builder
     */
    public Builder setHeaderName(String headerName) {
      this.headerName = headerName;
      return this;
    }

    @Override
    protected FunctionTokenAuthFilter newInstance() {
      return new FunctionTokenAuthFilter(headerName);
    }
  }
}
