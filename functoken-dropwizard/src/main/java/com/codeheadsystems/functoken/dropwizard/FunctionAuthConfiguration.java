package com.codeheadsystems.functoken.dropwizard;

import com.codeheadsystems.functoken.config.FunctionAuthConfig;
import com.codeheadsystems.functoken.model.RuntimeIdentity;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for function token authentication.
 * <p>
 * The platform injects the identity and key as environment variables; the bundle enables
 * environment substitution so the YAML can reference them directly:
 * <pre>{@code
 *   publicFunction: "${SCW_PUBLIC:-false}"
 *   publicKeyPem: ${SCW_PUBLIC_KEY:-}
 *   applicationId: ${SCW_APPLICATION_ID:-}
 *   namespaceId: ${SCW_NAMESPACE_ID:-}
 * }</pre>
 * Empty values are accepted at startup and reported per request (and by the health check).
 * Quote {@code publicFunction}: only the exact string {@code "true"} makes the function public,
 * and an unquoted YAML {@code TRUE} would already have been read as a boolean.
 */
public class FunctionAuthConfiguration extends Configuration {

  /**
   * When exactly {@code "true"} every request is allowed without a token.
   */
  private String publicFunction = "false";

  /**
   * PEM-encoded PKCS#1 RSA public key tokens are signed with.
   */
  private String publicKeyPem = "";

  /**
   * This function's application ID.
   */
  private String applicationId = "";

  /**
   * This function's namespace ID.
   */
  private String namespaceId = "";

  /**
   * Request header carrying the token.
   */
  @NotEmpty
  private String tokenHeader = FunctionAuthConfig.DEFAULT_TOKEN_HEADER;

  /**
   * Clock skew tolerated on exp/nbf/iat, in seconds.
   */
  @Min(0)
  private long leewaySeconds = 0;

  /**
   * Builds the core configuration from this block.
   *
   * @return the function auth config
   */
  public FunctionAuthConfig toFunctionAuthConfig() {
    return new FunctionAuthConfig(
        new RuntimeIdentity(applicationId, namespaceId, "true".equals(publicFunction)),
        publicKeyPem,
        tokenHeader,
        leewaySeconds);
  }

  @JsonProperty
  public String getPublicFunction() {
    return publicFunction;
  }

  @JsonProperty
  public void setPublicFunction(String publicFunction) {
    this.publicFunction = publicFunction;
  }

  @JsonProperty
  public String getPublicKeyPem() {
    return publicKeyPem;
  }

  @JsonProperty
  public void setPublicKeyPem(String publicKeyPem) {
    this.publicKeyPem = publicKeyPem;
  }

  @JsonProperty
  public String getApplicationId() {
    return applicationId;
  }

  @JsonProperty
  public void setApplicationId(String applicationId) {
    this.applicationId = applicationId;
  }

  @JsonProperty
  public String getNamespaceId() {
    return namespaceId;
  }

  @JsonProperty
  public void setNamespaceId(String namespaceId) {
    this.namespaceId = namespaceId;
  }

  @JsonProperty
  public String getTokenHeader() {
    return tokenHeader;
  }

  @JsonProperty
  public void setTokenHeader(String tokenHeader) {
    this.tokenHeader = tokenHeader;
  }

  @JsonProperty
  public long getLeewaySeconds() {
    return leewaySeconds;
  }

  @JsonProperty
  public void setLeewaySeconds(long leewaySeconds) {
    this.leewaySeconds = leewaySeconds;
  }
}
