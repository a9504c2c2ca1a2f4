package com.codeheadsystems.functoken.springboot.config;

import com.codeheadsystems.functoken.config.FunctionAuthConfig;
import com.codeheadsystems.functoken.model.RuntimeIdentity;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Function token settings, bound from {@code functoken.*}. The platform's variables can be
 * referenced directly, e.g. {@code functoken.public-key-pem: ${SCW_PUBLIC_KEY:}}.
 */
@ConfigurationProperties(prefix = "functoken")
public class FunctionAuthProperties {

  private String publicFunction = "false";
  private String publicKeyPem = "";
  private String applicationId = "";
  private String namespaceId = "";
  private String tokenHeader = FunctionAuthConfig.DEFAULT_TOKEN_HEADER;
  private long leewaySeconds = 0;
  private List<String> permitPaths = List.of("/actuator/health");

  /**
   * Builds the core configuration from these properties.
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

  /**
   * Public flag as configured. Only the exact string {@code "true"} makes the function public.
   *
   * @return the raw flag
   */
  public String getPublicFunction() {
    return publicFunction;
  }

  public void setPublicFunction(String publicFunction) {
    this.publicFunction = publicFunction;
  }

  public String getPublicKeyPem() {
    return publicKeyPem;
  }

  public void setPublicKeyPem(String publicKeyPem) {
    this.publicKeyPem = publicKeyPem;
  }

  public String getApplicationId() {
    return applicationId;
  }

  public void setApplicationId(String applicationId) {
    this.applicationId = applicationId;
  }

  public String getNamespaceId() {
    return namespaceId;
  }

  public void setNamespaceId(String namespaceId) {
    this.namespaceId = namespaceId;
  }

  public String getTokenHeader() {
    return tokenHeader;
  }

  public void setTokenHeader(String tokenHeader) {
    this.tokenHeader = tokenHeader;
  }

  public long getLeewaySeconds() {
    return leewaySeconds;
  }

  public void setLeewaySeconds(long leewaySeconds) {
    this.leewaySeconds = leewaySeconds;
  }

  /**
   * Paths reachable without a token, even on a private function.
   *
   * @return the permit paths
   */
  public List<String> getPermitPaths() {
    return permitPaths;
  }

  public void setPermitPaths(List<String> permitPaths) {
    this.permitPaths = permitPaths;
  }
}
