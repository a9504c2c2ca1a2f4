package com.codeheadsystems.functoken.config;

import com.codeheadsystems.functoken.model.RuntimeIdentity;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the authenticator needs from its environment, resolved once up front.
 * <p>
 * Values are kept as given; an empty public key or identifier is not rejected here but
 * surfaces as the matching failure when a request is checked.
 *
 * @param identity      the running function's identity
 * @param publicKeyPem  PEM-encoded PKCS#1 RSA public key tokens are signed with
 * @param tokenHeader   request header carrying the token
 * @param leewaySeconds tolerated clock skew when checking exp/nbf/iat
 */
public record FunctionAuthConfig(
    RuntimeIdentity identity,
    String publicKeyPem,
    String tokenHeader,
    long leewaySeconds) {

  /**
   * Request header the platform uses to forward function tokens.
   */
  public static final String DEFAULT_TOKEN_HEADER = "SCW_FUNCTIONS_TOKEN";

  /**
   * Environment variable set to {@code "true"} for public functions.
   */
  public static final String ENV_PUBLIC = "SCW_PUBLIC";

  /**
   * Environment variable holding the PEM public key.
   */
  public static final String ENV_PUBLIC_KEY = "SCW_PUBLIC_KEY";

  /**
   * Environment variable holding the function's application ID.
   */
  public static final String ENV_APPLICATION_ID = "SCW_APPLICATION_ID";

  /**
   * Environment variable holding the function's namespace ID.
   */
  public static final String ENV_NAMESPACE_ID = "SCW_NAMESPACE_ID";

  /**
   * Validates the structural fields.
   */
  public FunctionAuthConfig {
    Objects.requireNonNull(identity, "identity");
    publicKeyPem = publicKeyPem == null ? "" : publicKeyPem;
    if (tokenHeader == null || tokenHeader.isBlank()) {
      throw new IllegalArgumentException("tokenHeader must not be empty");
    }
    if (leewaySeconds < 0) {
      throw new IllegalArgumentException("leewaySeconds must be >= 0");
    }
  }

  /**
   * Config using the default header and no leeway.
   *
   * @param identity     the identity
   * @param publicKeyPem the public key pem
   */
  public FunctionAuthConfig(RuntimeIdentity identity, String publicKeyPem) {
    this(identity, publicKeyPem, DEFAULT_TOKEN_HEADER, 0);
  }

  /**
   * Builds the config from the variables the platform injects into the function's process.
   * Typically called with {@code System.getenv()}.
   *
   * @param env environment variables
   * @return the config
   */
  public static FunctionAuthConfig fromEnvironment(Map<String, String> env) {
    RuntimeIdentity identity = new RuntimeIdentity(
        env.getOrDefault(ENV_APPLICATION_ID, ""),
        env.getOrDefault(ENV_NAMESPACE_ID, ""),
        "true".equals(env.get(ENV_PUBLIC)));
    return new FunctionAuthConfig(identity, env.getOrDefault(ENV_PUBLIC_KEY, ""));
  }
}
