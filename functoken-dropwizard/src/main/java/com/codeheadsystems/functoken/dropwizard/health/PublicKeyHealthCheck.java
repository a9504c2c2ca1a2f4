package com.codeheadsystems.functoken.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.functoken.config.FunctionAuthConfig;
import com.codeheadsystems.functoken.exceptions.InvalidPublicKeyException;
import com.codeheadsystems.functoken.key.PublicKeyLoader;
import com.codeheadsystems.functoken.model.RuntimeIdentity;
import java.security.interfaces.RSAPublicKey;

/**
 * Health check that verifies a private function can authenticate requests at all: the key
 * decodes and both identifiers are set.
 */
public class PublicKeyHealthCheck extends HealthCheck {

  private final FunctionAuthConfig config;
  private final PublicKeyLoader publicKeyLoader;

  /**
   * Instantiates a new Public key health check.
   *
   * @param config          the config
   * @param publicKeyLoader the public key loader
   */
  public PublicKeyHealthCheck(FunctionAuthConfig config, PublicKeyLoader publicKeyLoader) {
    this.config = config;
    this.publicKeyLoader = publicKeyLoader;
  }

  @Override
  protected Result check() {
    RuntimeIdentity identity = config.identity();
    if (identity.publicFunction()) {
      return Result.healthy("public function, no token required");
    }
    if (identity.applicationId().isEmpty()) {
      return Result.unhealthy("Application ID is not configured");
    }
    if (identity.namespaceId().isEmpty()) {
      return Result.unhealthy("Namespace ID is not configured");
    }
    try {
      RSAPublicKey key = publicKeyLoader.load(config.publicKeyPem());
      return Result.healthy("RSA key modulus bits=%d", key.getModulus().bitLength());
    } catch (InvalidPublicKeyException e) {
      return Result.unhealthy(e.getMessage());
    }
  }
}
