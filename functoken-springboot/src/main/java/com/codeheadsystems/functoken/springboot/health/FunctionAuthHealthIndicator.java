package com.codeheadsystems.functoken.springboot.health;

import com.codeheadsystems.functoken.config.FunctionAuthConfig;
import com.codeheadsystems.functoken.exceptions.InvalidPublicKeyException;
import com.codeheadsystems.functoken.key.PublicKeyLoader;
import com.codeheadsystems.functoken.model.RuntimeIdentity;
import java.security.interfaces.RSAPublicKey;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

public class FunctionAuthHealthIndicator implements HealthIndicator {

  private final FunctionAuthConfig config;
  private final PublicKeyLoader publicKeyLoader;

  public FunctionAuthHealthIndicator(FunctionAuthConfig config, PublicKeyLoader publicKeyLoader) {
    this.config = config;
    this.publicKeyLoader = publicKeyLoader;
  }

  @Override
  public Health health() {
    RuntimeIdentity identity = config.identity();
    if (identity.publicFunction()) {
      return Health.up().withDetail("public", true).build();
    }
    if (identity.applicationId().isEmpty()) {
      return Health.down().withDetail("reason", "Application ID is not configured").build();
    }
    if (identity.namespaceId().isEmpty()) {
      return Health.down().withDetail("reason", "Namespace ID is not configured").build();
    }
    try {
      RSAPublicKey key = publicKeyLoader.load(config.publicKeyPem());
      return Health.up().withDetail("modulusBits", key.getModulus().bitLength()).build();
    } catch (InvalidPublicKeyException e) {
      return Health.down().withDetail("reason", e.getMessage()).build();
    }
  }
}
