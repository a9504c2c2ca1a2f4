package com.codeheadsystems.functoken.springboot.config;

import com.codeheadsystems.functoken.FunctionAuthenticator;
import com.codeheadsystems.functoken.claims.ApplicationClaimExtractor;
import com.codeheadsystems.functoken.claims.IdentityMatcher;
import com.codeheadsystems.functoken.config.FunctionAuthConfig;
import com.codeheadsystems.functoken.key.CachingPublicKeyLoader;
import com.codeheadsystems.functoken.key.PemPublicKeyLoader;
import com.codeheadsystems.functoken.key.PublicKeyLoader;
import com.codeheadsystems.functoken.springboot.health.FunctionAuthHealthIndicator;
import com.codeheadsystems.functoken.springboot.security.FunctionAuthSecurityConfig;
import com.codeheadsystems.functoken.token.TokenVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@AutoConfiguration
@EnableConfigurationProperties(FunctionAuthProperties.class)
@Import(FunctionAuthSecurityConfig.class)
public class FunctionAuthAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(FunctionAuthAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public FunctionAuthConfig functionAuthConfig(FunctionAuthProperties props) {
    FunctionAuthConfig config = props.toFunctionAuthConfig();
    if (config.identity().publicFunction()) {
      log.warn("Function is public: requests are not authenticated");
    }
    return config;
  }

  /**
   * Default key loader. The configured key never changes, so it is decoded once and reused.
   * Override this bean to read keys from elsewhere:
   * <pre>{@code
   *   @Bean
   *   public PublicKeyLoader publicKeyLoader() {
   *     return pem -> keyStore.currentKey();
   *   }
   * }</pre>
   */
  @Bean
  @ConditionalOnMissingBean
  public PublicKeyLoader publicKeyLoader() {
    return new CachingPublicKeyLoader(new PemPublicKeyLoader());
  }

  @Bean
  @ConditionalOnMissingBean
  public FunctionAuthenticator functionAuthenticator(FunctionAuthConfig config,
                                                     PublicKeyLoader publicKeyLoader) {
    return new FunctionAuthenticator(
        config,
        publicKeyLoader,
        new TokenVerifier(config.leewaySeconds()),
        new ApplicationClaimExtractor(),
        new IdentityMatcher());
  }

  /**
   * Registers the health indicator when Actuator is present.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
  static class HealthConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FunctionAuthHealthIndicator functionAuthHealthIndicator(FunctionAuthConfig config,
                                                                   PublicKeyLoader publicKeyLoader) {
      return new FunctionAuthHealthIndicator(config, publicKeyLoader);
    }
  }
}
