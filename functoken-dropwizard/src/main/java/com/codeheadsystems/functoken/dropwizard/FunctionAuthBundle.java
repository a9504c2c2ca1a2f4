package com.codeheadsystems.functoken.dropwizard;

import com.codeheadsystems.functoken.FunctionAuthenticator;
import com.codeheadsystems.functoken.claims.ApplicationClaimExtractor;
import com.codeheadsystems.functoken.claims.IdentityMatcher;
import com.codeheadsystems.functoken.config.FunctionAuthConfig;
import com.codeheadsystems.functoken.dropwizard.auth.FunctionPrincipal;
import com.codeheadsystems.functoken.dropwizard.auth.FunctionTokenAuthFilter;
import com.codeheadsystems.functoken.dropwizard.auth.FunctionTokenAuthenticator;
import com.codeheadsystems.functoken.dropwizard.health.PublicKeyHealthCheck;
import com.codeheadsystems.functoken.key.CachingPublicKeyLoader;
import com.codeheadsystems.functoken.key.PemPublicKeyLoader;
import com.codeheadsystems.functoken.key.PublicKeyLoader;
import com.codeheadsystems.functoken.token.TokenVerifier;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that protects an application's resources with function token authentication.
 * <p>
 * Registers the token auth filter, the {@code @Auth FunctionPrincipal} binder and a health check
 * on the configured key. Requires a {@link FunctionAuthConfiguration} as the application's
 * configuration:
 * <pre>{@code
 *   bootstrap.addBundle(new FunctionAuthBundle<>());
 * }</pre>
 * Resources opt in with {@code @Auth FunctionPrincipal principal}; requests that fail the check
 * get a 401, and a misconfigured function answers 500.
 */
public class FunctionAuthBundle<C extends FunctionAuthConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(FunctionAuthBundle.class);

  /**
   * Scheme reported in the {@code WWW-Authenticate} header of a 401.
   */
  public static final String AUTH_SCHEME = "FunctionToken";

  /**
   * Realm reported in the {@code WWW-Authenticate} header of a 401.
   */
  public static final String REALM = "functoken";

  private final PublicKeyLoader publicKeyLoader;

  /**
   * Creates a bundle that decodes the configured key once and reuses it.
   */
  public FunctionAuthBundle() {
    this(new CachingPublicKeyLoader(new PemPublicKeyLoader()));
  }

  /**
   * Creates a bundle with a custom key loader.
   *
   * @param publicKeyLoader the public key loader
   */
  public FunctionAuthBundle(PublicKeyLoader publicKeyLoader) {
    this.publicKeyLoader = publicKeyLoader;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    bootstrap.setConfigurationSourceProvider(new SubstitutingSourceProvider(
        bootstrap.getConfigurationSourceProvider(), new EnvironmentVariableSubstitutor(false)));
  }

  @Override
  public void run(C configuration, Environment environment) {
    FunctionAuthConfig config = configuration.toFunctionAuthConfig();
    if (config.identity().publicFunction()) {
      log.warn("Function is public: requests are not authenticated");
    }

    FunctionAuthenticator authenticator = new FunctionAuthenticator(
        config,
        publicKeyLoader,
        new TokenVerifier(config.leewaySeconds()),
        new ApplicationClaimExtractor(),
        new IdentityMatcher());

    environment.jersey().register(new AuthDynamicFeature(
        new FunctionTokenAuthFilter.Builder()
            .setHeaderName(config.tokenHeader())
            .setAuthenticator(new FunctionTokenAuthenticator(authenticator))
            .setPrefix(AUTH_SCHEME)
            .setRealm(REALM)
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(FunctionPrincipal.class));
    environment.healthChecks().register("function-token", new PublicKeyHealthCheck(config, publicKeyLoader));
  }
}
