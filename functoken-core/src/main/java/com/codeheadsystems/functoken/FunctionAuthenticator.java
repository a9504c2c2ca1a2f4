package com.codeheadsystems.functoken;

import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.functoken.claims.ApplicationClaimExtractor;
import com.codeheadsystems.functoken.claims.IdentityMatcher;
import com.codeheadsystems.functoken.config.FunctionAuthConfig;
import com.codeheadsystems.functoken.exceptions.FunctionAuthException;
import com.codeheadsystems.functoken.key.PemPublicKeyLoader;
import com.codeheadsystems.functoken.key.PublicKeyLoader;
import com.codeheadsystems.functoken.model.ApplicationClaim;
import com.codeheadsystems.functoken.model.AuthFailure;
import com.codeheadsystems.functoken.model.AuthVerdict;
import com.codeheadsystems.functoken.model.RuntimeIdentity;
import com.codeheadsystems.functoken.token.TokenVerifier;
import java.security.interfaces.RSAPublicKey;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates a request to a function from the token it carries.
 * <p>
 * Steps run in a fixed order and the first failure ends the check:
 * <ol>
 *   <li>public functions are allowed without looking at the request;</li>
 *   <li>a missing or empty token is rejected ({@link AuthFailure#NO_TOKEN});</li>
 *   <li>the configured public key is loaded ({@link AuthFailure#INVALID_PUBLIC_KEY});</li>
 *   <li>the token signature and validity window are verified ({@link AuthFailure#TOKEN_INVALID});</li>
 *   <li>the first application claim is extracted ({@link AuthFailure#CLAIMS_INVALID});</li>
 *   <li>the function's application ID and then namespace ID must be non-empty
 *       ({@link AuthFailure#MISSING_APPLICATION_ID}, {@link AuthFailure#MISSING_NAMESPACE_ID});</li>
 *   <li>the claim must match the namespace or the application ({@link AuthFailure#CLAIM_MISMATCH}).</li>
 * </ol>
 * Instances hold no mutable state and may be shared between threads.
 */
public class FunctionAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(FunctionAuthenticator.class);

  private final FunctionAuthConfig config;
  private final PublicKeyLoader publicKeyLoader;
  private final TokenVerifier tokenVerifier;
  private final ApplicationClaimExtractor claimExtractor;
  private final IdentityMatcher identityMatcher;

  /**
   * Creates an authenticator with the default components.
   *
   * @param config the config
   */
  public FunctionAuthenticator(FunctionAuthConfig config) {
    this(config,
        new PemPublicKeyLoader(),
        new TokenVerifier(config.leewaySeconds()),
        new ApplicationClaimExtractor(),
        new IdentityMatcher());
  }

  /**
   * Creates an authenticator.
   *
   * @param config          the config
   * @param publicKeyLoader decodes the configured public key
   * @param tokenVerifier   checks token signature and validity window
   * @param claimExtractor  reads the application claim from a verified token
   * @param identityMatcher compares the claim to the function's identity
   */
  public FunctionAuthenticator(FunctionAuthConfig config,
                               PublicKeyLoader publicKeyLoader,
                               TokenVerifier tokenVerifier,
                               ApplicationClaimExtractor claimExtractor,
                               IdentityMatcher identityMatcher) {
    this.config = config;
    this.publicKeyLoader = publicKeyLoader;
    this.tokenVerifier = tokenVerifier;
    this.claimExtractor = claimExtractor;
    this.identityMatcher = identityMatcher;
  }

  /**
   * Authenticates a request, reading the token from the configured header.
   *
   * @param headers header lookup for the request, returning null when a header is absent
   * @return the verdict
   */
  public AuthVerdict authenticate(Function<String, String> headers) {
    if (config.identity().publicFunction()) {
      return AuthVerdict.allowedPublic();
    }
    return authenticate(headers.apply(config.tokenHeader()));
  }

  /**
   * Authenticates a request carrying the given token.
   *
   * @param requestToken the token from the request, may be null
   * @return the verdict
   */
  public AuthVerdict authenticate(String requestToken) {
    RuntimeIdentity identity = config.identity();
    if (identity.publicFunction()) {
      return AuthVerdict.allowedPublic();
    }
    if (requestToken == null || requestToken.isEmpty()) {
      return reject(AuthFailure.NO_TOKEN);
    }

    ApplicationClaim claim;
    try {
      RSAPublicKey key = publicKeyLoader.load(config.publicKeyPem());
      DecodedJWT token = tokenVerifier.verify(requestToken, key);
      claim = claimExtractor.extract(token);
    } catch (FunctionAuthException e) {
      return reject(e.failure());
    }

    if (identity.applicationId().isEmpty()) {
      return reject(AuthFailure.MISSING_APPLICATION_ID);
    }
    if (identity.namespaceId().isEmpty()) {
      return reject(AuthFailure.MISSING_NAMESPACE_ID);
    }

    try {
      identityMatcher.requireMatch(claim, identity);
    } catch (FunctionAuthException e) {
      return reject(e.failure());
    }
    log.debug("Request authorized for namespace={} application={}", claim.namespaceId(), claim.applicationId());
    return AuthVerdict.allowed(claim);
  }

  /**
   * Gets the config.
   *
   * @return the config
   */
  public FunctionAuthConfig config() {
    return config;
  }

  private AuthVerdict reject(AuthFailure failure) {
    if (failure.isMisconfiguration()) {
      log.warn("Rejecting request, function is misconfigured: {}", failure);
    } else {
      log.debug("Rejecting request: {}", failure);
    }
    return AuthVerdict.rejected(failure);
  }
}
