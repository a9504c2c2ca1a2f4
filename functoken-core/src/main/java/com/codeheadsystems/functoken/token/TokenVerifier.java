package com.codeheadsystems.functoken.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.functoken.exceptions.TokenInvalidException;
import java.security.interfaces.RSAPublicKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies compact JWS tokens signed with an RSA algorithm.
 * <p>
 * The algorithm named in the token header picks between RS256, RS384, RS512 (PKCS#1 v1.5) and
 * PS256, PS384, PS512 (PSS); any other value, including {@code none}, the HMAC family and EC
 * signatures, is rejected before the key is touched.
 * {@code exp}, {@code nbf} and {@code iat} are checked when present, with the configured leeway.
 */
public class TokenVerifier {

  private static final Logger log = LoggerFactory.getLogger(TokenVerifier.class);

  private final long leewaySeconds;

  /**
   * Creates a verifier with no clock leeway.
   */
  public TokenVerifier() {
    this(0);
  }

  /**
   * Creates a new TokenVerifier.
   *
   * @param leewaySeconds tolerated clock skew for the temporal claims, in seconds
   */
  public TokenVerifier(long leewaySeconds) {
    if (leewaySeconds < 0) {
      throw new IllegalArgumentException("leewaySeconds must be >= 0");
    }
    this.leewaySeconds = leewaySeconds;
  }

  /**
   * Verifies a token's signature and validity window.
   *
   * @param token compact serialized token
   * @param key   the key the token must be signed with
   * @return the decoded token
   * @throws TokenInvalidException if the token is malformed, the algorithm is not RSA, the
   *                               signature does not verify, or a temporal claim is violated
   */
  public DecodedJWT verify(String token, RSAPublicKey key) {
    DecodedJWT unverified;
    try {
      unverified = JWT.decode(token);
    } catch (JWTDecodeException e) {
      log.debug("Token could not be decoded: {}", e.getMessage());
      throw new TokenInvalidException();
    }

    Algorithm algorithm = algorithmFor(unverified.getAlgorithm(), key);
    try {
      return JWT.require(algorithm)
          .acceptLeeway(leewaySeconds)
          .build()
          .verify(unverified);
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getMessage());
      throw new TokenInvalidException();
    }
  }

  /**
   * Gets the leeway.
   *
   * @return the leeway in seconds
   */
  public long leewaySeconds() {
    return leewaySeconds;
  }

  private Algorithm algorithmFor(String name, RSAPublicKey key) {
    if (name == null) {
      log.debug("Token header declares no algorithm");
      throw new TokenInvalidException();
    }
    return switch (name) {
      case "RS256" -> Algorithm.RSA256(key, null);
      case "RS384" -> Algorithm.RSA384(key, null);
      case "RS512" -> Algorithm.RSA512(key, null);
      case "PS256" -> RsaPssAlgorithm.PS256(key, null);
      case "PS384" -> RsaPssAlgorithm.PS384(key, null);
      case "PS512" -> RsaPssAlgorithm.PS512(key, null);
      default -> {
        log.debug("Token header declares unsupported algorithm {}", name);
        throw new TokenInvalidException();
      }
    };
  }
}
