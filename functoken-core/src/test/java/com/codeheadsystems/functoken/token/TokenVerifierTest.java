package com.codeheadsystems.functoken.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.functoken.exceptions.TokenInvalidException;
import com.codeheadsystems.functoken.model.AuthFailure;
import com.codeheadsystems.functoken.testing.TestKeys;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TokenVerifierTest {

  private static KeyPair keyPair;
  private static KeyPair otherKeyPair;

  private TokenVerifier verifier;

  @BeforeAll
  static void generateKeys() {
    keyPair = TestKeys.rsa();
    otherKeyPair = TestKeys.rsa();
  }

  @BeforeEach
  void setUp() {
    verifier = new TokenVerifier();
  }

  @Test
  void verify_validToken_returnsDecodedToken() {
    String token = TestKeys.token(keyPair, List.of(TestKeys.claim("ns-1", "app-1")));

    DecodedJWT decoded = verifier.verify(token, publicKey(keyPair));

    assertThat(decoded.getIssuer()).isEqualTo("functoken-test");
    assertThat(decoded.getClaim("application_claim").isMissing()).isFalse();
  }

  @Test
  void verify_rs384AndRs512_areAccepted() {
    RSAPublicKey pub = publicKey(keyPair);
    RSAPrivateKey priv = (RSAPrivateKey) keyPair.getPrivate();

    String rs384 = JWT.create().withSubject("s").sign(Algorithm.RSA384(pub, priv));
    String rs512 = JWT.create().withSubject("s").sign(Algorithm.RSA512(pub, priv));

    assertThat(verifier.verify(rs384, pub).getAlgorithm()).isEqualTo("RS384");
    assertThat(verifier.verify(rs512, pub).getAlgorithm()).isEqualTo("RS512");
  }

  @ParameterizedTest
  @ValueSource(strings = {"PS256", "PS384", "PS512"})
  void verify_pssToken_isAccepted(String name) {
    String token = TestKeys.tokenWith(List.of(TestKeys.claim("ns-1", "app-1")))
        .sign(pss(name, keyPair));

    DecodedJWT decoded = verifier.verify(token, publicKey(keyPair));

    assertThat(decoded.getAlgorithm()).isEqualTo(name);
    assertThat(decoded.getIssuer()).isEqualTo("functoken-test");
  }

  @ParameterizedTest
  @ValueSource(strings = {"PS256", "PS384", "PS512"})
  void verify_pssTokenSignedWithOtherKey_throws(String name) {
    String token = JWT.create().withSubject("s").sign(pss(name, otherKeyPair));

    assertThatThrownBy(() -> verifier.verify(token, publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
  }

  @Test
  void verify_pkcs1SignatureRelabelledAsPss_throws() {
    String signed = JWT.create().withSubject("s").sign(TestKeys.rs256(keyPair));
    String relabelledHeader = Base64.getUrlEncoder().withoutPadding()
        .encodeToString("{\"alg\":\"PS256\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));
    String token = relabelledHeader + signed.substring(signed.indexOf('.'));

    assertThatThrownBy(() -> verifier.verify(token, publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
  }

  @Test
  void verify_ecToken_throws() {
    KeyPair ec = TestKeys.ec();
    String token = JWT.create()
        .withSubject("s")
        .sign(Algorithm.ECDSA256((ECPublicKey) ec.getPublic(), (ECPrivateKey) ec.getPrivate()));

    assertThatThrownBy(() -> verifier.verify(token, publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
  }

  @Test
  void verify_noTemporalClaims_isAccepted() {
    String token = JWT.create().withSubject("timeless").sign(TestKeys.rs256(keyPair));

    assertThat(verifier.verify(token, publicKey(keyPair)).getSubject()).isEqualTo("timeless");
  }

  @Test
  void verify_signedWithOtherKey_throws() {
    String token = TestKeys.token(otherKeyPair, List.of(TestKeys.claim("ns-1", "app-1")));

    assertThatThrownBy(() -> verifier.verify(token, publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
  }

  @Test
  void verify_expiredToken_throws() {
    String token = JWT.create()
        .withIssuedAt(Instant.now().minusSeconds(7200))
        .withExpiresAt(Instant.now().minusSeconds(3600))
        .sign(TestKeys.rs256(keyPair));

    assertThatThrownBy(() -> verifier.verify(token, publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
  }

  @Test
  void verify_notYetValid_throws() {
    String token = JWT.create()
        .withNotBefore(Instant.now().plusSeconds(3600))
        .sign(TestKeys.rs256(keyPair));

    assertThatThrownBy(() -> verifier.verify(token, publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
  }

  @Test
  void verify_issuedInTheFuture_throws() {
    String token = JWT.create()
        .withIssuedAt(Instant.now().plusSeconds(3600))
        .sign(TestKeys.rs256(keyPair));

    assertThatThrownBy(() -> verifier.verify(token, publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
  }

  @Test
  void verify_recentlyExpiredWithinLeeway_isAccepted() {
    TokenVerifier lenient = new TokenVerifier(60);
    String token = JWT.create()
        .withExpiresAt(Instant.now().minusSeconds(5))
        .sign(TestKeys.rs256(keyPair));

    assertThat(lenient.verify(token, publicKey(keyPair))).isNotNull();
  }

  @Test
  void verify_hmacToken_throws() {
    String token = JWT.create()
        .withSubject("s")
        .sign(Algorithm.HMAC256("a-shared-secret-that-is-long-enough!"));

    assertThatThrownBy(() -> verifier.verify(token, publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
  }

  @Test
  void verify_unsignedToken_throws() {
    String token = JWT.create().withSubject("s").sign(Algorithm.none());

    assertThatThrownBy(() -> verifier.verify(token, publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
  }

  @Test
  void verify_malformedToken_throws() {
    assertThatThrownBy(() -> verifier.verify("not-a-real-token", publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
    assertThatThrownBy(() -> verifier.verify("a.b.c", publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
  }

  @Test
  void verify_tamperedSignature_throws() {
    String token = TestKeys.token(keyPair, List.of(TestKeys.claim("ns-1", "app-1")));
    // Flip a character in the middle of the signature part
    int index = token.lastIndexOf('.') + 10;
    char replacement = token.charAt(index) == 'A' ? 'B' : 'A';
    String tampered = token.substring(0, index) + replacement + token.substring(index + 1);

    assertThatThrownBy(() -> verifier.verify(tampered, publicKey(keyPair)))
        .isInstanceOf(TokenInvalidException.class);
  }

  @Test
  void verify_failure_exposesOnlyGenericMessage() {
    assertThatThrownBy(() -> verifier.verify("garbage", publicKey(keyPair)))
        .hasMessage(AuthFailure.TOKEN_INVALID.message())
        .hasNoCause();
  }

  @Test
  void constructor_negativeLeeway_throws() {
    assertThatThrownBy(() -> new TokenVerifier(-1)).isInstanceOf(IllegalArgumentException.class);
  }

  private static Algorithm pss(String name, KeyPair pair) {
    RSAPublicKey pub = publicKey(pair);
    RSAPrivateKey priv = (RSAPrivateKey) pair.getPrivate();
    return switch (name) {
      case "PS256" -> RsaPssAlgorithm.PS256(pub, priv);
      case "PS384" -> RsaPssAlgorithm.PS384(pub, priv);
      default -> RsaPssAlgorithm.PS512(pub, priv);
    };
  }

  private static RSAPublicKey publicKey(KeyPair pair) {
    return (RSAPublicKey) pair.getPublic();
  }
}
