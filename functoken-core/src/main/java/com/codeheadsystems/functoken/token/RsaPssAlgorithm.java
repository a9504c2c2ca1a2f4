package com.codeheadsystems.functoken.token;

import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.SignatureGenerationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;
import java.util.Base64;

/**
 * RSASSA-PSS signatures for java-jwt, which only ships the PKCS#1 v1.5 RSA algorithms.
 * <p>
 * Parameters follow RFC 7518 section 3.5: MGF1 with the signature's digest and a salt as long
 * as the digest output.
 */
public class RsaPssAlgorithm extends Algorithm {

  private static final String JCA_NAME = "RSASSA-PSS";

  private final PSSParameterSpec parameters;
  private final RSAPublicKey publicKey;
  private final RSAPrivateKey privateKey;

  private RsaPssAlgorithm(String name, String digest, MGF1ParameterSpec mgf1, int saltLength,
                          RSAPublicKey publicKey, RSAPrivateKey privateKey) {
    super(name, JCA_NAME + " with " + digest);
    this.parameters = new PSSParameterSpec(digest, "MGF1", mgf1, saltLength, PSSParameterSpec.TRAILER_FIELD_BC);
    this.publicKey = publicKey;
    this.privateKey = privateKey;
  }

  /**
   * PS256: RSASSA-PSS using SHA-256.
   *
   * @param publicKey  key used to verify, may be null when only signing
   * @param privateKey key used to sign, may be null when only verifying
   * @return the algorithm
   */
  public static RsaPssAlgorithm PS256(RSAPublicKey publicKey, RSAPrivateKey privateKey) {
    return new RsaPssAlgorithm("PS256", "SHA-256", MGF1ParameterSpec.SHA256, 32, publicKey, privateKey);
  }

  /**
   * PS384: RSASSA-PSS using SHA-384.
   *
   * @param publicKey  key used to verify, may be null when only signing
   * @param privateKey key used to sign, may be null when only verifying
   * @return the algorithm
   */
  public static RsaPssAlgorithm PS384(RSAPublicKey publicKey, RSAPrivateKey privateKey) {
    return new RsaPssAlgorithm("PS384", "SHA-384", MGF1ParameterSpec.SHA384, 48, publicKey, privateKey);
  }

  /**
   * PS512: RSASSA-PSS using SHA-512.
   *
   * @param publicKey  key used to verify, may be null when only signing
   * @param privateKey key used to sign, may be null when only verifying
   * @return the algorithm
   */
  public static RsaPssAlgorithm PS512(RSAPublicKey publicKey, RSAPrivateKey privateKey) {
    return new RsaPssAlgorithm("PS512", "SHA-512", MGF1ParameterSpec.SHA512, 64, publicKey, privateKey);
  }

  @Override
  public void verify(DecodedJWT jwt) throws SignatureVerificationException {
    if (publicKey == null) {
      throw new SignatureVerificationException(this, new IllegalStateException("The public key is null."));
    }
    try {
      byte[] signature = Base64.getUrlDecoder().decode(jwt.getSignature());
      Signature verifier = newSignature();
      verifier.initVerify(publicKey);
      verifier.update(signingInput(jwt.getHeader(), jwt.getPayload()));
      if (!verifier.verify(signature)) {
        throw new SignatureVerificationException(this);
      }
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new SignatureVerificationException(this, e);
    }
  }

  @Override
  public byte[] sign(byte[] headerBytes, byte[] payloadBytes) throws SignatureGenerationException {
    return sign(signingInput(
        new String(headerBytes, StandardCharsets.UTF_8), new String(payloadBytes, StandardCharsets.UTF_8)));
  }

  @Override
  public byte[] sign(byte[] contentBytes) throws SignatureGenerationException {
    if (privateKey == null) {
      throw new SignatureGenerationException(this, new IllegalStateException("The private key is null."));
    }
    try {
      Signature signer = newSignature();
      signer.initSign(privateKey);
      signer.update(contentBytes);
      return signer.sign();
    } catch (GeneralSecurityException e) {
      throw new SignatureGenerationException(this, e);
    }
  }

  private Signature newSignature() throws GeneralSecurityException {
    Signature signature = Signature.getInstance(JCA_NAME);
    signature.setParameter(parameters);
    return signature;
  }

  private static byte[] signingInput(String header, String payload) {
    return (header + "." + payload).getBytes(StandardCharsets.US_ASCII);
  }
}
