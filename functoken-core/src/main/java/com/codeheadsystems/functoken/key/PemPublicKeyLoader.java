package com.codeheadsystems.functoken.key;

import com.codeheadsystems.functoken.exceptions.InvalidPublicKeyException;
import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPublicKeySpec;
import java.util.Arrays;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes the first PEM block of a string as a DER {@code RSAPublicKey} (RFC 8017 A.1.1):
 * <pre>
 *   RSAPublicKey ::= SEQUENCE {
 *     modulus         INTEGER,
 *     publicExponent  INTEGER }
 * </pre>
 * The block label is not checked; only its contents decide. An X.509
 * {@code SubjectPublicKeyInfo}, an EC key, or trailing bytes after the sequence are rejected.
 */
public class PemPublicKeyLoader implements PublicKeyLoader {

  private static final Logger log = LoggerFactory.getLogger(PemPublicKeyLoader.class);

  // The exponent has to fit a signed 32-bit int.
  private static final int MAX_EXPONENT_BITS = 31;

  @Override
  public RSAPublicKey load(String pem) {
    if (pem == null || pem.isBlank()) {
      log.warn("No public key configured");
      throw new InvalidPublicKeyException();
    }
    byte[] der = readFirstBlock(pem);
    return parsePkcs1(der);
  }

  private byte[] readFirstBlock(String pem) {
    PemObject block;
    try (PemReader reader = new PemReader(new StringReader(pem))) {
      block = reader.readPemObject();
    } catch (IOException | RuntimeException e) {
      log.warn("Public key PEM could not be read: {}", e.getMessage());
      throw new InvalidPublicKeyException();
    }
    if (block == null) {
      log.warn("Public key contains no PEM block");
      throw new InvalidPublicKeyException();
    }
    return block.getContent();
  }

  private RSAPublicKey parsePkcs1(byte[] der) {
    ASN1Sequence sequence = readSequence(der);
    if (sequence.size() != 2) {
      log.warn("Public key sequence has {} elements, expected 2", sequence.size());
      throw new InvalidPublicKeyException();
    }

    // Signed values: a negative INTEGER must stay negative so it can be rejected.
    BigInteger modulus;
    BigInteger exponent;
    try {
      modulus = ASN1Integer.getInstance(sequence.getObjectAt(0)).getValue();
      exponent = ASN1Integer.getInstance(sequence.getObjectAt(1)).getValue();
    } catch (IllegalArgumentException e) {
      log.warn("Public key is not a PKCS#1 RSA public key: {}", e.getMessage());
      throw new InvalidPublicKeyException();
    }
    if (modulus.signum() <= 0 || exponent.signum() <= 0) {
      log.warn("Public key contains zero or negative value");
      throw new InvalidPublicKeyException();
    }
    if (exponent.bitLength() > MAX_EXPONENT_BITS) {
      log.warn("Public key contains large public exponent");
      throw new InvalidPublicKeyException();
    }

    try {
      return (RSAPublicKey) KeyFactory.getInstance("RSA")
          .generatePublic(new RSAPublicKeySpec(modulus, exponent));
    } catch (GeneralSecurityException e) {
      log.warn("Public key could not be constructed: {}", e.getMessage());
      throw new InvalidPublicKeyException();
    }
  }

  private ASN1Sequence readSequence(byte[] der) {
    try {
      ASN1Primitive primitive = ASN1Primitive.fromByteArray(der);
      // Re-encoding must give back the input: no trailing bytes, no BER forms.
      if (Arrays.equals(primitive.getEncoded(ASN1Encoding.DER), der)) {
        return ASN1Sequence.getInstance(primitive);
      }
      log.warn("Public key has trailing or non-DER bytes");
    } catch (IOException | RuntimeException e) {
      log.warn("Public key is not a PKCS#1 RSA public key: {}", e.getMessage());
    }
    throw new InvalidPublicKeyException();
  }
}
