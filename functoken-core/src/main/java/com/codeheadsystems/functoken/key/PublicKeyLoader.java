package com.codeheadsystems.functoken.key;

import com.codeheadsystems.functoken.exceptions.InvalidPublicKeyException;
import java.security.interfaces.RSAPublicKey;

/**
 * Turns the configured public key string into a key the token verifier can use.
 * <p>
 * Implementations must be thread-safe. They must never expose parser diagnostics to the
 * caller: any failure surfaces as an {@link InvalidPublicKeyException} carrying only the
 * generic message, with the underlying detail logged for operators.
 */
public interface PublicKeyLoader {

  /**
   * Loads an RSA public key from its PEM text.
   *
   * @param pem PEM-encoded PKCS#1 RSA public key
   * @return the decoded key
   * @throws InvalidPublicKeyException if the text is empty, has no PEM block, or the block is
   *                                   not a PKCS#1 RSA public key
   */
  RSAPublicKey load(String pem);
}
