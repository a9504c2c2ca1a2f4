package com.codeheadsystems.functoken.exceptions;

import com.codeheadsystems.functoken.model.AuthFailure;

/**
 * The configured public key could not be decoded as a PKCS#1 RSA public key.
 */
public class InvalidPublicKeyException extends FunctionAuthException {

  /**
   * Instantiates a new exception.
   */
  public InvalidPublicKeyException() {
    super(AuthFailure.INVALID_PUBLIC_KEY);
  }
}
