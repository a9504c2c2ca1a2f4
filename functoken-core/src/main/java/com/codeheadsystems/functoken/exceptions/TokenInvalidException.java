package com.codeheadsystems.functoken.exceptions;

import com.codeheadsystems.functoken.model.AuthFailure;

/**
 * The token is malformed, carries a bad signature, or is outside its validity window.
 */
public class TokenInvalidException extends FunctionAuthException {

  /**
   * Instantiates a new exception.
   */
  public TokenInvalidException() {
    super(AuthFailure.TOKEN_INVALID);
  }
}
