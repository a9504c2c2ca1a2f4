package com.codeheadsystems.functoken.exceptions;

import com.codeheadsystems.functoken.model.AuthFailure;

/**
 * The token's application claims are missing, empty or malformed.
 */
public class ClaimsInvalidException extends FunctionAuthException {

  /**
   * Instantiates a new exception.
   */
  public ClaimsInvalidException() {
    super(AuthFailure.CLAIMS_INVALID);
  }
}
