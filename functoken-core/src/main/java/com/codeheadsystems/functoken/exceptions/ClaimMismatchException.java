package com.codeheadsystems.functoken.exceptions;

import com.codeheadsystems.functoken.model.AuthFailure;

/**
 * The token's application claim authorizes neither this function's namespace nor its application.
 */
public class ClaimMismatchException extends FunctionAuthException {

  /**
   * Instantiates a new exception.
   */
  public ClaimMismatchException() {
    super(AuthFailure.CLAIM_MISMATCH);
  }
}
