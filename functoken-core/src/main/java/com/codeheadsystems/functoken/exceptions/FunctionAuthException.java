package com.codeheadsystems.functoken.exceptions;

import com.codeheadsystems.functoken.model.AuthFailure;

/**
 * Base type for a failed authentication step. The message is always the caller-safe message
 * of the {@link AuthFailure}; low-level causes are logged where they occur and not attached.
 */
public class FunctionAuthException extends RuntimeException {

  private final AuthFailure failure;

  /**
   * Instantiates a new Function auth exception.
   *
   * @param failure the failure kind
   */
  public FunctionAuthException(final AuthFailure failure) {
    super(failure.message());
    this.failure = failure;
  }

  /**
   * Gets the failure kind.
   *
   * @return the failure
   */
  public AuthFailure failure() {
    return failure;
  }
}
