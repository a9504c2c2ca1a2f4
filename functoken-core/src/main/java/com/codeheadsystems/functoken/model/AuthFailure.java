package com.codeheadsystems.functoken.model;

/**
 * The reasons a request can be rejected. Messages are fixed and safe to return to callers;
 * they never contain parser or key-material diagnostics.
 */
public enum AuthFailure {

  NO_TOKEN("Authentication token was not provided in the request", false),
  INVALID_PUBLIC_KEY("Invalid public key", true),
  TOKEN_INVALID("Invalid token", false),
  CLAIMS_INVALID("Invalid claims", false),
  MISSING_APPLICATION_ID("Application ID was not provided", true),
  MISSING_NAMESPACE_ID("Namespace ID was not provided", true),
  CLAIM_MISMATCH("Token claims do not match this function", false);

  private final String message;
  private final boolean misconfiguration;

  AuthFailure(String message, boolean misconfiguration) {
    this.message = message;
    this.misconfiguration = misconfiguration;
  }

  /**
   * Caller-facing description of the failure.
   *
   * @return the message
   */
  public String message() {
    return message;
  }

  /**
   * Whether the failure comes from the function's own configuration rather than the
   * credential presented by the caller.
   *
   * @return true for runtime misconfiguration
   */
  public boolean isMisconfiguration() {
    return misconfiguration;
  }
}
