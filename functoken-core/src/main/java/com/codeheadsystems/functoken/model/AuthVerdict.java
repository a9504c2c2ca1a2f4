package com.codeheadsystems.functoken.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one authentication check: either allowed, or rejected for exactly one
 * {@link AuthFailure}.
 * <p>
 * An allowed verdict for a private function carries the {@link ApplicationClaim} that matched.
 * Public functions are allowed without a claim.
 */
public final class AuthVerdict {

  private static final AuthVerdict PUBLIC = new AuthVerdict(null, null);

  private final AuthFailure failure;
  private final ApplicationClaim claim;

  private AuthVerdict(AuthFailure failure, ApplicationClaim claim) {
    this.failure = failure;
    this.claim = claim;
  }

  /**
   * Verdict for a public function; no token was inspected.
   *
   * @return the verdict
   */
  public static AuthVerdict allowedPublic() {
    return PUBLIC;
  }

  /**
   * Verdict for a verified token whose claim matched this function.
   *
   * @param claim the matching claim
   * @return the verdict
   */
  public static AuthVerdict allowed(ApplicationClaim claim) {
    return new AuthVerdict(null, Objects.requireNonNull(claim, "claim"));
  }

  /**
   * Verdict for a rejected request.
   *
   * @param failure why it was rejected
   * @return the verdict
   */
  public static AuthVerdict rejected(AuthFailure failure) {
    return new AuthVerdict(Objects.requireNonNull(failure, "failure"), null);
  }

  /**
   * Is allowed.
   *
   * @return true if the request may proceed
   */
  public boolean isAllowed() {
    return failure == null;
  }

  /**
   * The rejection reason, empty when allowed.
   *
   * @return the failure
   */
  public Optional<AuthFailure> failure() {
    return Optional.ofNullable(failure);
  }

  /**
   * The claim that authorized the request, empty for public functions and rejections.
   *
   * @return the matched claim
   */
  public Optional<ApplicationClaim> claim() {
    return Optional.ofNullable(claim);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AuthVerdict that)) {
      return false;
    }
    return failure == that.failure && Objects.equals(claim, that.claim);
  }

  @Override
  public int hashCode() {
    return Objects.hash(failure, claim);
  }

  @Override
  public String toString() {
    return isAllowed() ? "AuthVerdict[allowed, claim=" + claim + "]" : "AuthVerdict[rejected=" + failure + "]";
  }
}
