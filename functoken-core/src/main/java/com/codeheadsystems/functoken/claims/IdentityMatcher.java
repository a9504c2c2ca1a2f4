package com.codeheadsystems.functoken.claims;

import com.codeheadsystems.functoken.exceptions.ClaimMismatchException;
import com.codeheadsystems.functoken.model.ApplicationClaim;
import com.codeheadsystems.functoken.model.RuntimeIdentity;

/**
 * Decides whether an application claim authorizes the running function.
 * <p>
 * A claim matches when its namespace equals the function's namespace <em>or</em> its
 * application equals the function's application. Callers must make sure both identity fields
 * are non-empty first, otherwise an empty claim field would match an empty identity field.
 */
public class IdentityMatcher {

  /**
   * Matches.
   *
   * @param claim    the claim from the token
   * @param identity the running function's identity
   * @return true if the claim covers the function's namespace or application
   */
  public boolean matches(ApplicationClaim claim, RuntimeIdentity identity) {
    return claim.namespaceId().equals(identity.namespaceId())
        || claim.applicationId().equals(identity.applicationId());
  }

  /**
   * Same as {@link #matches} but fails instead of returning false.
   *
   * @param claim    the claim from the token
   * @param identity the running function's identity
   * @throws ClaimMismatchException if the claim authorizes neither the namespace nor the application
   */
  public void requireMatch(ApplicationClaim claim, RuntimeIdentity identity) {
    if (!matches(claim, identity)) {
      throw new ClaimMismatchException();
    }
  }
}
