package com.codeheadsystems.functoken.dropwizard.auth;

import com.codeheadsystems.functoken.model.ApplicationClaim;
import com.codeheadsystems.functoken.model.AuthVerdict;
import java.security.Principal;

/**
 * Principal for a request that passed function token authentication.
 *
 * @param namespaceId   namespace scope of the matching claim, empty for public functions
 * @param applicationId application scope of the matching claim, empty for public functions
 * @param publicAccess  true when the function is public and no token was checked
 */
public record FunctionPrincipal(String namespaceId, String applicationId, boolean publicAccess)
    implements Principal {

  /**
   * Builds the principal for an allowed verdict.
   *
   * @param verdict an allowed verdict
   * @return the principal
   */
  public static FunctionPrincipal of(AuthVerdict verdict) {
    return verdict.claim()
        .map(FunctionPrincipal::of)
        .orElseGet(() -> new FunctionPrincipal("", "", true));
  }

  private static FunctionPrincipal of(ApplicationClaim claim) {
    return new FunctionPrincipal(claim.namespaceId(), claim.applicationId(), false);
  }

  @Override
  public String getName() {
    if (publicAccess) {
      return "public";
    }
    return applicationId.isEmpty() ? namespaceId : applicationId;
  }
}
