package com.codeheadsystems.functoken.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One authorization scope carried in a token's {@code application_claim} array.
 * <p>
 * A claim scoped at the namespace level authorizes every application in that namespace;
 * a claim scoped at the application level authorizes that one application only.
 * Missing or {@code null} fields decode to the empty string.
 *
 * @param namespaceId   the namespace the token is scoped to, possibly empty
 * @param applicationId the application the token is scoped to, possibly empty
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApplicationClaim(
    @JsonProperty("namespace_id") String namespaceId,
    @JsonProperty("application_id") String applicationId) {

  /**
   * Normalizes absent fields to the empty string.
   */
  public ApplicationClaim {
    namespaceId = namespaceId == null ? "" : namespaceId;
    applicationId = applicationId == null ? "" : applicationId;
  }
}
