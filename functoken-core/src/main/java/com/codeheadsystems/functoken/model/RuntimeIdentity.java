package com.codeheadsystems.functoken.model;

/**
 * Identity of the function instance currently executing, as injected by the runtime.
 *
 * @param applicationId  the function's own application ID
 * @param namespaceId    the namespace the function is deployed in
 * @param publicFunction true when the function is publicly invocable and needs no token
 */
public record RuntimeIdentity(String applicationId, String namespaceId, boolean publicFunction) {

  /**
   * Normalizes absent identifiers to the empty string.
   */
  public RuntimeIdentity {
    applicationId = applicationId == null ? "" : applicationId;
    namespaceId = namespaceId == null ? "" : namespaceId;
  }

  /**
   * Identity of a private function.
   *
   * @param applicationId the application id
   * @param namespaceId   the namespace id
   * @return the runtime identity
   */
  public static RuntimeIdentity privateFunction(String applicationId, String namespaceId) {
    return new RuntimeIdentity(applicationId, namespaceId, false);
  }

  /**
   * Identity of a public function.
   *
   * @param applicationId the application id
   * @param namespaceId   the namespace id
   * @return the runtime identity
   */
  public static RuntimeIdentity publicFunction(String applicationId, String namespaceId) {
    return new RuntimeIdentity(applicationId, namespaceId, true);
  }
}
