package com.codeheadsystems.functoken.claims;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.functoken.exceptions.ClaimMismatchException;
import com.codeheadsystems.functoken.model.ApplicationClaim;
import com.codeheadsystems.functoken.model.RuntimeIdentity;
import org.junit.jupiter.api.Test;

class IdentityMatcherTest {

  private static final RuntimeIdentity IDENTITY = RuntimeIdentity.privateFunction("app-1", "ns-1");

  private final IdentityMatcher matcher = new IdentityMatcher();

  @Test
  void matches_bothFields() {
    assertThat(matcher.matches(new ApplicationClaim("ns-1", "app-1"), IDENTITY)).isTrue();
  }

  @Test
  void matches_namespaceScopedClaim() {
    assertThat(matcher.matches(new ApplicationClaim("ns-1", "app-9"), IDENTITY)).isTrue();
    assertThat(matcher.matches(new ApplicationClaim("ns-1", ""), IDENTITY)).isTrue();
  }

  @Test
  void matches_applicationScopedClaim() {
    assertThat(matcher.matches(new ApplicationClaim("ns-2", "app-1"), IDENTITY)).isTrue();
    assertThat(matcher.matches(new ApplicationClaim("", "app-1"), IDENTITY)).isTrue();
  }

  @Test
  void matches_neither_isFalse() {
    assertThat(matcher.matches(new ApplicationClaim("ns-2", "app-9"), IDENTITY)).isFalse();
    assertThat(matcher.matches(new ApplicationClaim("", ""), IDENTITY)).isFalse();
  }

  @Test
  void matches_isCaseSensitive() {
    assertThat(matcher.matches(new ApplicationClaim("NS-1", "APP-1"), IDENTITY)).isFalse();
  }

  @Test
  void matches_emptyIdentityFieldMatchesEmptyClaimField() {
    // Callers guard against this by requiring a non-empty identity.
    RuntimeIdentity partial = RuntimeIdentity.privateFunction("app-1", "");

    assertThat(matcher.matches(new ApplicationClaim("", "app-9"), partial)).isTrue();
  }

  @Test
  void requireMatch_mismatch_throws() {
    assertThatThrownBy(() -> matcher.requireMatch(new ApplicationClaim("ns-2", "app-9"), IDENTITY))
        .isInstanceOf(ClaimMismatchException.class);
    assertThatCode(() -> matcher.requireMatch(new ApplicationClaim("ns-1", "app-9"), IDENTITY))
        .doesNotThrowAnyException();
  }
}
