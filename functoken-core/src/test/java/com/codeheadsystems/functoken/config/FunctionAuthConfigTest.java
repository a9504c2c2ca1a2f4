package com.codeheadsystems.functoken.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.functoken.model.RuntimeIdentity;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FunctionAuthConfigTest {

  @Test
  void fromEnvironment_readsPlatformVariables() {
    FunctionAuthConfig config = FunctionAuthConfig.fromEnvironment(Map.of(
        "SCW_PUBLIC", "false",
        "SCW_PUBLIC_KEY", "pem",
        "SCW_APPLICATION_ID", "app-1",
        "SCW_NAMESPACE_ID", "ns-1"));

    assertThat(config.identity()).isEqualTo(RuntimeIdentity.privateFunction("app-1", "ns-1"));
    assertThat(config.publicKeyPem()).isEqualTo("pem");
    assertThat(config.tokenHeader()).isEqualTo(FunctionAuthConfig.DEFAULT_TOKEN_HEADER);
    assertThat(config.leewaySeconds()).isZero();
  }

  @Test
  void fromEnvironment_publicOnlyWhenExactlyTrue() {
    assertThat(FunctionAuthConfig.fromEnvironment(Map.of("SCW_PUBLIC", "true"))
        .identity().publicFunction()).isTrue();
    assertThat(FunctionAuthConfig.fromEnvironment(Map.of("SCW_PUBLIC", "TRUE"))
        .identity().publicFunction()).isFalse();
    assertThat(FunctionAuthConfig.fromEnvironment(Map.of("SCW_PUBLIC", "1"))
        .identity().publicFunction()).isFalse();
  }

  @Test
  void fromEnvironment_missingVariables_becomeEmpty() {
    FunctionAuthConfig config = FunctionAuthConfig.fromEnvironment(Map.of());

    assertThat(config.identity()).isEqualTo(new RuntimeIdentity("", "", false));
    assertThat(config.publicKeyPem()).isEmpty();
  }

  @Test
  void constructor_rejectsBlankHeaderAndNegativeLeeway() {
    RuntimeIdentity identity = RuntimeIdentity.privateFunction("app-1", "ns-1");

    assertThatThrownBy(() -> new FunctionAuthConfig(identity, "pem", " ", 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new FunctionAuthConfig(identity, "pem", "X-Token", -1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new FunctionAuthConfig(null, "pem"))
        .isInstanceOf(NullPointerException.class);
  }
}
