package io.chatpad.pilot.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class RequestScopesTest {

  @Test
  void unboundPrincipalThrows() {
    assertThat(RequestScopes.isPrincipalBound()).isFalse();
    assertThatThrownBy(RequestScopes::requirePrincipalId)
        .isInstanceOf(PrincipalContextNotBoundException.class);
  }

  @Test
  void nestedBindingRestoresOuterPrincipal() throws Exception {
    var outer = UUID.randomUUID();
    var inner = UUID.randomUUID();

    RequestScopes.runAs(
        outer,
        () -> {
          RequestScopes.runAs(
              inner, () -> assertThat(RequestScopes.requirePrincipalId()).isEqualTo(inner));
          assertThat(RequestScopes.requirePrincipalId()).isEqualTo(outer);
        });

    assertThat(RequestScopes.getPrincipalIdOrNull()).isNull();
  }

  @Test
  void bindingIsClearedWhenActionThrows() {
    assertThatThrownBy(
            () ->
                RequestScopes.callAs(
                    UUID.randomUUID(),
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(RequestScopes.isPrincipalBound()).isFalse();
  }
}
