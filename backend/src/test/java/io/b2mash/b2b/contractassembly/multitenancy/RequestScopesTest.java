package io.b2mash.b2b.contractassembly.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.contractassembly.exception.MissingTenantContextException;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class RequestScopesTest {

  @Test
  void tenantIdBoundWithinScope() {
    RequestScopes.run(
        new RequestScopes.Scope("tenant_a1b2c3", null, null),
        () -> {
          assertThat(RequestScopes.requireTenantId()).isEqualTo("tenant_a1b2c3");
          assertThat(RequestScopes.getActorIdOrNull()).isNull();
        });
  }

  @Test
  void tenantIdUnboundOutsideScope() {
    assertThat(RequestScopes.getTenantIdOrNull()).isNull();
    assertThatThrownBy(RequestScopes::requireTenantId)
        .isInstanceOf(MissingTenantContextException.class);
  }

  @Test
  void missingActorIsRejected() {
    RequestScopes.run(
        new RequestScopes.Scope("tenant_a1b2c3", null, "user"),
        () ->
            assertThatThrownBy(RequestScopes::requireActorId)
                .isInstanceOf(MissingTenantContextException.class));
  }

  @Test
  void nestedScopeShadowsOuter() {
    RequestScopes.run(
        new RequestScopes.Scope("outer", null, null),
        () -> {
          RequestScopes.run(
              new RequestScopes.Scope("inner", null, null),
              () -> assertThat(RequestScopes.requireTenantId()).isEqualTo("inner"));

          assertThat(RequestScopes.requireTenantId()).isEqualTo("outer");
        });
    assertThat(RequestScopes.getTenantIdOrNull()).isNull();
  }

  @Test
  void scopeIsReleasedOnException() {
    assertThatThrownBy(
            () ->
                RequestScopes.run(
                    new RequestScopes.Scope("test", null, null),
                    () -> {
                      throw new IllegalStateException("test");
                    }))
        .isInstanceOf(IllegalStateException.class);
    assertThat(RequestScopes.getTenantIdOrNull()).isNull();
  }

  @Test
  void adminRoleIsMatchedCaseInsensitively() {
    UUID actorId = UUID.randomUUID();
    boolean admin =
        RequestScopes.call(
            new RequestScopes.Scope("tenant_abc", actorId, "Admin"), RequestScopes::isAdmin);
    boolean editor =
        RequestScopes.call(
            new RequestScopes.Scope("tenant_abc", actorId, "editor"), RequestScopes::isAdmin);

    assertThat(admin).isTrue();
    assertThat(editor).isFalse();
  }
}
