package io.b2mash.b2b.contractassembly.audit;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

class AuditEventBuilderTest {

  @AfterEach
  void clearRequest() {
    RequestContextHolder.resetRequestAttributes();
  }

  @Test
  void fillsTenantAndActorFromRequestScope() {
    UUID actorId = UUID.randomUUID();
    UUID entityId = UUID.randomUUID();

    var record =
        RequestScopes.call(
            new RequestScopes.Scope("tenant_audit", actorId, "editor"),
            () ->
                AuditEventBuilder.builder()
                    .eventType("clause.created")
                    .entityType("clause")
                    .entityId(entityId)
                    .details(Map.of("title", "Liability"))
                    .build());

    assertThat(record.tenantId()).isEqualTo("tenant_audit");
    assertThat(record.actorId()).isEqualTo(actorId);
    assertThat(record.actorType()).isEqualTo("USER");
    assertThat(record.source()).isEqualTo("INTERNAL");
    assertThat(record.ipAddress()).isNull();
    assertThat(record.details()).containsEntry("title", "Liability");
  }

  @Test
  void explicitValuesWinOverRequestScope() {
    var record =
        RequestScopes.call(
            new RequestScopes.Scope("tenant_scope", UUID.randomUUID(), "editor"),
            () ->
                AuditEventBuilder.builder()
                    .eventType("contract.completed")
                    .entityType("contract")
                    .entityId(UUID.randomUUID())
                    .tenantId("tenant_event")
                    .actorId(null)
                    .build());

    assertThat(record.tenantId()).isEqualTo("tenant_event");
    assertThat(record.actorId()).isNull();
    assertThat(record.actorType()).isEqualTo("SYSTEM");
  }

  @Test
  void capturesHttpRequestMetadataAndTruncatesUserAgent() {
    var request = new MockHttpServletRequest();
    request.setRemoteAddr("10.0.0.7");
    request.addHeader("User-Agent", "x".repeat(600));
    RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

    var record =
        AuditEventBuilder.builder()
            .eventType("version.submitted")
            .entityType("clause_version")
            .entityId(UUID.randomUUID())
            .build();

    assertThat(record.source()).isEqualTo("API");
    assertThat(record.ipAddress()).isEqualTo("10.0.0.7");
    assertThat(record.userAgent()).hasSize(500);
    assertThat(record.tenantId()).isNull();
  }
}
