package io.b2mash.b2b.contractassembly.audit;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.contractassembly.TestcontainersConfiguration;
import io.b2mash.b2b.contractassembly.content.ClauseContent;
import io.b2mash.b2b.contractassembly.content.ClauseLifecycleService;
import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import io.b2mash.b2b.contractassembly.rule.Rule;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Integration tests for {@link DatabaseAuditService} and {@link AuditEventListener} against a real
 * Postgres via Testcontainers.
 */
@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AuditServiceIntegrationTest {

  private static final String TENANT = "tenant_audit_svc";
  private static final String OTHER_TENANT = "tenant_audit_svc_other";

  private final UUID actorId = UUID.randomUUID();

  @Autowired private AuditService auditService;
  @Autowired private ClauseLifecycleService clauseService;
  @Autowired private PlatformTransactionManager transactionManager;

  @Test
  void logEventAndFindItWithinTenant() {
    var entityId = UUID.randomUUID();

    inScope(
        TENANT,
        actorId,
        () -> {
          auditService.log(
              AuditEventBuilder.builder()
                  .eventType("contract.created")
                  .entityType("contract")
                  .entityId(entityId)
                  .details(Map.of("title", "Audit engagement"))
                  .build());
          return null;
        });

    var events = inScope(TENANT, actorId, () -> auditService.findByEntity(entityId));
    assertThat(events).hasSize(1);
    var event = events.get(0);
    assertThat(event.getEventType()).isEqualTo("contract.created");
    assertThat(event.getEntityType()).isEqualTo("contract");
    assertThat(event.getTenantId()).isEqualTo(TENANT);
    assertThat(event.getActorId()).isEqualTo(actorId);
    assertThat(event.getActorType()).isEqualTo("USER");
    assertThat(event.getSource()).isEqualTo("INTERNAL");
    assertThat(event.getDetails()).containsEntry("title", "Audit engagement");
    assertThat(event.getOccurredAt()).isNotNull();

    assertThat(inScope(OTHER_TENANT, actorId, () -> auditService.findByEntity(entityId)))
        .isEmpty();
  }

  @Test
  void rolledBackTransactionLeavesNoAuditRow() {
    var entityId = UUID.randomUUID();
    var transactionTemplate = new TransactionTemplate(transactionManager);

    inScope(
        TENANT,
        actorId,
        () ->
            transactionTemplate.execute(
                status -> {
                  auditService.log(
                      AuditEventBuilder.builder()
                          .eventType("contract.created")
                          .entityType("contract")
                          .entityId(entityId)
                          .build());
                  status.setRollbackOnly();
                  return null;
                }));

    assertThat(inScope(TENANT, actorId, () -> auditService.findByEntity(entityId))).isEmpty();
  }

  @Test
  void publishedVersionIsAuditedFromDomainEvent() {
    UUID reviewerId = UUID.randomUUID();
    UUID versionId =
        inScope(
            TENANT,
            actorId,
            () -> {
              var clause = clauseService.createClause("Audit trail", "DE", null, List.of());
              var content =
                  new ClauseContent(
                      "Records are kept for ten years.",
                      null,
                      List.of(new Rule.ScopedTo(List.of("DE"), null, null, null, null)),
                      null,
                      null);
              var draft = clauseService.createDraft(clause.getId(), content, actorId);
              return clauseService.submitForReview(draft.getId(), reviewerId).version().getId();
            });
    inScope(TENANT, reviewerId, () -> clauseService.approve(versionId, reviewerId));

    var events = inScope(TENANT, actorId, () -> auditService.findByEntity(versionId));
    assertThat(events)
        .extracting(AuditEvent::getEventType)
        .containsSubsequence("version.created", "version.submitted", "version.published");
    var published =
        events.stream()
            .filter(event -> event.getEventType().equals("version.published"))
            .findFirst()
            .orElseThrow();
    assertThat(published.getActorId()).isEqualTo(reviewerId);
    assertThat(published.getDetails()).containsKey("occurredAt");
  }

  private static <T> T inScope(String tenantId, UUID actorId, Supplier<T> action) {
    return RequestScopes.call(new RequestScopes.Scope(tenantId, actorId, "editor"), action);
  }
}
