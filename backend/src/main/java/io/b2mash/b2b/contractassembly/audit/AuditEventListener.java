package io.b2mash.b2b.contractassembly.audit;

import io.b2mash.b2b.contractassembly.event.DomainEvent;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Persists published domain events as audit rows. Runs before commit so the audit row shares the
 * fate of the transition that produced it.
 */
@Component
public class AuditEventListener {

  private static final Logger log = LoggerFactory.getLogger(AuditEventListener.class);

  private final AuditService auditService;

  public AuditEventListener(AuditService auditService) {
    this.auditService = auditService;
  }

  @TransactionalEventListener(phase = TransactionPhase.BEFORE_COMMIT, fallbackExecution = true)
  public void onDomainEvent(DomainEvent event) {
    Map<String, Object> details = new HashMap<>();
    if (event.details() != null) {
      details.putAll(event.details());
    }
    details.put("occurredAt", event.occurredAt().toString());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType(event.eventType())
            .entityType(event.entityType())
            .entityId(event.entityId())
            .tenantId(event.tenantId())
            .actorId(event.actorId())
            .details(details)
            .build());
    log.debug(
        "Audited domain event {} for {} {}",
        event.eventType(),
        event.entityType(),
        event.entityId());
  }
}
