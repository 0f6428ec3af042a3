package io.b2mash.b2b.contractassembly.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ContractValidatedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    String tenantId,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    String validationState,
    int messageCount)
    implements DomainEvent {

  public static final String EVENT_TYPE = "contract.validated";
}
