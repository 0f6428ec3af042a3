package io.b2mash.b2b.contractassembly.event;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ContractCompletedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    String tenantId,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID templateVersionId,
    List<UUID> clauseVersionIds)
    implements DomainEvent {

  public static final String EVENT_TYPE = "contract.completed";
}
