package io.b2mash.b2b.contractassembly.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** A published version was deprecated, either explicitly or by a newer publication. */
public record VersionDeprecatedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    String tenantId,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID logicalEntityId,
    String reason)
    implements DomainEvent {

  public static final String EVENT_TYPE = "version.deprecated";
}
