package io.b2mash.b2b.contractassembly.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** A clause or template version became the published version of its entity. */
public record VersionPublishedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    String tenantId,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID logicalEntityId,
    int versionNumber,
    UUID demotedVersionId)
    implements DomainEvent {

  public static final String EVENT_TYPE = "version.published";
}
