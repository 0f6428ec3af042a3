package io.b2mash.b2b.contractassembly.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for lifecycle and validation events published via Spring's
 * ApplicationEventPublisher. All implementations are records with primitive/UUID fields only, no
 * JPA entity references, so they stay valid after the publishing transaction closes.
 *
 * <p>Delivery and persistence are the audit layer's concern; the core only publishes.
 */
public sealed interface DomainEvent
    permits VersionPublishedEvent,
        VersionDeprecatedEvent,
        ContractCompletedEvent,
        ContractValidatedEvent {

  String eventType();

  String entityType();

  UUID entityId();

  String tenantId();

  UUID actorId();

  Instant occurredAt();

  Map<String, Object> details();
}
