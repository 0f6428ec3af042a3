package io.b2mash.b2b.contractassembly.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder} which fills in tenant, actor and request metadata.
 *
 * @param eventType event type following the {@code {entity}.{action}} convention, e.g. {@code
 *     version.published}
 * @param entityType kind of object affected ("clause_version", "contract", ...)
 * @param entityId ID of the affected object (not a FK)
 * @param tenantId tenant the action happened in; null for unscoped system work
 * @param actorId acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source API or INTERNAL
 * @param ipAddress client IP; null outside HTTP requests
 * @param userAgent truncated User-Agent header; null outside HTTP requests
 * @param details structured payload stored as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String tenantId,
    UUID actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
