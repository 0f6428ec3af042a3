package io.b2mash.b2b.contractassembly.content;

import java.time.Instant;
import java.util.UUID;

/**
 * One step of a version's review trail.
 *
 * @param action submitted, approved, rejected, published or deprecated
 * @param actorId user who acted; null for system actions
 * @param comment rejection comment or deprecation reason; null otherwise
 * @param occurredAt when the step happened
 */
public record ReviewHistoryEntry(String action, UUID actorId, String comment, Instant occurredAt) {}
