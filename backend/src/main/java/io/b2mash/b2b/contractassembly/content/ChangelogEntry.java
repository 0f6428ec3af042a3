package io.b2mash.b2b.contractassembly.content;

import java.time.Instant;
import java.util.UUID;

/** Author's note on what changed in a version and how it affects existing contracts. */
public record ChangelogEntry(
    ChangeType changeType,
    LegalImpact legalImpact,
    String summary,
    String migrationNotes,
    UUID authorId,
    Instant createdAt) {}
