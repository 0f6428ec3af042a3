package io.b2mash.b2b.contractassembly.content.dto;

import io.b2mash.b2b.contractassembly.content.ChangeType;
import io.b2mash.b2b.contractassembly.content.LegalImpact;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangelogEntryRequest(
    ChangeType changeType,
    LegalImpact legalImpact,
    @NotBlank(message = "summary is required")
        @Size(max = 1000, message = "summary must not exceed 1000 characters")
        String summary,
    @Size(max = 4000, message = "migrationNotes must not exceed 4000 characters")
        String migrationNotes) {}
