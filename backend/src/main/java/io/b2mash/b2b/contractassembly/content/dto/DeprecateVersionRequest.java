package io.b2mash.b2b.contractassembly.content.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record DeprecateVersionRequest(
    @NotBlank(message = "reason is required")
        @Size(max = 2000, message = "reason must not exceed 2000 characters")
        String reason) {}
