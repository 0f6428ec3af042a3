package io.b2mash.b2b.contractassembly.content.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RejectVersionRequest(
    @NotBlank(message = "comment is required")
        @Size(max = 2000, message = "comment must not exceed 2000 characters")
        String comment) {}
