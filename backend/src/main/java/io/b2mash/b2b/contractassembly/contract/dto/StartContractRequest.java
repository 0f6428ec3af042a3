package io.b2mash.b2b.contractassembly.contract.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;

public record StartContractRequest(
    @NotNull(message = "templateId is required") UUID templateId,
    @NotBlank(message = "title is required")
        @Size(max = 500, message = "title must not exceed 500 characters")
        String title,
    @Size(max = 255, message = "clientReference must not exceed 255 characters")
        String clientReference,
    List<String> tags) {}
