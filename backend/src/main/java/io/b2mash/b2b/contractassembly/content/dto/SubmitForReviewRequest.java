package io.b2mash.b2b.contractassembly.content.dto;

import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record SubmitForReviewRequest(
    @NotNull(message = "reviewerId is required") UUID reviewerId) {}
