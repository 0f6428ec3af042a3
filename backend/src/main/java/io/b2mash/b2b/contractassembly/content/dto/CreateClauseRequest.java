package io.b2mash.b2b.contractassembly.content.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

public record CreateClauseRequest(
    @NotBlank(message = "title is required")
        @Size(max = 300, message = "title must not exceed 300 characters")
        String title,
    @NotBlank(message = "jurisdiction is required")
        @Size(min = 2, max = 10, message = "jurisdiction must be 2 to 10 characters")
        String jurisdiction,
    @Size(max = 100, message = "legalArea must not exceed 100 characters") String legalArea,
    List<String> tags) {}
