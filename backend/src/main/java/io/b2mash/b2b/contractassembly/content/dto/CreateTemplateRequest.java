package io.b2mash.b2b.contractassembly.content.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

public record CreateTemplateRequest(
    @NotBlank(message = "title is required")
        @Size(max = 300, message = "title must not exceed 300 characters")
        String title,
    @NotBlank(message = "jurisdiction is required")
        @Size(min = 2, max = 10, message = "jurisdiction must be 2 to 10 characters")
        String jurisdiction,
    @Size(max = 100, message = "legalArea must not exceed 100 characters") String legalArea,
    List<String> tags,
    @Size(max = 2000, message = "description must not exceed 2000 characters") String description,
    @Size(max = 100, message = "category must not exceed 100 characters") String category) {}
