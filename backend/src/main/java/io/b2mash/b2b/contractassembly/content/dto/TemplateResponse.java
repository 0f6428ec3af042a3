package io.b2mash.b2b.contractassembly.content.dto;

import io.b2mash.b2b.contractassembly.content.Template;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record TemplateResponse(
    UUID id,
    String tenantId,
    String title,
    String jurisdiction,
    String legalArea,
    List<String> tags,
    String description,
    String category,
    UUID currentPublishedVersionId,
    Instant createdAt,
    Instant updatedAt) {

  public static TemplateResponse from(Template template) {
    return new TemplateResponse(
        template.getId(),
        template.getTenantId(),
        template.getTitle(),
        template.getJurisdiction(),
        template.getLegalArea(),
        template.getTags(),
        template.getDescription(),
        template.getCategory(),
        template.getCurrentPublishedVersionId(),
        template.getCreatedAt(),
        template.getUpdatedAt());
  }
}
