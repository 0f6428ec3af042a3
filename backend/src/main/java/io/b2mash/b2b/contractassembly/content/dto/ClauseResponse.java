package io.b2mash.b2b.contractassembly.content.dto;

import io.b2mash.b2b.contractassembly.content.Clause;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ClauseResponse(
    UUID id,
    String tenantId,
    String title,
    String jurisdiction,
    String legalArea,
    List<String> tags,
    UUID currentPublishedVersionId,
    Instant createdAt,
    Instant updatedAt) {

  public static ClauseResponse from(Clause clause) {
    return new ClauseResponse(
        clause.getId(),
        clause.getTenantId(),
        clause.getTitle(),
        clause.getJurisdiction(),
        clause.getLegalArea(),
        clause.getTags(),
        clause.getCurrentPublishedVersionId(),
        clause.getCreatedAt(),
        clause.getUpdatedAt());
  }
}
