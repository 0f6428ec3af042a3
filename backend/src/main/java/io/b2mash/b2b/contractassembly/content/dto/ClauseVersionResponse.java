package io.b2mash.b2b.contractassembly.content.dto;

import io.b2mash.b2b.contractassembly.content.ChangelogEntry;
import io.b2mash.b2b.contractassembly.content.ClauseVersion;
import io.b2mash.b2b.contractassembly.content.VersionStatus;
import io.b2mash.b2b.contractassembly.rule.Rule;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ClauseVersionResponse(
    UUID id,
    UUID clauseId,
    int versionNumber,
    VersionStatus status,
    UUID authorId,
    UUID reviewerId,
    Instant submittedAt,
    Instant publishedAt,
    Instant deprecatedAt,
    String deprecationReason,
    Instant rejectedAt,
    String rejectionComment,
    UUID derivedFromVersionId,
    String content,
    Map<String, Object> parameters,
    List<Rule> rules,
    LocalDate validFrom,
    LocalDate validUntil,
    List<ChangelogEntry> changelog,
    Instant createdAt) {

  public static ClauseVersionResponse from(ClauseVersion version) {
    return new ClauseVersionResponse(
        version.getId(),
        version.getEntityId(),
        version.getVersionNumber(),
        version.getStatus(),
        version.getAuthorId(),
        version.getReviewerId(),
        version.getSubmittedAt(),
        version.getPublishedAt(),
        version.getDeprecatedAt(),
        version.getDeprecationReason(),
        version.getRejectedAt(),
        version.getRejectionComment(),
        version.getDerivedFromVersionId(),
        version.getContent(),
        version.getParameters(),
        version.getRules(),
        version.getValidFrom(),
        version.getValidUntil(),
        version.getChangelog(),
        version.getCreatedAt());
  }
}
