package io.b2mash.b2b.contractassembly.content.dto;

import io.b2mash.b2b.contractassembly.content.ChangelogEntry;
import io.b2mash.b2b.contractassembly.content.TemplateQuestion;
import io.b2mash.b2b.contractassembly.content.TemplateSection;
import io.b2mash.b2b.contractassembly.content.TemplateVersion;
import io.b2mash.b2b.contractassembly.content.VersionStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record TemplateVersionResponse(
    UUID id,
    UUID templateId,
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
    List<TemplateSection> structure,
    List<TemplateQuestion> questions,
    List<ChangelogEntry> changelog,
    Instant createdAt) {

  public static TemplateVersionResponse from(TemplateVersion version) {
    return new TemplateVersionResponse(
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
        version.getStructure(),
        version.getQuestions(),
        version.getChangelog(),
        version.getCreatedAt());
  }
}
