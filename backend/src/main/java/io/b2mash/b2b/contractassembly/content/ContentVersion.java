package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.exception.ImmutabilityViolationException;
import io.b2mash.b2b.contractassembly.exception.LifecycleException;
import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * An immutable snapshot of a clause's or template's content at one point in its lifecycle.
 *
 * <p>Content is editable only while the version is a DRAFT. Afterwards only lifecycle metadata
 * moves forward: status, reviewer, timestamps and the review trail. Subclasses call {@link
 * #requireEditable(String)} before touching content; the database enforces the same rule with a
 * trigger.
 */
@MappedSuperclass
public abstract class ContentVersion {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "entity_id", nullable = false, updatable = false)
  private UUID entityId;

  @Column(name = "tenant_id", nullable = false, length = 100, updatable = false)
  private String tenantId;

  @Column(name = "version_number", nullable = false, updatable = false)
  private int versionNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private VersionStatus status;

  @Column(name = "author_id", nullable = false, updatable = false)
  private UUID authorId;

  @Column(name = "reviewer_id")
  private UUID reviewerId;

  @Column(name = "submitted_at")
  private Instant submittedAt;

  @Column(name = "published_at")
  private Instant publishedAt;

  @Column(name = "deprecated_at")
  private Instant deprecatedAt;

  @Column(name = "deprecation_reason", length = 2000)
  private String deprecationReason;

  @Column(name = "rejected_at")
  private Instant rejectedAt;

  @Column(name = "rejection_comment", length = 2000)
  private String rejectionComment;

  @Column(name = "derived_from_version_id", updatable = false)
  private UUID derivedFromVersionId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "changelog", nullable = false, columnDefinition = "jsonb")
  private List<ChangelogEntry> changelog = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "review_history", nullable = false, columnDefinition = "jsonb")
  private List<ReviewHistoryEntry> reviewHistory = new ArrayList<>();

  @Version
  @Column(name = "lock_version", nullable = false)
  private long lockVersion;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  /** JPA-required no-arg constructor. */
  protected ContentVersion() {}

  protected ContentVersion(
      UUID entityId,
      String tenantId,
      int versionNumber,
      UUID authorId,
      UUID derivedFromVersionId) {
    this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
    this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
    this.authorId = Objects.requireNonNull(authorId, "authorId must not be null");
    if (versionNumber < 1) {
      throw new IllegalArgumentException("versionNumber must be positive");
    }
    this.versionNumber = versionNumber;
    this.derivedFromVersionId = derivedFromVersionId;
    this.status = VersionStatus.DRAFT;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  /**
   * Hands the draft to a reviewer. The reviewer must differ from the author.
   *
   * @throws LifecycleException if the version is not a draft or the reviewer is the author
   */
  public void submit(UUID reviewerId) {
    requireSubmittable(reviewerId);
    var now = Instant.now();
    this.status = VersionStatus.REVIEW;
    this.reviewerId = reviewerId;
    this.submittedAt = now;
    appendHistory("submitted", authorId, null, now);
  }

  /**
   * Approves the version under review. The caller must be the assigned reviewer and the version
   * must not have been rejected.
   */
  public void approve(UUID callerId) {
    requireTransition(VersionStatus.APPROVED, "approve");
    requireOpenReview(callerId, "approve");
    this.status = VersionStatus.APPROVED;
    appendHistory("approved", callerId, null, Instant.now());
  }

  /** Publishes an approved version. */
  public void publish() {
    requireTransition(VersionStatus.PUBLISHED, "publish");
    var now = Instant.now();
    this.status = VersionStatus.PUBLISHED;
    this.publishedAt = now;
    appendHistory("published", reviewerId, null, now);
  }

  /**
   * Marks the version under review as rejected. The version stays in REVIEW and can no longer be
   * approved; rework happens on a new draft copy.
   */
  public void reject(UUID callerId, String comment) {
    if (status != VersionStatus.REVIEW) {
      throw new LifecycleException(
          "Invalid version state",
          "Cannot reject version " + id + " in status " + status + "; it must be in REVIEW",
          status.name());
    }
    requireOpenReview(callerId, "reject");
    var now = Instant.now();
    this.rejectedAt = now;
    this.rejectionComment = Objects.requireNonNull(comment, "comment must not be null");
    appendHistory("rejected", callerId, comment, now);
  }

  /** Deprecates a published version. */
  public void deprecate(UUID actorId, String reason) {
    requireTransition(VersionStatus.DEPRECATED, "deprecate");
    var now = Instant.now();
    this.status = VersionStatus.DEPRECATED;
    this.deprecatedAt = now;
    this.deprecationReason = Objects.requireNonNull(reason, "reason must not be null");
    appendHistory("deprecated", actorId, reason, now);
  }

  /**
   * Checks the preconditions of {@link #submit(UUID)} without changing anything, so callers can
   * reject a wrong status or actor before running the publishing gate.
   */
  public void requireSubmittable(UUID reviewerId) {
    requireTransition(VersionStatus.REVIEW, "submit");
    Objects.requireNonNull(reviewerId, "reviewerId must not be null");
    if (reviewerId.equals(authorId)) {
      throw new LifecycleException(
          "Four-eyes principle violated",
          "Reviewer must differ from the author of version " + id,
          status.name());
    }
  }

  /** Appends a changelog entry. Drafts only. */
  public void addChangelogEntry(ChangelogEntry entry) {
    requireEditable("add a changelog entry to");
    var entries = new ArrayList<>(changelog);
    entries.add(Objects.requireNonNull(entry, "entry must not be null"));
    this.changelog = entries;
  }

  /** Copies the changelog of the version this draft was derived from. */
  protected void inheritChangelog(List<ChangelogEntry> entries) {
    this.changelog = new ArrayList<>(entries);
  }

  /**
   * Refuses the named action unless the version is still a draft.
   *
   * @throws ImmutabilityViolationException if the version has left DRAFT
   */
  public void requireEditable(String action) {
    if (!status.isEditable()) {
      throw new ImmutabilityViolationException(
          "Version is immutable",
          "Cannot " + action + " version " + id + " in status " + status + "; only drafts change");
    }
  }

  public boolean isRejected() {
    return rejectedAt != null;
  }

  private void requireOpenReview(UUID callerId, String action) {
    if (rejectedAt != null) {
      throw new LifecycleException(
          "Version was rejected",
          "Cannot " + action + " version " + id + "; it was rejected and replaced by a new draft",
          status.name());
    }
    if (callerId == null || !callerId.equals(reviewerId)) {
      throw new LifecycleException(
          "Not the assigned reviewer",
          "Only the assigned reviewer " + reviewerId + " may " + action + " version " + id,
          status.name());
    }
  }

  private void requireTransition(VersionStatus target, String action) {
    if (!status.canTransitionTo(target)) {
      throw new LifecycleException(
          "Invalid version state",
          "Cannot " + action + " version " + id + " in status " + status,
          status.name());
    }
  }

  private void appendHistory(String action, UUID actorId, String comment, Instant at) {
    var entries = new ArrayList<>(reviewHistory);
    entries.add(new ReviewHistoryEntry(action, actorId, comment, at));
    this.reviewHistory = entries;
  }

  public UUID getId() {
    return id;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public String getTenantId() {
    return tenantId;
  }

  public int getVersionNumber() {
    return versionNumber;
  }

  public VersionStatus getStatus() {
    return status;
  }

  public UUID getAuthorId() {
    return authorId;
  }

  public UUID getReviewerId() {
    return reviewerId;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Instant getPublishedAt() {
    return publishedAt;
  }

  public Instant getDeprecatedAt() {
    return deprecatedAt;
  }

  public String getDeprecationReason() {
    return deprecationReason;
  }

  public Instant getRejectedAt() {
    return rejectedAt;
  }

  public String getRejectionComment() {
    return rejectionComment;
  }

  public UUID getDerivedFromVersionId() {
    return derivedFromVersionId;
  }

  public List<ChangelogEntry> getChangelog() {
    return List.copyOf(changelog);
  }

  public List<ReviewHistoryEntry> getReviewHistory() {
    return List.copyOf(reviewHistory);
  }

  public long getLockVersion() {
    return lockVersion;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
