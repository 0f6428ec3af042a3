package io.b2mash.b2b.contractassembly.content;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Stable identity of a clause or template across all of its versions.
 *
 * <p>{@code currentPublishedVersionId} is the only pointer to "the" published version. It changes
 * only through {@link #promote(UUID)} during approval and {@link #clearPublished(UUID)} during
 * deprecation, both guarded by the optimistic lock on this row.
 */
@MappedSuperclass
public abstract class LogicalEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, length = 100, updatable = false)
  private String tenantId;

  @Column(name = "title", nullable = false, length = 300)
  private String title;

  @Column(name = "jurisdiction", nullable = false, length = 10)
  private String jurisdiction;

  @Column(name = "legal_area", length = 100)
  private String legalArea;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tags", nullable = false, columnDefinition = "jsonb")
  private List<String> tags = new ArrayList<>();

  @Column(name = "current_published_version_id")
  private UUID currentPublishedVersionId;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected LogicalEntity() {}

  protected LogicalEntity(
      String tenantId, String title, String jurisdiction, String legalArea, List<String> tags) {
    this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
    this.title = Objects.requireNonNull(title, "title must not be null");
    this.jurisdiction = Objects.requireNonNull(jurisdiction, "jurisdiction must not be null");
    this.legalArea = legalArea;
    this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Points this entity at a newly published version. */
  public void promote(UUID versionId) {
    this.currentPublishedVersionId = Objects.requireNonNull(versionId, "versionId");
  }

  /** Clears the published pointer if it still points at the given version. */
  public void clearPublished(UUID versionId) {
    if (versionId.equals(currentPublishedVersionId)) {
      this.currentPublishedVersionId = null;
    }
  }

  public boolean hasPublishedVersion() {
    return currentPublishedVersionId != null;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getTitle() {
    return title;
  }

  public String getJurisdiction() {
    return jurisdiction;
  }

  public String getLegalArea() {
    return legalArea;
  }

  public List<String> getTags() {
    return List.copyOf(tags);
  }

  public UUID getCurrentPublishedVersionId() {
    return currentPublishedVersionId;
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
