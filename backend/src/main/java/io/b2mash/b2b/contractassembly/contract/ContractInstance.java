package io.b2mash.b2b.contractassembly.contract;

import io.b2mash.b2b.contractassembly.exception.ImmutabilityViolationException;
import io.b2mash.b2b.contractassembly.exception.LifecycleException;
import io.b2mash.b2b.contractassembly.validation.ValidationMessage;
import io.b2mash.b2b.contractassembly.validation.ValidationResult;
import io.b2mash.b2b.contractassembly.validation.ValidationState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A tenant's contract assembled from pinned template and clause versions.
 *
 * <p>Pins are exact version ids resolved when the contract starts or is upgraded. While the
 * contract is a DRAFT its answers and slot choices change freely and pins change only by an
 * explicit upgrade. From COMPLETED on, pins, answers, slot choices and jurisdiction are frozen;
 * this entity refuses the change and a database trigger rejects it independently.
 */
@Entity
@Table(name = "contract_instances")
public class ContractInstance {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, length = 100, updatable = false)
  private String tenantId;

  @Column(name = "creator_id", nullable = false, updatable = false)
  private UUID creatorId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "client_reference", length = 255)
  private String clientReference;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tags", nullable = false, columnDefinition = "jsonb")
  private List<String> tags = new ArrayList<>();

  @Column(name = "template_id", nullable = false, updatable = false)
  private UUID templateId;

  @Column(name = "template_version_id", nullable = false)
  private UUID templateVersionId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "clause_version_ids", nullable = false, columnDefinition = "jsonb")
  private List<UUID> clauseVersionIds = new ArrayList<>();

  @Column(name = "jurisdiction", nullable = false, length = 10)
  private String jurisdiction;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "answers", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> answers = new LinkedHashMap<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "selected_slots", nullable = false, columnDefinition = "jsonb")
  private Map<String, UUID> selectedSlots = new LinkedHashMap<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "validation_state", nullable = false, length = 20)
  private ValidationState validationState;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "validation_messages", nullable = false, columnDefinition = "jsonb")
  private List<ValidationMessage> validationMessages = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ContractStatus status;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected ContractInstance() {}

  public ContractInstance(
      String tenantId,
      UUID creatorId,
      String title,
      String clientReference,
      List<String> tags,
      UUID templateId,
      UUID templateVersionId,
      List<UUID> clauseVersionIds,
      String jurisdiction,
      Map<String, UUID> selectedSlots) {
    this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
    this.creatorId = Objects.requireNonNull(creatorId, "creatorId must not be null");
    this.title = Objects.requireNonNull(title, "title must not be null");
    this.clientReference = clientReference;
    this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    this.templateId = Objects.requireNonNull(templateId, "templateId must not be null");
    this.templateVersionId =
        Objects.requireNonNull(templateVersionId, "templateVersionId must not be null");
    this.clauseVersionIds = new ArrayList<>(clauseVersionIds);
    this.jurisdiction = Objects.requireNonNull(jurisdiction, "jurisdiction must not be null");
    this.selectedSlots = new LinkedHashMap<>(selectedSlots);
    this.status = ContractStatus.DRAFT;
    this.validationState = ValidationState.VALID;
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

  /** Merges answers into the snapshot; a null value removes the answer. */
  public void mergeAnswers(Map<String, Object> changes) {
    requireDraft("change answers of");
    var merged = new LinkedHashMap<>(answers);
    changes.forEach(
        (questionId, value) -> {
          if (value == null) {
            merged.remove(questionId);
          } else {
            merged.put(questionId, value);
          }
        });
    this.answers = merged;
  }

  /** Fills a slot with a pinned clause version, or clears it when the version id is null. */
  public void selectSlot(String slotId, UUID clauseVersionId) {
    requireDraft("change slot choices of");
    if (clauseVersionId != null && !clauseVersionIds.contains(clauseVersionId)) {
      throw new IllegalArgumentException(
          "Clause version " + clauseVersionId + " is not pinned by contract " + id);
    }
    var slots = new LinkedHashMap<>(selectedSlots);
    if (clauseVersionId == null) {
      slots.remove(slotId);
    } else {
      slots.put(slotId, clauseVersionId);
    }
    this.selectedSlots = slots;
  }

  /** Replaces all pins during an explicit upgrade. */
  public void repin(
      UUID templateVersionId, List<UUID> clauseVersionIds, Map<String, UUID> selectedSlots) {
    requireDraft("upgrade pins of");
    this.templateVersionId = Objects.requireNonNull(templateVersionId, "templateVersionId");
    this.clauseVersionIds = new ArrayList<>(clauseVersionIds);
    this.selectedSlots = new LinkedHashMap<>(selectedSlots);
  }

  public void updateMetadata(String title, String clientReference, List<String> tags) {
    requireDraft("edit");
    if (title != null) {
      this.title = title;
    }
    if (clientReference != null) {
      this.clientReference = clientReference;
    }
    if (tags != null) {
      this.tags = new ArrayList<>(tags);
    }
  }

  /** Stores the outcome of a validation run. */
  public void recordValidation(ValidationResult result) {
    this.validationState = result.validationState();
    this.validationMessages = new ArrayList<>(result.messages());
  }

  /**
   * Freezes the contract. The caller checks slots and rule conflicts first.
   *
   * @throws LifecycleException if the contract is not a draft
   */
  public void complete() {
    if (status != ContractStatus.DRAFT) {
      throw new LifecycleException(
          "Invalid contract state",
          "Cannot complete contract " + id + " in status " + status + "; it must be a DRAFT",
          status.name());
    }
    this.status = ContractStatus.COMPLETED;
    this.completedAt = Instant.now();
  }

  public void archive() {
    if (status != ContractStatus.COMPLETED) {
      throw new LifecycleException(
          "Invalid contract state",
          "Cannot archive contract " + id + " in status " + status + "; it must be COMPLETED",
          status.name());
    }
    this.status = ContractStatus.ARCHIVED;
  }

  /** Clause versions currently chosen for slots, without duplicates. */
  public Set<UUID> selectedClauseVersionIds() {
    Set<UUID> selected = new LinkedHashSet<>();
    for (UUID versionId : selectedSlots.values()) {
      if (versionId != null) {
        selected.add(versionId);
      }
    }
    return selected;
  }

  private void requireDraft(String action) {
    if (status.isFrozen()) {
      throw new ImmutabilityViolationException(
          "Contract is frozen",
          "Cannot " + action + " contract " + id + " in status " + status);
    }
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getCreatorId() {
    return creatorId;
  }

  public String getTitle() {
    return title;
  }

  public String getClientReference() {
    return clientReference;
  }

  public List<String> getTags() {
    return List.copyOf(tags);
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public UUID getTemplateVersionId() {
    return templateVersionId;
  }

  public List<UUID> getClauseVersionIds() {
    return List.copyOf(clauseVersionIds);
  }

  public String getJurisdiction() {
    return jurisdiction;
  }

  public Map<String, Object> getAnswers() {
    return Collections.unmodifiableMap(answers);
  }

  public Map<String, UUID> getSelectedSlots() {
    return Collections.unmodifiableMap(selectedSlots);
  }

  public ValidationState getValidationState() {
    return validationState;
  }

  public List<ValidationMessage> getValidationMessages() {
    return List.copyOf(validationMessages);
  }

  public ContractStatus getStatus() {
    return status;
  }

  public Instant getCompletedAt() {
    return completedAt;
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
