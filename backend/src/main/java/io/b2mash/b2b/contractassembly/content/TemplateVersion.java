package io.b2mash.b2b.contractassembly.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** A version of a template: ordered sections of clause slots plus the interview questions. */
@Entity
@Table(name = "template_versions")
public class TemplateVersion extends ContentVersion {

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "structure", nullable = false, columnDefinition = "jsonb")
  private List<TemplateSection> structure = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "questions", nullable = false, columnDefinition = "jsonb")
  private List<TemplateQuestion> questions = new ArrayList<>();

  /** JPA-required no-arg constructor. */
  protected TemplateVersion() {}

  public TemplateVersion(
      Template template, int versionNumber, UUID authorId, TemplateContent content) {
    this(template.getId(), template.getTenantId(), versionNumber, authorId, null, content);
  }

  private TemplateVersion(
      UUID entityId,
      String tenantId,
      int versionNumber,
      UUID authorId,
      UUID derivedFromVersionId,
      TemplateContent content) {
    super(entityId, tenantId, versionNumber, authorId, derivedFromVersionId);
    assign(content);
  }

  /**
   * Creates the draft that replaces a rejected version: same author, same content, next number.
   */
  public static TemplateVersion reworkOf(TemplateVersion rejected, int versionNumber) {
    var copy =
        new TemplateVersion(
            rejected.getEntityId(),
            rejected.getTenantId(),
            versionNumber,
            rejected.getAuthorId(),
            rejected.getId(),
            rejected.toContent());
    copy.inheritChangelog(rejected.getChangelog());
    return copy;
  }

  /** Replaces the draft's structure and questions. */
  public void updateContent(TemplateContent content) {
    requireEditable("edit");
    assign(content);
  }

  public TemplateContent toContent() {
    return new TemplateContent(structure, questions);
  }

  /** All slots in document order. */
  public List<TemplateSlot> slots() {
    List<TemplateSlot> slots = new ArrayList<>();
    for (TemplateSection section : structure) {
      slots.addAll(section.slots());
    }
    return slots;
  }

  public Optional<TemplateSlot> findSlot(String slotId) {
    return slots().stream().filter(s -> slotId != null && slotId.equals(s.slotId())).findFirst();
  }

  /** Every clause referenced by any slot, primary or alternative, in document order. */
  public Set<UUID> referencedClauseIds() {
    Set<UUID> ids = new LinkedHashSet<>();
    for (TemplateSlot slot : slots()) {
      ids.addAll(slot.offeredClauseIds());
    }
    return ids;
  }

  private void assign(TemplateContent content) {
    this.structure = new ArrayList<>(content.structure());
    this.questions = new ArrayList<>(content.questions());
  }

  public List<TemplateSection> getStructure() {
    return List.copyOf(structure);
  }

  public List<TemplateQuestion> getQuestions() {
    return List.copyOf(questions);
  }
}
