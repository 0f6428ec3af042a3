package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.rule.Rule;
import io.b2mash.b2b.contractassembly.rule.RuleGraphNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** A version of a clause: its text, fill-in parameters and the rules it declares. */
@Entity
@Table(name = "clause_versions")
public class ClauseVersion extends ContentVersion {

  @Column(name = "content", nullable = false, columnDefinition = "TEXT")
  private String content;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "parameters", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> parameters = new HashMap<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "rules", nullable = false, columnDefinition = "jsonb")
  private List<Rule> rules = new ArrayList<>();

  @Column(name = "valid_from")
  private LocalDate validFrom;

  @Column(name = "valid_until")
  private LocalDate validUntil;

  /** JPA-required no-arg constructor. */
  protected ClauseVersion() {}

  public ClauseVersion(Clause clause, int versionNumber, UUID authorId, ClauseContent content) {
    this(clause.getId(), clause.getTenantId(), versionNumber, authorId, null, content);
  }

  private ClauseVersion(
      UUID entityId,
      String tenantId,
      int versionNumber,
      UUID authorId,
      UUID derivedFromVersionId,
      ClauseContent content) {
    super(entityId, tenantId, versionNumber, authorId, derivedFromVersionId);
    assign(content);
  }

  /**
   * Creates the draft that replaces a rejected version: same author, same content, next number.
   */
  public static ClauseVersion reworkOf(ClauseVersion rejected, int versionNumber) {
    var copy =
        new ClauseVersion(
            rejected.getEntityId(),
            rejected.getTenantId(),
            versionNumber,
            rejected.getAuthorId(),
            rejected.getId(),
            rejected.toContent());
    copy.inheritChangelog(rejected.getChangelog());
    return copy;
  }

  /** Replaces the draft's content. */
  public void updateContent(ClauseContent content) {
    requireEditable("edit");
    assign(content);
  }

  public ClauseContent toContent() {
    return new ClauseContent(content, parameters, rules, validFrom, validUntil);
  }

  public RuleGraphNode toRuleGraphNode() {
    return new RuleGraphNode(getId(), getEntityId(), rules);
  }

  private void assign(ClauseContent content) {
    this.content = content.content();
    this.parameters = new HashMap<>(content.parameters());
    this.rules = new ArrayList<>(content.rules());
    this.validFrom = content.validFrom();
    this.validUntil = content.validUntil();
  }

  public String getContent() {
    return content;
  }

  public Map<String, Object> getParameters() {
    return Collections.unmodifiableMap(parameters);
  }

  public List<Rule> getRules() {
    return List.copyOf(rules);
  }

  public LocalDate getValidFrom() {
    return validFrom;
  }

  public LocalDate getValidUntil() {
    return validUntil;
  }
}
