package io.b2mash.b2b.contractassembly.rule;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.UUID;

/**
 * A dependency, conflict, scope or answer rule embedded in a clause version. Immutable once the
 * owning version leaves draft.
 *
 * <p>Every variant may carry an activation {@link #condition()}: while the interview answers do not
 * satisfy it the rule is inactive. Severity defaults to {@link RuleSeverity#HARD} when omitted.
 *
 * <p>Stored and exchanged as JSON with a {@code type} discriminator. An unknown discriminator is
 * rejected by the JSON reader.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = Rule.Requires.class, name = "requires"),
  @JsonSubTypes.Type(value = Rule.Forbids.class, name = "forbids"),
  @JsonSubTypes.Type(value = Rule.IncompatibleWith.class, name = "incompatible_with"),
  @JsonSubTypes.Type(value = Rule.ScopedTo.class, name = "scoped_to"),
  @JsonSubTypes.Type(value = Rule.RequiresAnswer.class, name = "requires_answer")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface Rule
    permits Rule.TargetedRule, Rule.ScopedTo, Rule.RequiresAnswer {

  RuleType type();

  RuleSeverity severity();

  Condition condition();

  String message();

  String suggestion();

  <R> R accept(RuleVisitor<R> visitor);

  /** Rules whose targets are clause (logical entity) ids. */
  sealed interface TargetedRule extends Rule permits Requires, Forbids, IncompatibleWith {
    List<UUID> targets();
  }

  /** Violated when none of the targets is selected. */
  record Requires(
      List<UUID> targets,
      RuleSeverity severity,
      Condition condition,
      String message,
      String suggestion)
      implements TargetedRule {

    public Requires {
      targets = targets == null ? List.of() : List.copyOf(targets);
      severity = severity == null ? RuleSeverity.HARD : severity;
    }

    @Override
    public RuleType type() {
      return RuleType.REQUIRES;
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
      return visitor.visitRequires(this);
    }
  }

  /** Violated when any target is selected. Directed: only the owning clause reports it. */
  record Forbids(
      List<UUID> targets,
      RuleSeverity severity,
      Condition condition,
      String message,
      String suggestion)
      implements TargetedRule {

    public Forbids {
      targets = targets == null ? List.of() : List.copyOf(targets);
      severity = severity == null ? RuleSeverity.HARD : severity;
    }

    @Override
    public RuleType type() {
      return RuleType.FORBIDS;
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
      return visitor.visitForbids(this);
    }
  }

  /** Symmetric conflict: declared on one side, indexed on both. */
  record IncompatibleWith(
      List<UUID> targets,
      RuleSeverity severity,
      Condition condition,
      String message,
      String suggestion)
      implements TargetedRule {

    public IncompatibleWith {
      targets = targets == null ? List.of() : List.copyOf(targets);
      severity = severity == null ? RuleSeverity.HARD : severity;
    }

    @Override
    public RuleType type() {
      return RuleType.INCOMPATIBLE_WITH;
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
      return visitor.visitIncompatibleWith(this);
    }
  }

  /** Violated when the contract jurisdiction is not one of {@code jurisdictions}. */
  record ScopedTo(
      List<String> jurisdictions,
      RuleSeverity severity,
      Condition condition,
      String message,
      String suggestion)
      implements Rule {

    public ScopedTo {
      jurisdictions = jurisdictions == null ? List.of() : List.copyOf(jurisdictions);
      severity = severity == null ? RuleSeverity.HARD : severity;
    }

    @Override
    public RuleType type() {
      return RuleType.SCOPED_TO;
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
      return visitor.visitScopedTo(this);
    }
  }

  /** Violated when the answers do not satisfy {@code requirement}; unanswered counts as unmet. */
  record RequiresAnswer(
      Condition requirement,
      RuleSeverity severity,
      Condition condition,
      String message,
      String suggestion)
      implements Rule {

    public RequiresAnswer {
      severity = severity == null ? RuleSeverity.HARD : severity;
    }

    @Override
    public RuleType type() {
      return RuleType.REQUIRES_ANSWER;
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
      return visitor.visitRequiresAnswer(this);
    }
  }
}
