package io.b2mash.b2b.contractassembly.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.b2mash.b2b.contractassembly.rule.RuleSeverity;
import io.b2mash.b2b.contractassembly.rule.RuleType;
import java.util.List;
import java.util.UUID;

/**
 * One rule violation found by the {@link RuleValidationEngine}.
 *
 * @param ruleId {@code <versionId>:<ruleIndex>} of the violated rule
 * @param ruleType type of the violated rule
 * @param severity hard violations block completion
 * @param sourceClauseId clause declaring the rule
 * @param sourceVersionId clause version declaring the rule
 * @param targetClauseIds clauses involved on the other side; empty for scope and answer rules
 * @param questionId interview question for {@code requires_answer}; null otherwise
 * @param message human-readable description
 * @param suggestion optional hint from the rule author
 * @param resolutionOptions fixes derived from the rule type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationMessage(
    String ruleId,
    RuleType ruleType,
    RuleSeverity severity,
    UUID sourceClauseId,
    UUID sourceVersionId,
    List<UUID> targetClauseIds,
    String questionId,
    String message,
    String suggestion,
    List<ResolutionOption> resolutionOptions) {

  public ValidationMessage {
    targetClauseIds = targetClauseIds == null ? List.of() : List.copyOf(targetClauseIds);
    resolutionOptions = resolutionOptions == null ? List.of() : List.copyOf(resolutionOptions);
  }

  @JsonIgnore
  public boolean isHard() {
    return severity == RuleSeverity.HARD;
  }
}
