package io.b2mash.b2b.contractassembly.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.b2b.contractassembly.rule.RuleType;
import java.util.List;

/** Machine-readable fix a user can apply to resolve a violation. */
public enum ResolutionOption {
  @JsonProperty("add_clause")
  ADD_CLAUSE,
  @JsonProperty("remove_clause")
  REMOVE_CLAUSE,
  @JsonProperty("replace_clause")
  REPLACE_CLAUSE;

  /** Options offered for a violation of the given rule type. */
  public static List<ResolutionOption> forRuleType(RuleType type) {
    return switch (type) {
      case REQUIRES -> List.of(ADD_CLAUSE);
      case FORBIDS, INCOMPATIBLE_WITH, SCOPED_TO -> List.of(REMOVE_CLAUSE, REPLACE_CLAUSE);
      case REQUIRES_ANSWER -> List.of(REMOVE_CLAUSE);
    };
  }
}
