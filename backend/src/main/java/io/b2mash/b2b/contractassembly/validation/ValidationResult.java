package io.b2mash.b2b.contractassembly.validation;

import io.b2mash.b2b.contractassembly.rule.RuleSeverity;
import java.util.List;

public record ValidationResult(ValidationState validationState, List<ValidationMessage> messages) {

  public ValidationResult {
    messages = List.copyOf(messages);
  }

  /** Classifies the messages: any hard means conflicts, any other means warnings. */
  public static ValidationResult of(List<ValidationMessage> messages) {
    ValidationState state;
    if (messages.stream().anyMatch(m -> m.severity() == RuleSeverity.HARD)) {
      state = ValidationState.HAS_CONFLICTS;
    } else if (!messages.isEmpty()) {
      state = ValidationState.HAS_WARNINGS;
    } else {
      state = ValidationState.VALID;
    }
    return new ValidationResult(state, messages);
  }

  public boolean hasConflicts() {
    return validationState == ValidationState.HAS_CONFLICTS;
  }
}
