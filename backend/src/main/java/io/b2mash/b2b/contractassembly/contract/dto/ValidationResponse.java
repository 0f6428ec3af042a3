package io.b2mash.b2b.contractassembly.contract.dto;

import io.b2mash.b2b.contractassembly.validation.ValidationMessage;
import io.b2mash.b2b.contractassembly.validation.ValidationResult;
import io.b2mash.b2b.contractassembly.validation.ValidationState;
import java.util.List;

public record ValidationResponse(
    ValidationState validationState, List<ValidationMessage> messages) {

  public static ValidationResponse from(ValidationResult result) {
    return new ValidationResponse(result.validationState(), result.messages());
  }
}
