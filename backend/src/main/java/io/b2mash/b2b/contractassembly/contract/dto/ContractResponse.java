package io.b2mash.b2b.contractassembly.contract.dto;

import io.b2mash.b2b.contractassembly.contract.ContractInstance;
import io.b2mash.b2b.contractassembly.contract.ContractStatus;
import io.b2mash.b2b.contractassembly.validation.ValidationMessage;
import io.b2mash.b2b.contractassembly.validation.ValidationState;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ContractResponse(
    UUID id,
    String title,
    String clientReference,
    List<String> tags,
    UUID creatorId,
    UUID templateId,
    UUID templateVersionId,
    List<UUID> clauseVersionIds,
    String jurisdiction,
    Map<String, Object> answers,
    Map<String, UUID> selectedSlots,
    ValidationState validationState,
    List<ValidationMessage> validationMessages,
    ContractStatus status,
    Instant completedAt,
    Instant createdAt,
    Instant updatedAt) {

  public static ContractResponse from(ContractInstance contract) {
    return new ContractResponse(
        contract.getId(),
        contract.getTitle(),
        contract.getClientReference(),
        contract.getTags(),
        contract.getCreatorId(),
        contract.getTemplateId(),
        contract.getTemplateVersionId(),
        contract.getClauseVersionIds(),
        contract.getJurisdiction(),
        contract.getAnswers(),
        contract.getSelectedSlots(),
        contract.getValidationState(),
        contract.getValidationMessages(),
        contract.getStatus(),
        contract.getCompletedAt(),
        contract.getCreatedAt(),
        contract.getUpdatedAt());
  }
}
