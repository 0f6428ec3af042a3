package io.b2mash.b2b.contractassembly.contract.dto;

import io.b2mash.b2b.contractassembly.content.dto.ClauseVersionResponse;
import io.b2mash.b2b.contractassembly.content.dto.TemplateVersionResponse;
import io.b2mash.b2b.contractassembly.contract.PinnedContent;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record PinnedContentResponse(
    UUID contractId,
    TemplateVersionResponse templateVersion,
    List<ClauseVersionResponse> clauseVersions,
    Map<String, UUID> selectedSlots,
    Map<String, Object> answers) {

  public static PinnedContentResponse from(PinnedContent content) {
    return new PinnedContentResponse(
        content.contractId(),
        TemplateVersionResponse.from(content.templateVersion()),
        content.clauseVersions().stream().map(ClauseVersionResponse::from).toList(),
        content.selectedSlots(),
        content.answers());
  }
}
