package io.b2mash.b2b.contractassembly.contract;

import io.b2mash.b2b.contractassembly.content.ClauseVersion;
import io.b2mash.b2b.contractassembly.content.TemplateVersion;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Frozen content of a completed contract, as handed to the export pipeline. Resolved by version id,
 * so it stays readable after the publisher deprecates or evolves the content.
 *
 * @param contractId the completed contract
 * @param templateVersion pinned template version
 * @param clauseVersions pinned clause versions in pin order
 * @param selectedSlots slot id to chosen clause version id
 * @param answers interview answers at completion
 */
public record PinnedContent(
    UUID contractId,
    TemplateVersion templateVersion,
    List<ClauseVersion> clauseVersions,
    Map<String, UUID> selectedSlots,
    Map<String, Object> answers) {}
