package io.b2mash.b2b.contractassembly.content;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A position in a template that holds one clause.
 *
 * @param slotId identifier unique within the template version
 * @param clauseId primary clause (logical entity) offered for the slot
 * @param type required, optional or alternative
 * @param alternativeClauseIds further clauses the user may choose instead of the primary one
 */
public record TemplateSlot(
    String slotId, UUID clauseId, SlotType type, List<UUID> alternativeClauseIds) {

  public TemplateSlot {
    type = type == null ? SlotType.REQUIRED : type;
    alternativeClauseIds =
        alternativeClauseIds == null ? List.of() : List.copyOf(alternativeClauseIds);
  }

  /** Primary clause first, then the alternatives in declared order. */
  public List<UUID> offeredClauseIds() {
    List<UUID> offered = new ArrayList<>();
    if (clauseId != null) {
      offered.add(clauseId);
    }
    for (UUID alternative : alternativeClauseIds) {
      if (!offered.contains(alternative)) {
        offered.add(alternative);
      }
    }
    return offered;
  }
}
