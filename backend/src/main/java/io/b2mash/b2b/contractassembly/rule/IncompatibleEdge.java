package io.b2mash.b2b.contractassembly.rule;

import java.util.UUID;

/**
 * One {@code incompatible_with} rule target, indexed under both of its endpoints.
 *
 * @param sourceVersionId version declaring the rule
 * @param sourceEntityId clause owning the declaring version
 * @param ruleIndex position of the rule in the declaring version's rule list
 * @param targetEntityId clause named as incompatible
 * @param rule the declaring rule
 */
public record IncompatibleEdge(
    UUID sourceVersionId,
    UUID sourceEntityId,
    int ruleIndex,
    UUID targetEntityId,
    Rule.IncompatibleWith rule) {

  /** Returns the endpoint opposite to {@code entityId}. */
  public UUID other(UUID entityId) {
    return sourceEntityId.equals(entityId) ? targetEntityId : sourceEntityId;
  }
}
