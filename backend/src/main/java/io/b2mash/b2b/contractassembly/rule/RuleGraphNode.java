package io.b2mash.b2b.contractassembly.rule;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** One clause version in a rule graph, with the rules it declares in insertion order. */
public record RuleGraphNode(UUID versionId, UUID entityId, List<Rule> rules) {

  public RuleGraphNode {
    Objects.requireNonNull(versionId, "versionId");
    Objects.requireNonNull(entityId, "entityId");
    rules = rules == null ? List.of() : List.copyOf(rules);
  }
}
