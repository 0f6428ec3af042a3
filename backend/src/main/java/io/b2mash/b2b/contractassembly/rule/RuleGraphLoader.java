package io.b2mash.b2b.contractassembly.rule;

import io.b2mash.b2b.contractassembly.content.ClauseVersion;
import io.b2mash.b2b.contractassembly.content.ClauseVersionRepository;
import io.b2mash.b2b.contractassembly.content.VersionStatus;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Builds {@link RuleGraph} snapshots from stored clause versions. */
@Component
public class RuleGraphLoader {

  private static final Logger log = LoggerFactory.getLogger(RuleGraphLoader.class);

  private final ClauseVersionRepository clauseVersionRepository;

  public RuleGraphLoader(ClauseVersionRepository clauseVersionRepository) {
    this.clauseVersionRepository = clauseVersionRepository;
  }

  /**
   * Loads the rules of exactly the given versions, typically the pins of a contract. Ids that do
   * not exist are left out of the graph.
   */
  @Transactional(readOnly = true)
  public RuleGraph forVersions(Collection<UUID> versionIds) {
    if (versionIds.isEmpty()) {
      return RuleGraph.empty();
    }
    List<RuleGraphNode> nodes =
        clauseVersionRepository.findByIdIn(versionIds).stream()
            .sorted(Comparator.comparing(v -> v.getId().toString()))
            .map(ClauseVersion::toRuleGraphNode)
            .toList();
    return RuleGraph.of(nodes);
  }

  /**
   * Loads every published clause version of the publisher, with the candidate standing in for its
   * entity's published version. Used to check that publishing the candidate keeps the graph sound.
   */
  @Transactional(readOnly = true)
  public RuleGraph forPublishedClauses(String tenantId, RuleGraphNode candidate) {
    List<RuleGraphNode> nodes = new ArrayList<>();
    clauseVersionRepository.findByTenantIdAndStatus(tenantId, VersionStatus.PUBLISHED).stream()
        .filter(v -> !v.getEntityId().equals(candidate.entityId()))
        .sorted(Comparator.comparing(v -> v.getEntityId().toString()))
        .map(ClauseVersion::toRuleGraphNode)
        .forEach(nodes::add);
    nodes.add(candidate);
    log.debug(
        "Built publish-time rule graph for tenant {} with {} clause(s)", tenantId, nodes.size());
    return RuleGraph.of(nodes);
  }
}
