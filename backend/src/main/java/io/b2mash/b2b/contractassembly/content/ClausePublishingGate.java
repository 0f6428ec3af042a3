package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.config.ContractAssemblyProperties;
import io.b2mash.b2b.contractassembly.rule.Rule;
import io.b2mash.b2b.contractassembly.rule.RuleGraph;
import io.b2mash.b2b.contractassembly.rule.RuleGraphLoader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Publishing gate for clause versions. Runs every check and never stops at the first failure.
 *
 * <p>{@code REQUIRES_ACYCLIC} builds the graph of all currently published clauses of the publisher
 * with the candidate substituted for its clause, so a cycle is caught when its last edge is
 * introduced. The same check runs again at approval.
 */
@Component
public class ClausePublishingGate implements PublishingGate<Clause, ClauseVersion> {

  private static final Logger log = LoggerFactory.getLogger(ClausePublishingGate.class);

  static final String CONTENT_NOT_EMPTY = "CONTENT_NOT_EMPTY";
  static final String RULES_PRESENT = "RULES_PRESENT";
  static final String RULES_WELL_FORMED = "RULES_WELL_FORMED";
  static final String TARGETS_RESOLVABLE = "TARGETS_RESOLVABLE";
  static final String REQUIRES_ACYCLIC = "REQUIRES_ACYCLIC";
  static final String VALIDITY_WINDOW = "VALIDITY_WINDOW";
  static final String JURISDICTION_SET = "JURISDICTION_SET";
  static final String CHANGELOG_PRESENT = "CHANGELOG_PRESENT";

  private final ClauseRepository clauseRepository;
  private final RuleGraphLoader ruleGraphLoader;
  private final ContractAssemblyProperties properties;

  public ClausePublishingGate(
      ClauseRepository clauseRepository,
      RuleGraphLoader ruleGraphLoader,
      ContractAssemblyProperties properties) {
    this.clauseRepository = clauseRepository;
    this.ruleGraphLoader = ruleGraphLoader;
    this.properties = properties;
  }

  @Override
  public GateReport evaluate(Clause clause, ClauseVersion version) {
    List<GateResult> results = new ArrayList<>();
    List<Rule> rules = version.getRules();

    results.add(
        GateResult.check(
            CONTENT_NOT_EMPTY,
            version.getContent() != null && !version.getContent().isBlank(),
            "Clause content is empty"));

    results.add(
        GateResult.check(
            RULES_PRESENT, !rules.isEmpty(), "Clause version must declare at least one rule"));

    List<String> ruleProblems = ContentShapeValidator.ruleProblems(rules);
    results.add(
        GateResult.check(
            RULES_WELL_FORMED, ruleProblems.isEmpty(), String.join("; ", ruleProblems)));

    Set<UUID> missing = unresolvableTargets(rules);
    results.add(
        GateResult.check(
            TARGETS_RESOLVABLE,
            missing.isEmpty(),
            "Rules reference clauses that do not exist: " + missing));

    results.add(requiresAcyclic(clause, version));

    results.add(
        GateResult.check(
            VALIDITY_WINDOW,
            version.getValidFrom() == null
                || version.getValidUntil() == null
                || version.getValidFrom().isBefore(version.getValidUntil()),
            "validFrom must be before validUntil"));

    results.add(
        GateResult.check(
            JURISDICTION_SET,
            isJurisdictionSet(clause.getJurisdiction()),
            "Clause must have a jurisdiction of at least two characters"));

    boolean hasChangelog = version.getVersionNumber() == 1 || !version.getChangelog().isEmpty();
    String changelogMessage = "Version " + version.getVersionNumber() + " has no changelog entry";
    results.add(
        properties.publishing().requireChangelog()
            ? GateResult.check(CHANGELOG_PRESENT, hasChangelog, changelogMessage)
            : GateResult.warnUnless(CHANGELOG_PRESENT, hasChangelog, changelogMessage));

    var report = new GateReport(version.getId(), results);
    log.debug(
        "Clause gate for version {}: passed={}, failures={}",
        version.getId(),
        report.passed(),
        report.failures().size());
    return report;
  }

  /**
   * Two versions that require each other can both pass review while neither is published, so the
   * cycle check is repeated against the graph as it stands when the version goes live.
   */
  @Override
  public GateReport evaluateAtPublish(Clause clause, ClauseVersion version) {
    GateResult acyclic = requiresAcyclic(clause, version);
    if (!acyclic.passed()) {
      log.info("Approval of clause version {} blocked: {}", version.getId(), acyclic.message());
    }
    return new GateReport(version.getId(), List.of(acyclic));
  }

  static boolean isJurisdictionSet(String jurisdiction) {
    return jurisdiction != null && jurisdiction.trim().length() >= 2;
  }

  private Set<UUID> unresolvableTargets(List<Rule> rules) {
    Set<UUID> targets = new LinkedHashSet<>();
    for (Rule rule : rules) {
      if (rule instanceof Rule.TargetedRule targeted) {
        targets.addAll(targeted.targets());
      }
    }
    if (targets.isEmpty()) {
      return Set.of();
    }
    Set<UUID> found = new HashSet<>();
    clauseRepository.findAllById(targets).forEach(c -> found.add(c.getId()));
    targets.removeAll(found);
    return targets;
  }

  private GateResult requiresAcyclic(Clause clause, ClauseVersion version) {
    List<List<UUID>> cycles = cyclesThrough(clause, version);
    return GateResult.check(
        REQUIRES_ACYCLIC,
        cycles.isEmpty(),
        "Publishing would introduce requires cycle(s): "
            + cycles.stream().map(ClausePublishingGate::describeCycle).toList());
  }

  private List<List<UUID>> cyclesThrough(Clause clause, ClauseVersion version) {
    RuleGraph graph =
        ruleGraphLoader.forPublishedClauses(clause.getTenantId(), version.toRuleGraphNode());
    return graph.findCycles().stream().filter(cycle -> cycle.contains(clause.getId())).toList();
  }

  private static String describeCycle(List<UUID> cycle) {
    return cycle.stream().map(UUID::toString).collect(Collectors.joining(" -> "))
        + " -> "
        + cycle.get(0);
  }
}
