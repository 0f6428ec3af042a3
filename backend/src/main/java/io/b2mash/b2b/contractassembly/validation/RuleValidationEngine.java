package io.b2mash.b2b.contractassembly.validation;

import io.b2mash.b2b.contractassembly.exception.InvalidRuleException;
import io.b2mash.b2b.contractassembly.rule.ConditionEvaluator;
import io.b2mash.b2b.contractassembly.rule.IncompatibleEdge;
import io.b2mash.b2b.contractassembly.rule.Rule;
import io.b2mash.b2b.contractassembly.rule.RuleGraph;
import io.b2mash.b2b.contractassembly.rule.RuleGraphNode;
import io.b2mash.b2b.contractassembly.rule.RuleSeverity;
import io.b2mash.b2b.contractassembly.rule.RuleType;
import io.b2mash.b2b.contractassembly.rule.RuleVisitor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates the rules of a clause selection against interview answers and a jurisdiction.
 *
 * <p>Runs four phases to completion and never stops at the first violation:
 *
 * <ol>
 *   <li>scope: {@code scoped_to} and {@code requires_answer}
 *   <li>dependency: {@code requires}
 *   <li>conflict: {@code forbids} and {@code incompatible_with}
 *   <li>aggregation: one message per incompatible pair, then classification
 * </ol>
 *
 * <p>Selected versions are visited in version-id order and rules in their declared order, so
 * identical input always yields identical output. Inconsistent content is a normal result, not an
 * error; only a selection that references versions missing from the graph is rejected.
 *
 * <p>Holds no state; one instance may serve concurrent evaluations.
 */
@Component
public class RuleValidationEngine {

  private static final Logger log = LoggerFactory.getLogger(RuleValidationEngine.class);

  private static final Comparator<UUID> ID_ORDER = Comparator.comparing(UUID::toString);

  public ValidationResult evaluate(
      Collection<UUID> selectedVersionIds,
      Map<String, Object> answers,
      String jurisdiction,
      RuleGraph graph) {
    List<RuleGraphNode> selected = resolveSelection(selectedVersionIds, graph);
    Set<UUID> selectedEntities = new HashSet<>();
    for (RuleGraphNode node : selected) {
      selectedEntities.add(node.entityId());
    }
    Map<String, Object> safeAnswers = answers != null ? answers : Map.of();

    List<ValidationMessage> messages = new ArrayList<>();
    for (Phase phase : List.of(Phase.SCOPE, Phase.DEPENDENCY, Phase.CONFLICT)) {
      for (RuleGraphNode node : selected) {
        var checker = new Checker(node, selectedEntities, safeAnswers, jurisdiction);
        List<Rule> rules = node.rules();
        for (int i = 0; i < rules.size(); i++) {
          Rule rule = rules.get(i);
          if (rule.accept(PHASE_OF) == phase && isActive(rule, safeAnswers)) {
            checker.ruleIndex = i;
            messages.addAll(rule.accept(checker));
          }
        }
      }
      if (phase == Phase.CONFLICT) {
        messages.addAll(incompatiblePairs(graph, selected, selectedEntities, safeAnswers));
      }
    }

    ValidationResult result = ValidationResult.of(messages);
    log.debug(
        "Evaluated {} clause version(s): state={}, messages={}",
        selected.size(),
        result.validationState(),
        messages.size());
    return result;
  }

  private static List<RuleGraphNode> resolveSelection(
      Collection<UUID> selectedVersionIds, RuleGraph graph) {
    List<UUID> ordered =
        selectedVersionIds.stream().distinct().sorted(ID_ORDER).collect(Collectors.toList());
    List<RuleGraphNode> nodes = new ArrayList<>(ordered.size());
    for (UUID versionId : ordered) {
      nodes.add(
          graph
              .resolveVersion(versionId)
              .orElseThrow(
                  () ->
                      new InvalidRuleException(
                          "Selected clause version " + versionId + " is not in the rule graph")));
    }
    return nodes;
  }

  private static boolean isActive(Rule rule, Map<String, Object> answers) {
    return rule.condition() == null || ConditionEvaluator.isSatisfied(rule.condition(), answers);
  }

  /**
   * Walks the symmetric index from every selected clause and keeps one message per unordered pair.
   * A hard rule replaces a soft one for the same pair in place.
   */
  private static List<ValidationMessage> incompatiblePairs(
      RuleGraph graph,
      List<RuleGraphNode> selected,
      Set<UUID> selectedEntities,
      Map<String, Object> answers) {
    Map<String, ValidationMessage> byPair = new LinkedHashMap<>();
    for (RuleGraphNode node : selected) {
      for (IncompatibleEdge edge : graph.incompatibleWith(node.entityId())) {
        UUID other = edge.other(node.entityId());
        if (other.equals(node.entityId())
            || !selectedEntities.contains(other)
            || !selectedEntities.contains(edge.sourceEntityId())
            || !isActive(edge.rule(), answers)) {
          continue;
        }
        String key = pairKey(edge.sourceEntityId(), edge.targetEntityId());
        ValidationMessage existing = byPair.get(key);
        boolean upgradesSeverity =
            existing != null && !existing.isHard() && edge.rule().severity() == RuleSeverity.HARD;
        if (existing == null || upgradesSeverity) {
          byPair.put(key, incompatibleMessage(edge));
        }
      }
    }
    return new ArrayList<>(byPair.values());
  }

  private static String pairKey(UUID a, UUID b) {
    return ID_ORDER.compare(a, b) <= 0 ? a + "|" + b : b + "|" + a;
  }

  private static ValidationMessage incompatibleMessage(IncompatibleEdge edge) {
    Rule.IncompatibleWith rule = edge.rule();
    String text =
        rule.message() != null
            ? rule.message()
            : "Clause "
                + edge.sourceEntityId()
                + " is incompatible with clause "
                + edge.targetEntityId();
    return new ValidationMessage(
        ruleId(edge.sourceVersionId(), edge.ruleIndex()),
        RuleType.INCOMPATIBLE_WITH,
        rule.severity(),
        edge.sourceEntityId(),
        edge.sourceVersionId(),
        List.of(edge.targetEntityId()),
        null,
        text,
        rule.suggestion(),
        ResolutionOption.forRuleType(RuleType.INCOMPATIBLE_WITH));
  }

  private static String ruleId(UUID versionId, int ruleIndex) {
    return versionId + ":" + ruleIndex;
  }

  private enum Phase {
    SCOPE,
    DEPENDENCY,
    CONFLICT
  }

  private static final RuleVisitor<Phase> PHASE_OF =
      new RuleVisitor<>() {
        @Override
        public Phase visitRequires(Rule.Requires rule) {
          return Phase.DEPENDENCY;
        }

        @Override
        public Phase visitForbids(Rule.Forbids rule) {
          return Phase.CONFLICT;
        }

        @Override
        public Phase visitIncompatibleWith(Rule.IncompatibleWith rule) {
          return Phase.CONFLICT;
        }

        @Override
        public Phase visitScopedTo(Rule.ScopedTo rule) {
          return Phase.SCOPE;
        }

        @Override
        public Phase visitRequiresAnswer(Rule.RequiresAnswer rule) {
          return Phase.SCOPE;
        }
      };

  /** Checks one active rule of one selected version. */
  private static final class Checker implements RuleVisitor<List<ValidationMessage>> {

    private final RuleGraphNode node;
    private final Set<UUID> selectedEntities;
    private final Map<String, Object> answers;
    private final String jurisdiction;
    private int ruleIndex;

    private Checker(
        RuleGraphNode node,
        Set<UUID> selectedEntities,
        Map<String, Object> answers,
        String jurisdiction) {
      this.node = node;
      this.selectedEntities = selectedEntities;
      this.answers = answers;
      this.jurisdiction = jurisdiction;
    }

    @Override
    public List<ValidationMessage> visitRequires(Rule.Requires rule) {
      if (rule.targets().stream().anyMatch(selectedEntities::contains)) {
        return List.of();
      }
      String text =
          rule.message() != null
              ? rule.message()
              : "Clause " + node.entityId() + " requires one of " + rule.targets();
      return List.of(violation(rule, rule.targets(), null, text));
    }

    @Override
    public List<ValidationMessage> visitForbids(Rule.Forbids rule) {
      List<UUID> present =
          rule.targets().stream()
              .filter(t -> !t.equals(node.entityId()) && selectedEntities.contains(t))
              .toList();
      if (present.isEmpty()) {
        return List.of();
      }
      String text =
          rule.message() != null
              ? rule.message()
              : "Clause " + node.entityId() + " forbids " + present;
      return List.of(violation(rule, present, null, text));
    }

    @Override
    public List<ValidationMessage> visitIncompatibleWith(Rule.IncompatibleWith rule) {
      // reported once per pair through the symmetric index
      return List.of();
    }

    @Override
    public List<ValidationMessage> visitScopedTo(Rule.ScopedTo rule) {
      boolean inScope =
          jurisdiction != null
              && rule.jurisdictions().stream().anyMatch(j -> j.equalsIgnoreCase(jurisdiction));
      if (inScope) {
        return List.of();
      }
      String text =
          rule.message() != null
              ? rule.message()
              : "Clause "
                  + node.entityId()
                  + " is only valid in "
                  + rule.jurisdictions()
                  + ", contract jurisdiction is "
                  + jurisdiction;
      return List.of(violation(rule, List.of(), null, text));
    }

    @Override
    public List<ValidationMessage> visitRequiresAnswer(Rule.RequiresAnswer rule) {
      if (rule.requirement() != null
          && ConditionEvaluator.isSatisfied(rule.requirement(), answers)) {
        return List.of();
      }
      String questionId = rule.requirement() != null ? rule.requirement().questionId() : null;
      String text =
          rule.message() != null
              ? rule.message()
              : "Answer to question '" + questionId + "' does not meet the clause's requirement";
      return List.of(violation(rule, List.of(), questionId, text));
    }

    private ValidationMessage violation(
        Rule rule, List<UUID> targets, String questionId, String text) {
      return new ValidationMessage(
          ruleId(node.versionId(), ruleIndex),
          rule.type(),
          rule.severity(),
          node.entityId(),
          node.versionId(),
          targets,
          questionId,
          text,
          rule.suggestion(),
          ResolutionOption.forRuleType(rule.type()));
    }
  }
}
