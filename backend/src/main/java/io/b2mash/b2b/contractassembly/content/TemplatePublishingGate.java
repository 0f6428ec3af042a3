package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.rule.Rule;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Publishing gate for template versions. Runs every check and never stops at the first failure. */
@Component
public class TemplatePublishingGate implements PublishingGate<Template, TemplateVersion> {

  private static final Logger log = LoggerFactory.getLogger(TemplatePublishingGate.class);

  static final String STRUCTURE_HAS_SECTION = "STRUCTURE_HAS_SECTION";
  static final String SLOTS_RESOLVABLE = "SLOTS_RESOLVABLE";
  static final String REQUIRED_SLOTS_PUBLISHED = "REQUIRED_SLOTS_PUBLISHED";
  static final String NO_DUPLICATE_SLOTS = "NO_DUPLICATE_SLOTS";
  static final String HAS_REQUIRED_SLOT = "HAS_REQUIRED_SLOT";
  static final String JURISDICTION_SET = "JURISDICTION_SET";
  static final String QUESTIONS_DEFINED = "QUESTIONS_DEFINED";

  private final ClauseRepository clauseRepository;
  private final ClauseVersionRepository clauseVersionRepository;

  public TemplatePublishingGate(
      ClauseRepository clauseRepository, ClauseVersionRepository clauseVersionRepository) {
    this.clauseRepository = clauseRepository;
    this.clauseVersionRepository = clauseVersionRepository;
  }

  @Override
  public GateReport evaluate(Template template, TemplateVersion version) {
    List<GateResult> results = new ArrayList<>();
    List<TemplateSlot> slots = version.slots();
    Map<UUID, Clause> clauses = loadClauses(version.referencedClauseIds());

    results.add(
        GateResult.check(
            STRUCTURE_HAS_SECTION,
            !version.getStructure().isEmpty(),
            "Template must have at least one section"));

    Set<UUID> missing = new LinkedHashSet<>(version.referencedClauseIds());
    missing.removeAll(clauses.keySet());
    results.add(
        GateResult.check(
            SLOTS_RESOLVABLE, missing.isEmpty(), "Slots reference unknown clauses: " + missing));

    List<String> unpublished =
        slots.stream()
            .filter(slot -> slot.type().mustBeFilled())
            .filter(
                slot -> {
                  Clause clause = clauses.get(slot.clauseId());
                  return clause == null || !clause.hasPublishedVersion();
                })
            .map(TemplateSlot::slotId)
            .toList();
    results.add(
        GateResult.check(
            REQUIRED_SLOTS_PUBLISHED,
            unpublished.isEmpty(),
            "Required slots reference clauses without a published version: " + unpublished));

    Set<String> seen = new HashSet<>();
    Set<String> duplicates = new LinkedHashSet<>();
    for (TemplateSlot slot : slots) {
      if (!seen.add(slot.slotId())) {
        duplicates.add(slot.slotId());
      }
    }
    results.add(
        GateResult.check(
            NO_DUPLICATE_SLOTS, duplicates.isEmpty(), "Duplicate slot ids: " + duplicates));

    results.add(
        GateResult.check(
            HAS_REQUIRED_SLOT,
            slots.stream().anyMatch(slot -> slot.type() == SlotType.REQUIRED),
            "Template must have at least one required slot"));

    results.add(
        GateResult.check(
            JURISDICTION_SET,
            ClausePublishingGate.isJurisdictionSet(template.getJurisdiction()),
            "Template must have a jurisdiction of at least two characters"));

    Set<String> undefined = undefinedQuestions(version, clauses.values());
    results.add(
        GateResult.warnUnless(
            QUESTIONS_DEFINED,
            undefined.isEmpty(),
            "Clause rules ask about questions the template does not define: " + undefined));

    var report = new GateReport(version.getId(), results);
    log.debug(
        "Template gate for version {}: passed={}, failures={}",
        version.getId(),
        report.passed(),
        report.failures().size());
    return report;
  }

  private Map<UUID, Clause> loadClauses(Set<UUID> ids) {
    if (ids.isEmpty()) {
      return Map.of();
    }
    Map<UUID, Clause> byId = new HashMap<>();
    clauseRepository.findAllById(ids).forEach(c -> byId.put(c.getId(), c));
    return byId;
  }

  /** Question ids used by rules of the referenced clauses' published versions but not defined. */
  private Set<String> undefinedQuestions(TemplateVersion version, Iterable<Clause> clauses) {
    Set<UUID> publishedIds = new HashSet<>();
    clauses.forEach(
        c -> {
          if (c.hasPublishedVersion()) {
            publishedIds.add(c.getCurrentPublishedVersionId());
          }
        });
    if (publishedIds.isEmpty()) {
      return Set.of();
    }
    Set<String> defined =
        version.getQuestions().stream()
            .map(TemplateQuestion::questionId)
            .collect(Collectors.toSet());
    Set<String> undefined = new LinkedHashSet<>();
    for (ClauseVersion clauseVersion : clauseVersionRepository.findByIdIn(publishedIds)) {
      for (Rule rule : clauseVersion.getRules()) {
        if (rule.condition() != null) {
          undefined.add(rule.condition().questionId());
        }
        if (rule instanceof Rule.RequiresAnswer requiresAnswer
            && requiresAnswer.requirement() != null) {
          undefined.add(requiresAnswer.requirement().questionId());
        }
      }
    }
    undefined.removeIf(q -> q == null || defined.contains(q));
    return undefined;
  }
}
