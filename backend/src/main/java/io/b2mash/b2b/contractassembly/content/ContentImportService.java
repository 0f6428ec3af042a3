package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.config.RetryOnStorageFault;
import io.b2mash.b2b.contractassembly.content.ImportReport.Item;
import io.b2mash.b2b.contractassembly.content.ImportReport.Kind;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.ClauseDefinition;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.RuleDefinition;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.SectionDefinition;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.SlotDefinition;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.TemplateDefinition;
import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest.VersionDefinition;
import io.b2mash.b2b.contractassembly.exception.ContentImportRejectedException;
import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import io.b2mash.b2b.contractassembly.rule.Rule;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Imports a batch of clauses and templates into the calling publisher's library in one
 * transaction. Every imported version is a DRAFT authored by the caller.
 *
 * <p>The whole batch is checked before anything is written. Items whose title already exists in
 * the library are skipped; any invalid item rejects the batch.
 */
@Service
public class ContentImportService {

  private static final Logger log = LoggerFactory.getLogger(ContentImportService.class);

  private final ClauseRepository clauseRepository;
  private final TemplateRepository templateRepository;
  private final ClauseLifecycleService clauseService;
  private final TemplateLifecycleService templateService;

  public ContentImportService(
      ClauseRepository clauseRepository,
      TemplateRepository templateRepository,
      ClauseLifecycleService clauseService,
      TemplateLifecycleService templateService) {
    this.clauseRepository = clauseRepository;
    this.templateRepository = templateRepository;
    this.clauseService = clauseService;
    this.templateService = templateService;
  }

  /**
   * @throws ContentImportRejectedException if any item is invalid; the report lists every item
   */
  @Transactional
  @RetryOnStorageFault
  public ImportReport importContent(ContentImportRequest request) {
    String tenantId = RequestScopes.requireTenantId();
    UUID authorId = RequestScopes.requireActorId();

    Map<String, UUID> clauseIds = new HashMap<>();
    clauseRepository
        .findByTenantIdOrderByTitleAsc(tenantId)
        .forEach(clause -> clauseIds.putIfAbsent(clause.getTitle(), clause.getId()));
    Set<String> templateTitles = new HashSet<>();
    templateRepository
        .findByTenantIdOrderByTitleAsc(tenantId)
        .forEach(template -> templateTitles.add(template.getTitle()));

    List<Item> items = new ArrayList<>();
    List<ClauseDefinition> newClauses = planClauses(request.clauses(), clauseIds, items);
    Map<String, UUID> provisionalIds = new HashMap<>(clauseIds);
    newClauses.forEach(clause -> provisionalIds.put(clause.title(), provisionalId(clause)));
    checkClauses(newClauses, provisionalIds, items);
    List<TemplateDefinition> newTemplates =
        planTemplates(request.templates(), templateTitles, provisionalIds, items);

    int questionsSkipped =
        request.templates().stream()
            .filter(template -> templateTitles.contains(template.title()))
            .mapToInt(template -> template.questions().size())
            .sum();
    int questionsCreated =
        newTemplates.stream().mapToInt(template -> template.questions().size()).sum();

    var checked = ImportReport.of(items, questionsCreated, questionsSkipped);
    if (checked.hasErrors()) {
      log.warn(
          "Import for tenant {} rejected: {} invalid item(s)", tenantId, checked.errors().size());
      throw new ContentImportRejectedException(checked);
    }

    Map<String, Item> created = new LinkedHashMap<>();
    for (ClauseDefinition definition : newClauses) {
      var clause =
          clauseService.createClause(
              definition.title(),
              definition.jurisdiction(),
              definition.legalArea(),
              definition.tags());
      clauseIds.put(clause.getTitle(), clause.getId());
      created.put(
          Kind.CLAUSE + ":" + clause.getTitle(),
          Item.created(Kind.CLAUSE, clause.getTitle(), clause.getId()));
    }
    for (ClauseDefinition definition : newClauses) {
      UUID clauseId = clauseIds.get(definition.title());
      for (VersionDefinition version : definition.versions()) {
        clauseService.createDraft(
            clauseId, toClauseContent(version, clauseIds, new ArrayList<>()), authorId);
      }
    }
    for (TemplateDefinition definition : newTemplates) {
      var template =
          templateService.createTemplate(
              definition.title(),
              definition.jurisdiction(),
              definition.legalArea(),
              definition.tags(),
              definition.description(),
              definition.category());
      templateService.createDraft(
          template.getId(), toTemplateContent(definition, clauseIds, new ArrayList<>()), authorId);
      created.put(
          Kind.TEMPLATE + ":" + template.getTitle(),
          Item.created(Kind.TEMPLATE, template.getTitle(), template.getId()));
    }

    List<Item> reported = new ArrayList<>();
    for (Item item : items) {
      String key = item.kind() + ":" + item.title();
      reported.add(item.status() == ImportReport.Status.CREATED ? created.get(key) : item);
    }
    var report = ImportReport.of(reported, questionsCreated, questionsSkipped);
    log.info(
        "Imported {} clause(s) and {} template(s) for tenant {}, skipped {} existing item(s)",
        report.summary().clauses().created(),
        report.summary().templates().created(),
        tenantId,
        report.summary().clauses().skipped() + report.summary().templates().skipped());
    return report;
  }

  // --- Planning ---

  private List<ClauseDefinition> planClauses(
      List<ClauseDefinition> definitions, Map<String, UUID> existing, List<Item> items) {
    List<ClauseDefinition> planned = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (ClauseDefinition definition : definitions) {
      String title = definition.title();
      if (!seen.add(title)) {
        items.add(Item.error(Kind.CLAUSE, title, "Title appears more than once in the import"));
      } else if (existing.containsKey(title)) {
        items.add(
            Item.skipped(Kind.CLAUSE, title, "A clause with this title already exists"));
      } else {
        planned.add(definition);
      }
    }
    return planned;
  }

  /** Adds one item per planned clause, an error if any of its versions is malformed. */
  private void checkClauses(
      List<ClauseDefinition> planned, Map<String, UUID> clauseIds, List<Item> items) {
    for (ClauseDefinition definition : planned) {
      List<String> problems = new ArrayList<>();
      for (int v = 0; v < definition.versions().size(); v++) {
        List<String> versionProblems = new ArrayList<>();
        var content = toClauseContent(definition.versions().get(v), clauseIds, versionProblems);
        versionProblems.addAll(ContentShapeValidator.clauseProblems(content));
        for (String problem : versionProblems) {
          problems.add("version[" + v + "] " + problem);
        }
      }
      items.add(
          problems.isEmpty()
              ? Item.created(Kind.CLAUSE, definition.title(), null)
              : Item.error(Kind.CLAUSE, definition.title(), String.join("; ", problems)));
    }
  }

  private List<TemplateDefinition> planTemplates(
      List<TemplateDefinition> definitions,
      Set<String> existingTitles,
      Map<String, UUID> clauseIds,
      List<Item> items) {
    List<TemplateDefinition> planned = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (TemplateDefinition definition : definitions) {
      String title = definition.title();
      if (!seen.add(title)) {
        items.add(Item.error(Kind.TEMPLATE, title, "Title appears more than once in the import"));
        continue;
      }
      if (existingTitles.contains(title)) {
        items.add(
            Item.skipped(Kind.TEMPLATE, title, "A template with this title already exists"));
        continue;
      }
      List<String> problems = new ArrayList<>();
      var content = toTemplateContent(definition, clauseIds, problems);
      problems.addAll(ContentShapeValidator.templateProblems(content));
      if (problems.isEmpty()) {
        items.add(Item.created(Kind.TEMPLATE, title, null));
        planned.add(definition);
      } else {
        items.add(Item.error(Kind.TEMPLATE, title, String.join("; ", problems)));
      }
    }
    return planned;
  }

  /** Stands in for the id of a clause that is not stored yet while the batch is checked. */
  private static UUID provisionalId(ClauseDefinition clause) {
    return UUID.nameUUIDFromBytes(clause.title().getBytes(StandardCharsets.UTF_8));
  }

  // --- Conversion ---

  private static ClauseContent toClauseContent(
      VersionDefinition version, Map<String, UUID> clauseIds, List<String> problems) {
    List<Rule> rules = new ArrayList<>();
    for (int i = 0; i < version.rules().size(); i++) {
      Rule rule = toRule(version.rules().get(i), clauseIds, "rule[" + i + "]", problems);
      if (rule != null) {
        rules.add(rule);
      }
    }
    return new ClauseContent(
        version.content(),
        version.parameters(),
        rules,
        version.validFrom(),
        version.validUntil());
  }

  private static Rule toRule(
      RuleDefinition definition,
      Map<String, UUID> clauseIds,
      String prefix,
      List<String> problems) {
    if (definition.type() == null) {
      problems.add(prefix + " must have a type");
      return null;
    }
    List<UUID> targets =
        resolve(definition.targetClauseTitles(), clauseIds, prefix + " target", problems);
    return switch (definition.type()) {
      case REQUIRES ->
          new Rule.Requires(
              targets,
              definition.severity(),
              definition.condition(),
              definition.message(),
              definition.suggestion());
      case FORBIDS ->
          new Rule.Forbids(
              targets,
              definition.severity(),
              definition.condition(),
              definition.message(),
              definition.suggestion());
      case INCOMPATIBLE_WITH ->
          new Rule.IncompatibleWith(
              targets,
              definition.severity(),
              definition.condition(),
              definition.message(),
              definition.suggestion());
      case SCOPED_TO ->
          new Rule.ScopedTo(
              definition.jurisdictions(),
              definition.severity(),
              definition.condition(),
              definition.message(),
              definition.suggestion());
      case REQUIRES_ANSWER ->
          new Rule.RequiresAnswer(
              definition.requirement(),
              definition.severity(),
              definition.condition(),
              definition.message(),
              definition.suggestion());
    };
  }

  private static TemplateContent toTemplateContent(
      TemplateDefinition definition, Map<String, UUID> clauseIds, List<String> problems) {
    List<TemplateSection> sections = new ArrayList<>();
    int position = 0;
    for (int s = 0; s < definition.sections().size(); s++) {
      SectionDefinition section = definition.sections().get(s);
      List<TemplateSlot> slots = new ArrayList<>();
      for (int i = 0; i < section.slots().size(); i++) {
        SlotDefinition slot = section.slots().get(i);
        position++;
        String prefix = "section[" + s + "].slot[" + i + "]";
        UUID clauseId = null;
        if (slot.clauseTitle() == null || slot.clauseTitle().isBlank()) {
          problems.add(prefix + " must name a clause");
        } else {
          clauseId =
              resolve(List.of(slot.clauseTitle()), clauseIds, prefix, problems).stream()
                  .findFirst()
                  .orElse(null);
        }
        List<UUID> alternatives =
            resolve(slot.alternativeClauseTitles(), clauseIds, prefix + " alternative", problems);
        String slotId =
            slot.slotId() == null || slot.slotId().isBlank() ? "slot-" + position : slot.slotId();
        slots.add(new TemplateSlot(slotId, clauseId, slot.type(), alternatives));
      }
      sections.add(new TemplateSection(section.title(), slots));
    }
    return new TemplateContent(sections, definition.questions());
  }

  private static List<UUID> resolve(
      List<String> titles, Map<String, UUID> clauseIds, String prefix, List<String> problems) {
    List<UUID> ids = new ArrayList<>();
    for (String title : titles) {
      UUID id = clauseIds.get(title);
      if (id == null) {
        problems.add(
            prefix
                + " refers to unknown clause '"
                + title
                + "'; it must be in the import or already exist");
      } else {
        ids.add(id);
      }
    }
    return ids;
  }
}
