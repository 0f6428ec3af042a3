package io.b2mash.b2b.contractassembly.content.dto;

import io.b2mash.b2b.contractassembly.content.SlotType;
import io.b2mash.b2b.contractassembly.content.TemplateQuestion;
import io.b2mash.b2b.contractassembly.rule.Condition;
import io.b2mash.b2b.contractassembly.rule.RuleSeverity;
import io.b2mash.b2b.contractassembly.rule.RuleType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Bulk import of clauses and templates. Clauses and template slots refer to other clauses by
 * title, so a single payload can carry a clause library together with the templates using it.
 */
public record ContentImportRequest(
    List<@Valid ClauseDefinition> clauses, List<@Valid TemplateDefinition> templates) {

  public ContentImportRequest {
    clauses = clauses == null ? List.of() : List.copyOf(clauses);
    templates = templates == null ? List.of() : List.copyOf(templates);
  }

  public record ClauseDefinition(
      @NotBlank(message = "clause title is required")
          @Size(max = 300, message = "clause title must not exceed 300 characters")
          String title,
      @NotBlank(message = "clause jurisdiction is required")
          @Size(min = 2, max = 10, message = "jurisdiction must be 2 to 10 characters")
          String jurisdiction,
      @Size(max = 100, message = "legalArea must not exceed 100 characters") String legalArea,
      List<String> tags,
      @NotEmpty(message = "a clause needs at least one version")
          List<@Valid VersionDefinition> versions) {}

  /** One clause version; every imported version becomes a DRAFT. */
  public record VersionDefinition(
      String content,
      Map<String, Object> parameters,
      List<RuleDefinition> rules,
      LocalDate validFrom,
      LocalDate validUntil) {

    public VersionDefinition {
      rules = rules == null ? List.of() : List.copyOf(rules);
    }
  }

  /** A rule whose clause targets are given by title instead of id. */
  public record RuleDefinition(
      RuleType type,
      List<String> targetClauseTitles,
      List<String> jurisdictions,
      Condition requirement,
      RuleSeverity severity,
      Condition condition,
      String message,
      String suggestion) {

    public RuleDefinition {
      targetClauseTitles = targetClauseTitles == null ? List.of() : List.copyOf(targetClauseTitles);
    }
  }

  public record TemplateDefinition(
      @NotBlank(message = "template title is required")
          @Size(max = 300, message = "template title must not exceed 300 characters")
          String title,
      @Size(max = 2000, message = "description must not exceed 2000 characters")
          String description,
      @Size(max = 100, message = "category must not exceed 100 characters") String category,
      @NotBlank(message = "template jurisdiction is required")
          @Size(min = 2, max = 10, message = "jurisdiction must be 2 to 10 characters")
          String jurisdiction,
      @Size(max = 100, message = "legalArea must not exceed 100 characters") String legalArea,
      List<String> tags,
      @NotEmpty(message = "a template needs at least one section")
          List<@Valid SectionDefinition> sections,
      List<TemplateQuestion> questions) {

    public TemplateDefinition {
      questions = questions == null ? List.of() : List.copyOf(questions);
    }
  }

  public record SectionDefinition(
      String title,
      @NotEmpty(message = "a section needs at least one slot") List<SlotDefinition> slots) {}

  /** A slot; {@code slotId} is derived from its position when absent. */
  public record SlotDefinition(
      String slotId, String clauseTitle, SlotType type, List<String> alternativeClauseTitles) {

    public SlotDefinition {
      alternativeClauseTitles =
          alternativeClauseTitles == null ? List.of() : List.copyOf(alternativeClauseTitles);
    }
  }
}
