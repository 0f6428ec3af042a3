package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.rule.Condition;
import io.b2mash.b2b.contractassembly.rule.ConditionOperator;
import io.b2mash.b2b.contractassembly.rule.Rule;
import io.b2mash.b2b.contractassembly.rule.RuleVisitor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Basic shape checks for draft content. Returns every problem found so the author can fix them in
 * one pass; an empty list means the shape is acceptable.
 */
public final class ContentShapeValidator {

  private ContentShapeValidator() {}

  public static List<String> clauseProblems(ClauseContent content) {
    List<String> problems = new ArrayList<>();
    if (content.content() == null || content.content().isBlank()) {
      problems.add("content must not be blank");
    }
    problems.addAll(ruleProblems(content.rules()));
    return problems;
  }

  public static List<String> ruleProblems(List<Rule> rules) {
    List<String> problems = new ArrayList<>();
    for (int i = 0; i < rules.size(); i++) {
      Rule rule = rules.get(i);
      String prefix = "rule[" + i + "] (" + rule.type().wireName() + ")";
      problems.addAll(rule.accept(new RuleShapeCheck(prefix)));
      if (rule.condition() != null) {
        problems.addAll(conditionProblems(rule.condition(), prefix + " condition"));
      }
    }
    return problems;
  }

  public static List<String> templateProblems(TemplateContent content) {
    List<String> problems = new ArrayList<>();
    for (int s = 0; s < content.structure().size(); s++) {
      TemplateSection section = content.structure().get(s);
      if (section.title() == null || section.title().isBlank()) {
        problems.add("section[" + s + "] must have a title");
      }
      for (int i = 0; i < section.slots().size(); i++) {
        TemplateSlot slot = section.slots().get(i);
        String prefix = "section[" + s + "].slot[" + i + "]";
        if (slot.slotId() == null || slot.slotId().isBlank()) {
          problems.add(prefix + " must have a slotId");
        }
        if (slot.clauseId() == null) {
          problems.add(prefix + " must reference a clause");
        }
        if (slot.type() == SlotType.ALTERNATIVE && slot.alternativeClauseIds().isEmpty()) {
          problems.add(prefix + " is an alternative slot without alternatives");
        }
      }
    }
    Set<String> questionIds = new HashSet<>();
    for (int q = 0; q < content.questions().size(); q++) {
      TemplateQuestion question = content.questions().get(q);
      if (question.questionId() == null || question.questionId().isBlank()) {
        problems.add("question[" + q + "] must have a questionId");
      } else if (!questionIds.add(question.questionId())) {
        problems.add("question[" + q + "] duplicates questionId '" + question.questionId() + "'");
      }
    }
    return problems;
  }

  static List<String> conditionProblems(Condition condition, String prefix) {
    List<String> problems = new ArrayList<>();
    if (condition.questionId() == null || condition.questionId().isBlank()) {
      problems.add(prefix + " must name a question");
    }
    if (condition.operator() == null) {
      problems.add(prefix + " must have an operator");
    } else if (condition.operator() == ConditionOperator.IN
        && !(condition.value() instanceof Collection<?>)) {
      problems.add(prefix + " with operator 'in' needs a list value");
    }
    if (condition.value() == null) {
      problems.add(prefix + " must have a value");
    }
    return problems;
  }

  private static final class RuleShapeCheck implements RuleVisitor<List<String>> {

    private final String prefix;

    private RuleShapeCheck(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public List<String> visitRequires(Rule.Requires rule) {
      return targets(rule.targets().isEmpty());
    }

    @Override
    public List<String> visitForbids(Rule.Forbids rule) {
      return targets(rule.targets().isEmpty());
    }

    @Override
    public List<String> visitIncompatibleWith(Rule.IncompatibleWith rule) {
      return targets(rule.targets().isEmpty());
    }

    @Override
    public List<String> visitScopedTo(Rule.ScopedTo rule) {
      if (rule.jurisdictions().isEmpty()
          || rule.jurisdictions().stream().anyMatch(j -> j == null || j.isBlank())) {
        return List.of(prefix + " must list at least one jurisdiction and no blank entries");
      }
      return List.of();
    }

    @Override
    public List<String> visitRequiresAnswer(Rule.RequiresAnswer rule) {
      if (rule.requirement() == null) {
        return List.of(prefix + " must define the required answer");
      }
      return conditionProblems(rule.requirement(), prefix + " requirement");
    }

    private List<String> targets(boolean empty) {
      return empty ? List.of(prefix + " must name at least one target clause") : List.of();
    }
  }
}
