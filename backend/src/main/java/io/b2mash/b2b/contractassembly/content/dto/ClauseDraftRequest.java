package io.b2mash.b2b.contractassembly.content.dto;

import io.b2mash.b2b.contractassembly.content.ClauseContent;
import io.b2mash.b2b.contractassembly.rule.Rule;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/** Body of create-draft and update-draft for clauses. Shape is checked by the service. */
public record ClauseDraftRequest(
    String content,
    Map<String, Object> parameters,
    List<Rule> rules,
    LocalDate validFrom,
    LocalDate validUntil) {

  public ClauseContent toContent() {
    return new ClauseContent(content, parameters, rules, validFrom, validUntil);
  }
}
