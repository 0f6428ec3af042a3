package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.rule.Rule;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Editable payload of a clause draft. */
public record ClauseContent(
    String content,
    Map<String, Object> parameters,
    List<Rule> rules,
    LocalDate validFrom,
    LocalDate validUntil) {

  public ClauseContent {
    parameters =
        parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    rules = rules == null ? List.of() : List.copyOf(rules);
  }
}
