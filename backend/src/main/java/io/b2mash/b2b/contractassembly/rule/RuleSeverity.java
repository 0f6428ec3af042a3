package io.b2mash.b2b.contractassembly.rule;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Whether a violated rule blocks completion (hard) or only warns (soft). */
public enum RuleSeverity {
  @JsonProperty("hard")
  HARD,
  @JsonProperty("soft")
  SOFT
}
