package io.b2mash.b2b.contractassembly.content;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum LegalImpact {
  @JsonProperty("breaking")
  BREAKING,
  @JsonProperty("minor")
  MINOR,
  @JsonProperty("none")
  NONE
}
