package io.b2mash.b2b.contractassembly.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ValidationState {
  @JsonProperty("valid")
  VALID,
  @JsonProperty("has_warnings")
  HAS_WARNINGS,
  @JsonProperty("has_conflicts")
  HAS_CONFLICTS
}
