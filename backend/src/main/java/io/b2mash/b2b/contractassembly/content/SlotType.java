package io.b2mash.b2b.contractassembly.content;

import com.fasterxml.jackson.annotation.JsonProperty;

/** How a template slot participates in an assembled contract. */
public enum SlotType {
  @JsonProperty("required")
  REQUIRED,
  @JsonProperty("optional")
  OPTIONAL,
  /** The user picks the primary clause or one of its alternatives; a choice is mandatory. */
  @JsonProperty("alternative")
  ALTERNATIVE;

  public boolean mustBeFilled() {
    return this != OPTIONAL;
  }
}
