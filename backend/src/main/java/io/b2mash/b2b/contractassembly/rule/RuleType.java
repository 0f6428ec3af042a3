package io.b2mash.b2b.contractassembly.rule;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RuleType {
  REQUIRES("requires"),
  FORBIDS("forbids"),
  INCOMPATIBLE_WITH("incompatible_with"),
  SCOPED_TO("scoped_to"),
  REQUIRES_ANSWER("requires_answer");

  private final String wireName;

  RuleType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
