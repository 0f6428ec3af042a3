package io.b2mash.b2b.contractassembly.rule;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ConditionOperator {
  @JsonProperty("equals")
  EQUALS,
  @JsonProperty("not_equals")
  NOT_EQUALS,
  @JsonProperty("greater_than")
  GREATER_THAN,
  @JsonProperty("less_than")
  LESS_THAN,
  @JsonProperty("contains")
  CONTAINS,
  @JsonProperty("in")
  IN
}
