package io.b2mash.b2b.contractassembly.content;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ChangeType {
  @JsonProperty("content")
  CONTENT,
  @JsonProperty("legal")
  LEGAL,
  @JsonProperty("editorial")
  EDITORIAL,
  @JsonProperty("structure")
  STRUCTURE
}
