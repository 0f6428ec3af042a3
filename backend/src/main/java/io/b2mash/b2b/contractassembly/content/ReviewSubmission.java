package io.b2mash.b2b.contractassembly.content;

import java.util.List;

/** A version that entered review, with the non-blocking gate warnings it carried. */
public record ReviewSubmission<V extends ContentVersion>(V version, List<GateResult> warnings) {

  public ReviewSubmission {
    warnings = List.copyOf(warnings);
  }
}
