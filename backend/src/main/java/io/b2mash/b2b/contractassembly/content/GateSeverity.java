package io.b2mash.b2b.contractassembly.content;

/** ERROR gates block submission; WARNING gates are reported only. */
public enum GateSeverity {
  ERROR,
  WARNING
}
