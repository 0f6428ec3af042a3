package io.b2mash.b2b.contractassembly.content;

/**
 * Outcome of one publishing gate check.
 *
 * @param gate stable check name, e.g. {@code REQUIRES_ACYCLIC}
 * @param passed whether the check passed
 * @param message explanation; names the offending items when the check failed
 * @param severity whether a failure blocks submission
 */
public record GateResult(String gate, boolean passed, String message, GateSeverity severity) {

  public static GateResult pass(String gate) {
    return new GateResult(gate, true, null, GateSeverity.ERROR);
  }

  public static GateResult fail(String gate, String message) {
    return new GateResult(gate, false, message, GateSeverity.ERROR);
  }

  public static GateResult check(String gate, boolean passed, String failureMessage) {
    return passed ? pass(gate) : fail(gate, failureMessage);
  }

  public static GateResult warnUnless(String gate, boolean passed, String warning) {
    return new GateResult(gate, passed, passed ? null : warning, GateSeverity.WARNING);
  }

  public boolean isBlocking() {
    return !passed && severity == GateSeverity.ERROR;
  }

  public boolean isWarning() {
    return !passed && severity == GateSeverity.WARNING;
  }
}
