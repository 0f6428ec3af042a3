package io.b2mash.b2b.contractassembly.content;

import java.util.List;
import java.util.UUID;

/** Every gate result for one version. All gates always run. */
public record GateReport(UUID versionId, List<GateResult> results) {

  public GateReport {
    results = List.copyOf(results);
  }

  public boolean passed() {
    return results.stream().noneMatch(GateResult::isBlocking);
  }

  public List<GateResult> failures() {
    return results.stream().filter(GateResult::isBlocking).toList();
  }

  public List<GateResult> warnings() {
    return results.stream().filter(GateResult::isWarning).toList();
  }
}
