package io.b2mash.b2b.contractassembly.exception;

import io.b2mash.b2b.contractassembly.content.GateResult;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a version fails one or more blocking publishing gates. Carries every failed check,
 * not only the first. Results in HTTP 422 Unprocessable Entity.
 */
public class GateViolationException extends ErrorResponseException {

  private final List<GateResult> failedGates;

  public GateViolationException(List<GateResult> failedGates) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(failedGates), null);
    this.failedGates = List.copyOf(failedGates);
  }

  public List<GateResult> getFailedGates() {
    return failedGates;
  }

  private static ProblemDetail createProblem(List<GateResult> failedGates) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Publishing gates failed");
    problem.setDetail(
        failedGates.size()
            + " publishing gate(s) failed: "
            + String.join(", ", failedGates.stream().map(GateResult::gate).toList()));
    problem.setProperty("gates", failedGates);
    return problem;
  }
}
