package io.b2mash.b2b.contractassembly.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a contract write loses an optimistic-lock race against a concurrent request. */
public class ConcurrentContractModificationException extends ErrorResponseException {

  /**
   * @param operation the write that lost the race, e.g. {@code upgrade} or {@code complete}
   */
  public ConcurrentContractModificationException(
      UUID contractId, String operation, Throwable cause) {
    super(HttpStatus.CONFLICT, createProblem(contractId, operation), cause);
  }

  private static ProblemDetail createProblem(UUID contractId, String operation) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent contract modification");
    problem.setDetail(
        "Could not "
            + operation
            + " contract "
            + contractId
            + " because it was modified concurrently. Reload and retry.");
    problem.setProperty("contractId", contractId);
    problem.setProperty("operation", operation);
    return problem;
  }
}
