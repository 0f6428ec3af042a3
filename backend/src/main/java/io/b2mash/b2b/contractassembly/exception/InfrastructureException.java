package io.b2mash.b2b.contractassembly.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Storage was unavailable or timed out after the persistence-boundary retries were exhausted. */
public class InfrastructureException extends ErrorResponseException {

  public InfrastructureException(Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(), cause);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Storage unavailable");
    problem.setDetail("The content store is temporarily unavailable. Please retry.");
    problem.setProperty("transient", true);
    return problem;
  }
}
