package io.b2mash.b2b.contractassembly.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a lifecycle transition is requested in the wrong status or by the wrong actor. The
 * detail always states the violated precondition. Results in HTTP 409 Conflict.
 */
public class LifecycleException extends ErrorResponseException {

  private final String currentStatus;

  public LifecycleException(String title, String detail, String currentStatus) {
    super(HttpStatus.CONFLICT, createProblem(title, detail, currentStatus), null);
    this.currentStatus = currentStatus;
  }

  public LifecycleException(String title, String detail) {
    this(title, detail, null);
  }

  public String getCurrentStatus() {
    return currentStatus;
  }

  private static ProblemDetail createProblem(String title, String detail, String currentStatus) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (currentStatus != null) {
      problem.setProperty("currentStatus", currentStatus);
    }
    return problem;
  }
}
