package io.b2mash.b2b.contractassembly.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown on any attempt to change frozen data: content of a non-draft version or the pins of a
 * completed contract. Never recovered from by applying the change.
 */
public class ImmutabilityViolationException extends ErrorResponseException {

  public ImmutabilityViolationException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
