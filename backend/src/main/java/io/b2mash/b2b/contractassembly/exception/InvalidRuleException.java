package io.b2mash.b2b.contractassembly.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Malformed rule-engine input: an unknown rule type or a reference that cannot be resolved. */
public class InvalidRuleException extends ErrorResponseException {

  public InvalidRuleException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Malformed rule input");
    problem.setDetail(detail);
    return problem;
  }
}
