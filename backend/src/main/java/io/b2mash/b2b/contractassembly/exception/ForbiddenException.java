package io.b2mash.b2b.contractassembly.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The acting role may not perform the operation. Carries the role that would be required. */
public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String requiredRole, String action) {
    super(HttpStatus.FORBIDDEN, createProblem(requiredRole, action), null);
  }

  private static ProblemDetail createProblem(String requiredRole, String action) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Insufficient permissions");
    problem.setDetail("Role '" + requiredRole + "' is required to " + action);
    problem.setProperty("requiredRole", requiredRole);
    return problem;
  }
}
