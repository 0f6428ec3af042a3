package io.b2mash.b2b.contractassembly.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class MissingTenantContextException extends ErrorResponseException {

  public MissingTenantContextException() {
    this("Request was not bound to a tenant by the isolation layer");
  }

  public MissingTenantContextException(String detail) {
    super(HttpStatus.UNAUTHORIZED, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Missing tenant context");
    problem.setDetail(detail);
    return problem;
  }
}
