package io.b2mash.b2b.contractassembly.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class NoPublishedVersionException extends ErrorResponseException {

  public NoPublishedVersionException(String entityType, UUID entityId) {
    super(HttpStatus.CONFLICT, createProblem(entityType, entityId), null);
  }

  private static ProblemDetail createProblem(String entityType, UUID entityId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("No published version");
    problem.setDetail(entityType + " " + entityId + " has no published version");
    problem.setProperty("entityId", entityId);
    return problem;
  }
}
