package io.b2mash.b2b.contractassembly.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown to the loser of two concurrent publications of the same logical entity. */
public class ConcurrentPublishException extends ErrorResponseException {

  public ConcurrentPublishException(String entityType, UUID entityId, Throwable cause) {
    super(HttpStatus.CONFLICT, createProblem(entityType, entityId), cause);
  }

  private static ProblemDetail createProblem(String entityType, UUID entityId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent publish");
    problem.setDetail(
        "Another version of "
            + entityType
            + " "
            + entityId
            + " was published concurrently. Reload and retry against the current state.");
    problem.setProperty("entityId", entityId);
    return problem;
  }
}
