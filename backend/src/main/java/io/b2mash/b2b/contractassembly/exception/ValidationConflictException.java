package io.b2mash.b2b.contractassembly.exception;

import io.b2mash.b2b.contractassembly.validation.ValidationMessage;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a contract with hard rule violations is asked to complete. The messages carry the
 * resolution options the user can pick from. Results in HTTP 422 Unprocessable Entity.
 */
public class ValidationConflictException extends ErrorResponseException {

  private final List<ValidationMessage> messages;

  public ValidationConflictException(List<ValidationMessage> messages) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(messages), null);
    this.messages = List.copyOf(messages);
  }

  public List<ValidationMessage> getMessages() {
    return messages;
  }

  private static ProblemDetail createProblem(List<ValidationMessage> messages) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Unresolved rule conflicts");
    problem.setDetail("Contract has hard rule violations that must be resolved before completion");
    problem.setProperty("messages", messages);
    return problem;
  }
}
