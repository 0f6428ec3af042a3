package io.b2mash.b2b.contractassembly.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when draft content fails basic shape checks. Lists every problem found. */
public class ContentValidationException extends ErrorResponseException {

  private final List<String> problems;

  public ContentValidationException(List<String> problems) {
    super(HttpStatus.BAD_REQUEST, createProblem(problems), null);
    this.problems = List.copyOf(problems);
  }

  public List<String> getProblems() {
    return problems;
  }

  private static ProblemDetail createProblem(List<String> problems) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid content");
    problem.setDetail(String.join("; ", problems));
    problem.setProperty("problems", problems);
    return problem;
  }
}
