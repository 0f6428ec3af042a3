package io.b2mash.b2b.contractassembly.exception;

import io.b2mash.b2b.contractassembly.content.ImportReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a bulk import has at least one invalid item. Nothing is written. */
public class ContentImportRejectedException extends ErrorResponseException {

  private final ImportReport report;

  public ContentImportRejectedException(ImportReport report) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(report), null);
    this.report = report;
  }

  public ImportReport getReport() {
    return report;
  }

  private static ProblemDetail createProblem(ImportReport report) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Import rejected");
    problem.setDetail(
        report.errors().size() + " item(s) failed validation; nothing was imported");
    problem.setProperty("summary", report.summary());
    problem.setProperty("items", report.items());
    return problem;
  }
}
