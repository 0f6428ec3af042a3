package io.b2mash.b2b.contractassembly.exception;

import io.b2mash.b2b.contractassembly.audit.AuditEventBuilder;
import io.b2mash.b2b.contractassembly.audit.AuditService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /** Prefix raised by the database triggers guarding frozen rows. */
  static final String IMMUTABLE_MARKER = "IMMUTABLE:";

  private final AuditService auditService;

  public GlobalExceptionHandler(AuditService auditService) {
    this.auditService = auditService;
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    String reason = ex.getBody().getDetail();
    log.warn(
        "Forbidden: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        reason);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("security.access_denied")
            .entityType("security")
            .entityId(UUID.randomUUID())
            .details(
                Map.of(
                    "path", request.getRequestURI(),
                    "method", request.getMethod(),
                    "reason", reason != null ? reason : "forbidden"))
            .build());

    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Resource was modified concurrently. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleIntegrityViolation(
      DataIntegrityViolationException ex) {
    String message = ex.getMostSpecificCause().getMessage();
    if (message != null && message.contains(IMMUTABLE_MARKER)) {
      log.warn("Storage rejected mutation of frozen data: {}", message);
      var immutability =
          new ImmutabilityViolationException(
              "Frozen data cannot be modified",
              message.substring(message.indexOf(IMMUTABLE_MARKER) + IMMUTABLE_MARKER.length())
                  .trim());
      return ResponseEntity.status(HttpStatus.CONFLICT).body(immutability.getBody());
    }
    log.warn("Data integrity violation: {}", message);
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Data integrity violation");
    problem.setDetail("The change conflicts with existing data. Reload and retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler({
    DataAccessResourceFailureException.class,
    TransientDataAccessResourceException.class,
    CannotCreateTransactionException.class,
    QueryTimeoutException.class,
    TransactionTimedOutException.class
  })
  public ResponseEntity<ProblemDetail> handleStorageUnavailable(Exception ex) {
    log.error("Storage unavailable after retries: {}", ex.getMessage());
    var infrastructure = new InfrastructureException(ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(infrastructure.getBody());
  }
}
