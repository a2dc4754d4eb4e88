package io.b2mash.precioustime.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps persistence failures to problem responses. {@code ErrorResponseException} subclasses (not
 * found, validation, conflict) are rendered by the base class from their own problem body.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ConcurrencyFailureException.class)
  public ResponseEntity<ProblemDetail> handleConcurrencyFailure(
      ConcurrencyFailureException ex, HttpServletRequest request) {
    log.warn(
        "Concurrent write rejected: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("The store was modified concurrently. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleIntegrityViolation(
      DataIntegrityViolationException ex, HttpServletRequest request) {
    log.warn(
        "Integrity violation: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getMostSpecificCause().getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Constraint violation");
    problem.setDetail("The change conflicts with existing data");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ProblemDetail> handlePersistenceFailure(
      DataAccessException ex, HttpServletRequest request) {
    log.error(
        "Persistence failure: path={}, method={}",
        request.getRequestURI(),
        request.getMethod(),
        ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Persistence failure");
    problem.setDetail("The operation could not be completed and was rolled back");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }
}
