package io.b2mash.precioustime.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Input that cannot be interpreted, such as an unparseable timestamp or a missing CSV column. */
public class ValidationFailureException extends ErrorResponseException {

  private final String rejectedValue;

  public ValidationFailureException(String title, String detail) {
    this(title, detail, null);
  }

  public ValidationFailureException(String title, String detail, String rejectedValue) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, rejectedValue), null);
    this.rejectedValue = rejectedValue;
  }

  public String getRejectedValue() {
    return rejectedValue;
  }

  @Override
  public String getMessage() {
    return getBody().getTitle() + ": " + getBody().getDetail();
  }

  private static ProblemDetail createProblem(String title, String detail, String rejectedValue) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (rejectedValue != null) {
      problem.setProperty("rejectedValue", rejectedValue);
    }
    return problem;
  }
}
