package io.b2mash.precioustime.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        createProblem(
            resourceType + " not found",
            "No " + resourceType.toLowerCase() + " found with id " + id),
        null);
    getBody().setProperty("resourceType", resourceType);
    getBody().setProperty("resourceId", String.valueOf(id));
  }

  private ResourceNotFoundException(String title, String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(title, detail), null);
  }

  public static ResourceNotFoundException noActiveEntry() {
    return new ResourceNotFoundException("No active entry", "No time entry is currently running");
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
