package io.bms.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A lease or invoice that does not exist within the requested organization. Entities of other
 * organizations are reported the same way.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(HttpStatus.NOT_FOUND, notFound(resourceType, id), null);
  }

  private static ProblemDetail notFound(String resourceType, Object id) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail("No " + resourceType.toLowerCase() + " found with id " + id);
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("resourceId", String.valueOf(id));
    return problem;
  }
}
