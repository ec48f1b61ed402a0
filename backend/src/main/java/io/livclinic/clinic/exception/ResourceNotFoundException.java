package io.livclinic.clinic.exception;

import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A patient or procedure addressed by id does not exist (or was deleted). Rendered as 404. */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(HttpStatus.NOT_FOUND, problem(resourceType, id), null);
  }

  private static ProblemDetail problem(String resourceType, Object id) {
    var problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.NOT_FOUND,
            "No " + resourceType.toLowerCase(Locale.ROOT) + " found with id " + id);
    problem.setTitle(resourceType + " not found");
    problem.setProperty("resourceId", String.valueOf(id));
    return problem;
  }
}
