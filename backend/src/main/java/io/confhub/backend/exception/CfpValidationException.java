package io.confhub.backend.exception;

import io.confhub.backend.cfp.CfpValidationResult.FieldError;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a call for proposals fails validation on save. Results in HTTP 422 Unprocessable
 * Entity with the failed field checks in the {@code errors} property.
 */
public class CfpValidationException extends ErrorResponseException {

  private final List<FieldError> errors;

  public CfpValidationException(List<FieldError> errors) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(errors), null);
    this.errors = List.copyOf(errors);
  }

  public List<FieldError> getErrors() {
    return errors;
  }

  private static ProblemDetail createProblem(List<FieldError> errors) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Call for proposals is invalid");
    problem.setDetail(
        errors.stream()
            .map(e -> e.field() + " " + e.message())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed"));
    problem.setProperty("errors", errors);
    return problem;
  }
}
