package io.confhub.backend.cfp;

import java.util.List;

/** Outcome of {@link CfpPolicy#validate}: either valid, or the list of failed field checks. */
public sealed interface CfpValidationResult
    permits CfpValidationResult.Valid, CfpValidationResult.Invalid {

  static CfpValidationResult of(List<FieldError> errors) {
    return errors.isEmpty() ? new Valid() : new Invalid(errors);
  }

  default boolean isValid() {
    return this instanceof Valid;
  }

  default List<FieldError> errors() {
    return List.of();
  }

  record Valid() implements CfpValidationResult {}

  record Invalid(List<FieldError> errors) implements CfpValidationResult {

    public Invalid {
      if (errors == null || errors.isEmpty()) {
        throw new IllegalArgumentException("an invalid result needs at least one error");
      }
      errors = List.copyOf(errors);
    }

    public boolean hasError(String field, String reason) {
      return errors.stream().anyMatch(e -> e.field().equals(field) && e.reason().equals(reason));
    }
  }

  /**
   * A single failed check. {@code reason} is a stable machine-readable code, {@code message} the
   * human-readable text.
   */
  record FieldError(String field, String reason, String message) {}
}
