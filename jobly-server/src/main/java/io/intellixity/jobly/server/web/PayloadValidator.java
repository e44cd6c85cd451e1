package io.intellixity.jobly.server.web;

import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Bean Validation of create payloads; violations are reported together, sorted by property. */
@Component
public final class PayloadValidator {
  private final Validator validator;

  public PayloadValidator(Validator validator) {
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  public <T> Result<T> check(T payload) {
    if (payload == null) return Result.failure(ErrorKind.INVALID_INPUT, "Request body is required");
    Set<ConstraintViolation<T>> violations = validator.validate(payload);
    if (violations.isEmpty()) return Result.success(payload);

    List<String> messages = new ArrayList<>(violations.size());
    for (ConstraintViolation<T> v : violations) {
      messages.add(v.getPropertyPath() + ": " + v.getMessage());
    }
    Collections.sort(messages);
    return Result.failure(ErrorKind.INVALID_INPUT, String.join("; ", messages));
  }
}
