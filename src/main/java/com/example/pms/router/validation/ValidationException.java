package com.example.pms.router.validation;

import java.util.List;
import java.util.Objects;

/** Exception thrown when required request input is missing or malformed. */
public class ValidationException extends RuntimeException {

  private final ErrorCode code;
  private final List<String> reasons;

  public ValidationException(ErrorCode code, String message) {
    super(Objects.requireNonNull(message, "message"));
    this.code = Objects.requireNonNull(code, "code");
    this.reasons = List.of(message);
  }

  public ValidationException(ErrorCode code, List<String> reasons) {
    super(formatMessage(reasons));
    this.code = Objects.requireNonNull(code, "code");
    this.reasons = List.copyOf(reasons);
  }

  public ErrorCode getCode() {
    return code;
  }

  public List<String> getReasons() {
    return reasons;
  }

  private static String formatMessage(List<String> reasons) {
    Objects.requireNonNull(reasons, "reasons");
    if (reasons.isEmpty()) {
      throw new IllegalArgumentException("reasons must not be empty");
    }
    if (reasons.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("reasons must not contain null entries");
    }
    return String.join("; ", reasons);
  }
}
