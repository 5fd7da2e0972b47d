package com.example.pms.router.validation;

import com.example.pms.router.config.RouterProperties;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Caps the query length; longer input is truncated with a notice, never rejected. */
@Component
public class MaxCharsValidator implements Validator {

  private static final int DEFAULT_MAX_CHARS = 2000;

  private final int maxChars;

  public MaxCharsValidator() {
    this(DEFAULT_MAX_CHARS);
  }

  @Autowired
  public MaxCharsValidator(RouterProperties properties) {
    this(properties.getMaxQueryChars());
  }

  public MaxCharsValidator(int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    this.maxChars = maxChars;
  }

  @Override
  public ValidationStage stage() {
    return ValidationStage.INPUT;
  }

  @Override
  public void validate(ValidationContext context) {
    String processed = Objects.requireNonNullElse(context.getProcessedInput(), "");
    if (processed.length() <= maxChars) {
      context.setProcessedInput(processed);
      return;
    }

    context.setProcessedInput(processed.substring(0, maxChars));
    context.addNotice(String.format("Query truncated to %d characters.", maxChars));
  }
}
