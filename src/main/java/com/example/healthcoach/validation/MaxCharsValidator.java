package com.example.healthcoach.validation;

import com.example.healthcoach.config.CoachProperties;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Truncates overly long questions and tells the user it did. */
@Component
@Order(2)
public class MaxCharsValidator implements Validator {

  private static final int DEFAULT_MAX_CHARS = 2000;

  private final int maxChars;

  public MaxCharsValidator() {
    this(DEFAULT_MAX_CHARS);
  }

  @Autowired
  public MaxCharsValidator(CoachProperties properties) {
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
    return ValidationStage.PRE_CHAIN;
  }

  @Override
  public void validate(ValidationContext context) {
    String processed = Objects.requireNonNullElse(context.getProcessedInput(), "");
    if (processed.length() <= maxChars) {
      context.setProcessedInput(processed);
      return;
    }

    context.setProcessedInput(processed.substring(0, maxChars));
    context.addNotice(String.format("Question truncated to %d characters.", maxChars));
  }
}
