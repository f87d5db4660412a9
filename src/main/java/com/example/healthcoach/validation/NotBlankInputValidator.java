package com.example.healthcoach.validation;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Rejects a null or blank question. */
@Component
@Order(1)
public class NotBlankInputValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.PRE_CHAIN;
  }

  @Override
  public void validate(ValidationContext context) {
    String rawInput = context.getRawInput();
    if (rawInput == null || rawInput.trim().isEmpty()) {
      throw new ValidationException("Question must not be blank.");
    }
    context.setProcessedInput(rawInput.strip());
  }
}
