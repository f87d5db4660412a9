package com.example.healthcoach.validation;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Runs the registered {@link Validator} beans of one stage, in registration order.
 */
@Service
public class ValidationService {

  private final List<Validator> orderedValidators;

  public ValidationService(List<Validator> validators) {
    List<Validator> safeValidators = validators == null ? List.of() : validators;
    this.orderedValidators = safeValidators.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(Validator::stage))
        .toList();
  }

  /** Validates the question before classification. */
  public ValidationContext validateInput(String rawInput) {
    return run(ValidationStage.PRE_CHAIN, new ValidationContext(rawInput, null));
  }

  /** Validates the user template the prompt stage is about to render. */
  public ValidationContext validateTemplate(String question, String userTemplate) {
    return run(ValidationStage.PRE_PROMPT, new ValidationContext(question, userTemplate));
  }

  private ValidationContext run(ValidationStage stage, ValidationContext context) {
    for (Validator validator : orderedValidators) {
      if (validator.stage() == stage) {
        validator.validate(context);
      }
    }
    return context;
  }
}
