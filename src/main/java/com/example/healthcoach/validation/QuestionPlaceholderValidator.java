package com.example.healthcoach.validation;

import java.util.Objects;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Guarantees that the user template carries the {{question}} placeholder by appending it when
 * absent, so an edited template can never drop the user's question.
 */
@Component
@Order(3)
public class QuestionPlaceholderValidator implements Validator {

  static final String QUESTION_PLACEHOLDER = "{{question}}";

  @Override
  public ValidationStage stage() {
    return ValidationStage.PRE_PROMPT;
  }

  @Override
  public void validate(ValidationContext context) {
    String template = Objects.requireNonNullElse(context.getUserTemplate(), "");
    if (template.contains(QUESTION_PLACEHOLDER)) {
      return;
    }
    String amended = template.isBlank()
        ? "Question: " + QUESTION_PLACEHOLDER
        : template + "\n\nQuestion: " + QUESTION_PLACEHOLDER;
    context.setUserTemplate(amended);
    context.addNotice("Injected missing {{question}} placeholder into prompt template.");
  }
}
