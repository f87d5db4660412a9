package com.example.healthcoach.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NotBlankInputValidatorTest {

  private final NotBlankInputValidator validator = new NotBlankInputValidator();

  @Test
  void shouldRejectBlankQuestion() {
    ValidationContext context = new ValidationContext("   ", null);

    assertThatThrownBy(() -> validator.validate(context))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("must not be blank");
  }

  @Test
  void shouldRejectNullQuestion() {
    assertThatThrownBy(() -> validator.validate(new ValidationContext(null, null)))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void shouldStripSurroundingWhitespace() {
    ValidationContext context = new ValidationContext("  How did I sleep?  ", null);

    validator.validate(context);

    assertThat(context.getProcessedInput()).isEqualTo("How did I sleep?");
  }
}
