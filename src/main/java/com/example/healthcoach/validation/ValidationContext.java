package com.example.healthcoach.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Carries the question and the prompt template through the validation stages. Validators can
 * mutate either and attach user facing notices.
 */
public class ValidationContext {

  private final String rawInput;
  private String processedInput;
  private String userTemplate;
  private final List<String> notices = new ArrayList<>();

  public ValidationContext(String rawInput, String userTemplate) {
    this.rawInput = rawInput;
    this.processedInput = rawInput;
    this.userTemplate = userTemplate;
  }

  public String getRawInput() {
    return rawInput;
  }

  public String getProcessedInput() {
    return processedInput;
  }

  public void setProcessedInput(String processedInput) {
    this.processedInput = processedInput;
  }

  public String getUserTemplate() {
    return userTemplate;
  }

  public void setUserTemplate(String userTemplate) {
    this.userTemplate = userTemplate;
  }

  /** Adds a user visible notice emitted during validation. */
  public void addNotice(String notice) {
    notices.add(Objects.requireNonNull(notice, "notice"));
  }

  public List<String> getNotices() {
    return Collections.unmodifiableList(notices);
  }
}
