package com.example.healthcoach.validation;

/** Contract for validation steps executed around the query pipeline. */
public interface Validator {

  /** The stage in which the validator should be executed. */
  ValidationStage stage();

  /** Applies the validation logic and optionally mutates the provided context. */
  void validate(ValidationContext context);
}
