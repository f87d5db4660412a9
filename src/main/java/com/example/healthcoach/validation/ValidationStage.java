package com.example.healthcoach.validation;

/** Identifies where in the pipeline a validator is executed. */
public enum ValidationStage {
  /** Checks on the raw question before classification starts. */
  PRE_CHAIN,
  /** Checks on the prompt template right before it is rendered for a backend. */
  PRE_PROMPT
}
