package com.example.healthcoach.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/** Proposed changes; a missing field leaves that factor unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class ScenarioRunRequest {
  private Double vo2Delta;
  private Double sleepDelta;
  private Double stepsDelta;
}
