package com.example.healthcoach.model;

import lombok.*;
import lombok.experimental.Accessors;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class StepLog {
  private String name;
  private QueryState state;
  private String note;
  private Instant at;
  /**
   * Elapsed milliseconds since the query was submitted when this step was recorded.
   */
  private Long elapsedMs;
}
