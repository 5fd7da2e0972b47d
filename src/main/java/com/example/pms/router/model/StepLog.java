package com.example.pms.router.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** One pipeline stage as it ran for a single query. */
@Value
@Builder
public class StepLog {
  String name;
  String note;
  /** Lane decided so far; null until the classifier has run. */
  Lane lane;
  boolean bypassed;
  Instant at;
  long elapsedMs;
}
