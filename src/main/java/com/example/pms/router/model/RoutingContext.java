package com.example.pms.router.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class RoutingContext {
  public static final String BYPASS_BLOCKED = "bypass-blocked";

  // input
  private String requestId;
  private AuthContext auth;
  private String rawInput;
  // untruncated text; the classifier must see everything the user sent
  private String originalInput;

  // classification
  private LaneDecision decision;

  // extraction + mapping
  private List<ExtractedEntity> entities = new ArrayList<>();
  private boolean modelExtractionUsed;
  private boolean extractionDegraded;
  private List<CandidateAction> actions = new ArrayList<>();

  private Instant now = Instant.now();

  // audit trail
  private List<StepLog> steps = new ArrayList<>();
  private List<String> validationNotices = new ArrayList<>();

  public RoutingContext addStep(String name, String note) {
    Instant at = Instant.now();
    long elapsed = now == null ? 0L : Duration.between(now, at).toMillis();
    steps.add(StepLog.builder()
        .name(name)
        .note(note)
        .lane(decision == null ? null : decision.lane())
        .bypassed(BYPASS_BLOCKED.equals(note))
        .at(at)
        .elapsedMs(elapsed)
        .build());
    return this;
  }

  public String getClassificationInput() {
    return originalInput != null ? originalInput : rawInput;
  }

  public boolean isBlocked() {
    return decision != null && decision.isBlocked();
  }
}
