package com.example.pms.router.model;

import java.util.Objects;

/**
 * Outcome of the safety classifier. {@code matchedRule} names the rule that decided the lane.
 */
public record LaneDecision(Lane lane, String reason, String matchedRule) {

    public static final String PASTE_DUMP = "paste_dump";
    public static final String INJECTION_DETECTED = "injection_detected";
    public static final String OFF_DOMAIN = "off_domain";
    public static final String EMPTY_QUERY = "empty_query";
    public static final String STRONG_PATTERN = "strong_pattern";
    public static final String DOMAIN_VOCABULARY = "domain_vocabulary";
    public static final String FREE_FORM = "free_form";
    public static final String CLASSIFICATION_AMBIGUOUS = "classification_ambiguous";

    public LaneDecision {
        Objects.requireNonNull(lane, "lane");
        Objects.requireNonNull(reason, "reason");
    }

    public static LaneDecision blocked(String reason, String rule) {
        return new LaneDecision(Lane.BLOCKED, reason, rule);
    }

    public boolean isBlocked() {
        return lane == Lane.BLOCKED;
    }
}
