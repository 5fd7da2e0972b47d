package com.example.pms.router.safety;

import com.example.pms.router.model.Lane;
import com.example.pms.router.model.LaneDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Assigns a processing lane to raw query text.
 *
 * <p>Rule groups are evaluated in a fixed order and the first match wins:
 * paste dumps, injection attempts, domain drift, then the strong-shape / vocabulary lanes.
 * The classifier holds no mutable state and never throws.</p>
 */
@Slf4j
@Component
public class SafetyClassifier {

    private static final String NAME = "safety-classifier";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+(?:[-'][\\p{L}\\p{N}]+)*");

    private final SafetyRuleSet rules;

    public SafetyClassifier(SafetyRuleSet rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public String rulesVersion() {
        return rules.getVersion();
    }

    public LaneDecision classify(String text) {
        if (text == null || text.isBlank()) {
            return new LaneDecision(Lane.NO_LLM, LaneDecision.EMPTY_QUERY, "builtin:empty");
        }
        try {
            return evaluate(text);
        } catch (RuntimeException ex) {
            log.warn("[{}] rule evaluation failed ({}); using restrictive lane", NAME, ex.toString());
            return new LaneDecision(Lane.RULES_ONLY, LaneDecision.CLASSIFICATION_AMBIGUOUS, "builtin:evaluation_error");
        }
    }

    private LaneDecision evaluate(String raw) {
        String lower = WHITESPACE.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();

        // 1) paste dumps: shapes are case-sensitive and may span lines, so match the raw text
        for (PatternRule rule : rules.getPasteDumpRules()) {
            if (rule.matches(raw)) {
                return LaneDecision.blocked(LaneDecision.PASTE_DUMP, rule.qualifiedName());
            }
        }
        if (raw.length() > rules.getLongTextChars() && alphaRatio(raw) < rules.getMinAlphaRatio()) {
            return LaneDecision.blocked(LaneDecision.PASTE_DUMP, "paste_dump:low_alpha_ratio");
        }

        // 2) injection: domain words that contain SQL-looking fragments are masked first
        String masked = rules.getBenignTerms() == null
                ? lower
                : rules.getBenignTerms().matcher(lower).replaceAll(" ");
        for (PatternRule rule : rules.getInjectionRules()) {
            if (rule.matches(masked)) {
                return LaneDecision.blocked(LaneDecision.INJECTION_DETECTED, rule.qualifiedName());
            }
        }

        // 3) domain drift
        for (PatternRule rule : rules.getOffDomainRules()) {
            if (rule.matches(lower)) {
                return LaneDecision.blocked(LaneDecision.OFF_DOMAIN, rule.qualifiedName());
            }
        }

        PatternRule strongShape = firstMatch(raw);
        if (strongShape != null && raw.trim().length() < rules.getShortQueryMaxChars()) {
            return new LaneDecision(Lane.NO_LLM, LaneDecision.STRONG_PATTERN, strongShape.qualifiedName());
        }

        boolean domainVocabulary = rules.getDomainVocabulary().matcher(lower).find();
        if (!domainVocabulary && strongShape == null) {
            if (lower.length() > rules.getDriftMinChars()) {
                return LaneDecision.blocked(LaneDecision.OFF_DOMAIN, "off_domain:no_domain_vocabulary");
            }
            return new LaneDecision(Lane.RULES_ONLY, LaneDecision.CLASSIFICATION_AMBIGUOUS, "builtin:vague_query");
        }

        if (isFreeForm(lower)) {
            return new LaneDecision(Lane.GPT, LaneDecision.FREE_FORM, "builtin:free_form");
        }
        return new LaneDecision(Lane.RULES_ONLY, LaneDecision.DOMAIN_VOCABULARY, "builtin:domain_vocabulary");
    }

    private PatternRule firstMatch(String raw) {
        for (PatternRule rule : rules.getStrongShapeRules()) {
            if (rule.matches(raw)) {
                return rule;
            }
        }
        return null;
    }

    private boolean isFreeForm(String lower) {
        var m = TOKEN.matcher(lower);
        int tokens = 0;
        String first = null;
        while (m.find()) {
            if (first == null) {
                first = m.group();
            }
            tokens++;
        }
        if (tokens > rules.getRulesOnlyMaxTokens()) {
            return true;
        }
        return lower.endsWith("?") || (first != null && rules.getFreeFormMarkers().contains(first));
    }

    private static double alphaRatio(String text) {
        int letters = 0;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetter(text.charAt(i))) {
                letters++;
            }
        }
        return (double) letters / text.length();
    }
}
