package com.example.pms.router.safety;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Compiled, immutable classifier configuration. Built once at start-up and shared by reference.
 */
@Getter
public final class SafetyRuleSet {

    private static final String INFLECTION = "(?:s|es|ed|ing)?";

    private final String version;
    private final int shortQueryMaxChars;
    private final int driftMinChars;
    private final int longTextChars;
    private final double minAlphaRatio;
    private final int rulesOnlyMaxTokens;
    private final List<PatternRule> pasteDumpRules;
    private final List<PatternRule> injectionRules;
    private final List<PatternRule> offDomainRules;
    private final List<PatternRule> strongShapeRules;
    private final Pattern benignTerms;
    private final Pattern domainVocabulary;
    private final Set<String> freeFormMarkers;

    private SafetyRuleSet(SafetyRulesDocument doc) {
        this.version = Objects.requireNonNullElse(doc.version, "unversioned");
        this.shortQueryMaxChars = positive(doc.shortQueryMaxChars, 50);
        this.driftMinChars = positive(doc.driftMinChars, 20);
        this.longTextChars = positive(doc.longTextChars, 100);
        this.minAlphaRatio = doc.minAlphaRatio == null ? 0.5 : doc.minAlphaRatio;
        this.rulesOnlyMaxTokens = positive(doc.rulesOnlyMaxTokens, 6);
        this.pasteDumpRules = compile("paste_dump", doc.pasteDump, 0);
        this.injectionRules = compile("injection", doc.injection, 0);
        this.offDomainRules = compile("off_domain", doc.offDomain, 0);
        this.strongShapeRules = compile("strong_shape", doc.strongShapes, 0);
        this.benignTerms = alternation(doc.benignTerms);
        this.domainVocabulary = alternation(doc.domainTerms);
        this.freeFormMarkers = normalizeAll(doc.freeFormMarkers);
        if (domainVocabulary == null) {
            throw new IllegalArgumentException("Safety rule set " + version + " declares no domain terms");
        }
    }

    public static SafetyRuleSet from(SafetyRulesDocument doc) {
        return new SafetyRuleSet(Objects.requireNonNull(doc, "doc"));
    }

    public int ruleCount() {
        return pasteDumpRules.size() + injectionRules.size() + offDomainRules.size() + strongShapeRules.size();
    }

    private static List<PatternRule> compile(String group, List<SafetyRulesDocument.RuleJson> rules, int flags) {
        if (rules == null) {
            return List.of();
        }
        List<PatternRule> out = new ArrayList<>(rules.size());
        for (SafetyRulesDocument.RuleJson rule : rules) {
            if (rule == null || rule.pattern == null || rule.pattern.isBlank()) {
                continue;
            }
            String name = rule.name == null || rule.name.isBlank() ? group + "_" + out.size() : rule.name;
            try {
                out.add(new PatternRule(group, name, Pattern.compile(rule.pattern, flags)));
            } catch (PatternSyntaxException ex) {
                throw new IllegalArgumentException("Invalid " + group + " rule '" + name + "': " + ex.getDescription(), ex);
            }
        }
        return List.copyOf(out);
    }

    // longest terms first so multi-word phrases win over their parts;
    // plural and verb endings count as the same term ("pumps", "leaking")
    private static Pattern alternation(List<String> terms) {
        Set<String> normalized = normalizeAll(terms);
        if (normalized.isEmpty()) {
            return null;
        }
        String body = normalized.stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(t -> Pattern.quote(t).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + body + ")" + INFLECTION + "\\b");
    }

    private static Set<String> normalizeAll(List<String> values) {
        if (values == null) {
            return Set.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                out.add(v.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " "));
            }
        }
        return Set.copyOf(out);
    }

    private static int positive(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}
