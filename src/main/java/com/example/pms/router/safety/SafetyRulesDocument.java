package com.example.pms.router.safety;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * JSON shape of {@code safety-rules.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SafetyRulesDocument {
    public String version;
    public Integer shortQueryMaxChars;
    public Integer driftMinChars;
    public Integer longTextChars;
    public Double minAlphaRatio;
    public Integer rulesOnlyMaxTokens;
    public List<RuleJson> pasteDump;
    public List<RuleJson> injection;
    public List<String> benignTerms;
    public List<RuleJson> offDomain;
    public List<RuleJson> strongShapes;
    public List<String> domainTerms;
    public List<String> freeFormMarkers;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuleJson {
        public String name;
        public String pattern;
    }
}
