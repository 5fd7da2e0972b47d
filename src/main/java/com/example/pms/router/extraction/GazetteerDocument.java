package com.example.pms.router.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * JSON shape of {@code gazetteer.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GazetteerDocument {
    public String version;
    public List<Abbreviation> abbreviations;
    public List<Term> equipment;
    public List<Term> parts;
    public List<Term> symptoms;
    public List<Unit> units;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Abbreviation {
        public String abbr;
        public String expansion;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Term {
        public String canonical;
        public List<String> aliases;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Unit {
        public String pattern;
        public String canonical;
    }
}
