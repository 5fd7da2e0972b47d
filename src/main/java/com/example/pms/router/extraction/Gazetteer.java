package com.example.pms.router.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiled domain vocabulary used by the pattern extraction pass. Immutable once loaded.
 */
@Slf4j
@Getter
public final class Gazetteer {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final String version;
    private final Map<String, String> abbreviations;
    private final Map<String, String> equipmentAliases;
    private final Map<String, String> partAliases;
    private final Map<String, String> symptomAliases;
    private final List<String> unitCanonicals;

    /** {@code ME1}, {@code me-1}, {@code ME 1}: abbreviation followed by a unit number. */
    private final Pattern numberedAbbreviation;
    /** Bare abbreviation, only when written in capitals. */
    private final Pattern bareAbbreviation;
    private final Pattern equipment;
    private final Pattern parts;
    private final Pattern symptoms;
    private final Pattern measurement;

    private Gazetteer(GazetteerDocument doc) {
        this.version = Objects.requireNonNullElse(doc.version, "unversioned");

        Map<String, String> abbr = new LinkedHashMap<>();
        if (doc.abbreviations != null) {
            for (GazetteerDocument.Abbreviation a : doc.abbreviations) {
                if (a != null && notBlank(a.abbr) && notBlank(a.expansion)) {
                    abbr.put(a.abbr.trim().toUpperCase(Locale.ROOT), a.expansion.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.abbreviations = Map.copyOf(abbr);
        this.equipmentAliases = aliases(doc.equipment);
        this.partAliases = aliases(doc.parts);
        this.symptomAliases = aliases(doc.symptoms);

        String abbrAlternation = abbr.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        this.numberedAbbreviation = abbr.isEmpty() ? null
                : Pattern.compile("\\b(?:(?i:(" + abbrAlternation + "))-?(\\d{1,2})|(" + abbrAlternation + ")\\s(\\d{1,2}))\\b");
        this.bareAbbreviation = abbr.isEmpty() ? null
                : Pattern.compile("\\b(" + abbrAlternation + ")\\b");

        this.equipment = termPattern(equipmentAliases, "(?:\\s+(?:no\\.?\\s*|#\\s*)?(\\d{1,2})\\b)?");
        this.parts = termPattern(partAliases, "");
        this.symptoms = termPattern(symptomAliases, "");

        List<String> canonicals = new ArrayList<>();
        StringBuilder units = new StringBuilder();
        if (doc.units != null) {
            for (GazetteerDocument.Unit u : doc.units) {
                if (u == null || !notBlank(u.pattern) || !notBlank(u.canonical)) {
                    continue;
                }
                if (units.length() > 0) {
                    units.append('|');
                }
                units.append("(?<u").append(canonicals.size()).append('>').append(u.pattern).append(')');
                canonicals.add(u.canonical);
            }
        }
        this.unitCanonicals = List.copyOf(canonicals);
        this.measurement = canonicals.isEmpty() ? null
                : Pattern.compile("(?<![\\w.])(?<num>-?\\d+(?:\\.\\d+)?)\\s*(?:" + units + ")(?![\\w/°])", FLAGS);
    }

    public static Gazetteer from(GazetteerDocument doc) {
        return new Gazetteer(Objects.requireNonNull(doc, "doc"));
    }

    public static Gazetteer load(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            Gazetteer gazetteer = from(objectMapper.readValue(in, GazetteerDocument.class));
            log.info("[entity-extractor] Loaded gazetteer version={} equipment={} parts={} symptoms={}",
                    gazetteer.version, gazetteer.equipmentAliases.size(), gazetteer.partAliases.size(),
                    gazetteer.symptomAliases.size());
            return gazetteer;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read gazetteer from " + resource.getDescription(), e);
        }
    }

    public String expandAbbreviation(String abbr) {
        return abbr == null ? null : abbreviations.get(abbr.toUpperCase(Locale.ROOT));
    }

    /** Canonical unit for a measurement match, by the index of the unit group that matched. */
    public String unitFor(java.util.regex.Matcher m) {
        for (int i = 0; i < unitCanonicals.size(); i++) {
            if (m.group("u" + i) != null) {
                return unitCanonicals.get(i);
            }
        }
        return "";
    }

    public static String canonicalOf(Map<String, String> aliases, String surface) {
        String key = surface.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        return aliases.getOrDefault(key, key);
    }

    private static Map<String, String> aliases(List<GazetteerDocument.Term> terms) {
        Map<String, String> out = new LinkedHashMap<>();
        if (terms == null) {
            return Map.of();
        }
        for (GazetteerDocument.Term term : terms) {
            if (term == null || !notBlank(term.canonical)) {
                continue;
            }
            String canonical = term.canonical.trim().toLowerCase(Locale.ROOT);
            out.putIfAbsent(canonical, canonical);
            if (term.aliases != null) {
                for (String alias : term.aliases) {
                    if (notBlank(alias)) {
                        out.putIfAbsent(alias.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " "), canonical);
                    }
                }
            }
        }
        return Map.copyOf(out);
    }

    private static Pattern termPattern(Map<String, String> aliases, String suffix) {
        if (aliases.isEmpty()) {
            return null;
        }
        String body = aliases.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(a -> Pattern.quote(a).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\w-])(" + body + ")(?![\\w-])" + suffix, FLAGS);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
