package com.example.pms.router.extraction;

import com.example.pms.router.model.EntitySource;
import com.example.pms.router.model.EntityType;
import com.example.pms.router.model.ExtractedEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First extraction pass: regular expressions and gazetteer lookups only. Deterministic and
 * side-effect free.
 */
@Slf4j
@Component
public class PatternEntityExtractor {

    private static final Pattern FAULT_CODE = Pattern.compile(
            "\\b(?:SPN[-\\s]?(\\d{2,6})(?:[-\\s]?FMI[-\\s]?(\\d{1,2}))?|([EFAW]\\d{3,4})|([PCBU][0-3]\\d{3}))\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WORK_ORDER = Pattern.compile("\\bWO[-\\s]?(\\d{3,})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PURCHASE_ORDER = Pattern.compile("\\bPO[-\\s]?(\\d{3,})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PART_NUMBER = Pattern.compile(
            "\\b(?=[A-Z0-9-]*\\d)(?=[A-Z0-9-]*[A-Z])[A-Z0-9]{1,6}-[A-Z0-9]{2,8}(?:-[A-Z0-9]{1,6})?\\b");

    // lower value wins a tie between equally long, equally confident spans
    private static final int P_FAULT = 0;
    private static final int P_ORDER = 1;
    private static final int P_EQUIPMENT_CODE = 2;
    private static final int P_MEASUREMENT = 3;
    private static final int P_PART_NUMBER = 4;
    private static final int P_EQUIPMENT = 5;
    private static final int P_PART = 6;
    private static final int P_SYMPTOM = 7;

    private final Gazetteer gazetteer;

    public PatternEntityExtractor(Gazetteer gazetteer) {
        this.gazetteer = Objects.requireNonNull(gazetteer, "gazetteer");
    }

    public List<ExtractedEntity> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();
        faultCodes(text, candidates);
        orders(text, candidates);
        equipmentCodes(text, candidates);
        measurements(text, candidates);
        partNumbers(text, candidates);
        terms(text, gazetteer.getEquipment(), gazetteer.getEquipmentAliases(), EntityType.EQUIPMENT, 0.85, P_EQUIPMENT, candidates);
        terms(text, gazetteer.getParts(), gazetteer.getPartAliases(), EntityType.PART, 0.8, P_PART, candidates);
        terms(text, gazetteer.getSymptoms(), gazetteer.getSymptomAliases(), EntityType.SYMPTOM, 0.75, P_SYMPTOM, candidates);
        return resolveOverlaps(candidates);
    }

    private void faultCodes(String text, List<Candidate> out) {
        Matcher m = FAULT_CODE.matcher(text);
        while (m.find()) {
            String normalized;
            if (m.group(1) != null) {
                normalized = "SPN " + m.group(1) + (m.group(2) != null ? " FMI " + m.group(2) : "");
            } else {
                normalized = m.group().toUpperCase(Locale.ROOT);
            }
            out.add(candidate(EntityType.FAULT_CODE, normalized, m, 0.95, P_FAULT));
        }
    }

    private void orders(String text, List<Candidate> out) {
        Matcher wo = WORK_ORDER.matcher(text);
        while (wo.find()) {
            out.add(candidate(EntityType.WORK_ORDER_NUMBER, "WO-" + wo.group(1), wo, 0.95, P_ORDER));
        }
        Matcher po = PURCHASE_ORDER.matcher(text);
        while (po.find()) {
            out.add(candidate(EntityType.PO_NUMBER, "PO-" + po.group(1), po, 0.95, P_ORDER));
        }
    }

    private void equipmentCodes(String text, List<Candidate> out) {
        if (gazetteer.getNumberedAbbreviation() != null) {
            Matcher m = gazetteer.getNumberedAbbreviation().matcher(text);
            while (m.find()) {
                String abbr = m.group(1) != null ? m.group(1) : m.group(3);
                String number = m.group(1) != null ? m.group(2) : m.group(4);
                String expansion = gazetteer.expandAbbreviation(abbr);
                out.add(candidate(EntityType.EQUIPMENT, expansion + " " + Integer.parseInt(number), m, 0.9, P_EQUIPMENT_CODE));
            }
        }
        if (gazetteer.getBareAbbreviation() != null) {
            Matcher m = gazetteer.getBareAbbreviation().matcher(text);
            while (m.find()) {
                out.add(candidate(EntityType.EQUIPMENT, gazetteer.expandAbbreviation(m.group(1)), m, 0.7, P_EQUIPMENT_CODE));
            }
        }
    }

    private void measurements(String text, List<Candidate> out) {
        if (gazetteer.getMeasurement() == null) {
            return;
        }
        Matcher m = gazetteer.getMeasurement().matcher(text);
        while (m.find()) {
            String unit = gazetteer.unitFor(m);
            out.add(candidate(EntityType.MEASUREMENT, m.group("num") + " " + unit, m, 0.9, P_MEASUREMENT));
        }
    }

    private void partNumbers(String text, List<Candidate> out) {
        Matcher m = PART_NUMBER.matcher(text);
        while (m.find()) {
            out.add(candidate(EntityType.PART_NUMBER, m.group(), m, 0.9, P_PART_NUMBER));
        }
    }

    private void terms(String text, Pattern pattern, Map<String, String> aliases, EntityType type,
                       double confidence, int priority, List<Candidate> out) {
        if (pattern == null) {
            return;
        }
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String canonical = Gazetteer.canonicalOf(aliases, m.group(1));
            // equipment patterns capture an optional unit number
            if (m.groupCount() >= 2 && m.group(2) != null) {
                canonical = canonical + " " + Integer.parseInt(m.group(2));
            }
            // single-word aliases are weaker evidence than multi-word names
            double conf = m.group(1).trim().contains(" ") ? confidence : confidence - 0.1;
            out.add(candidate(type, canonical, m, Math.max(0.7, conf), priority));
        }
    }

    private static Candidate candidate(EntityType type, String normalized, Matcher m, double confidence, int priority) {
        ExtractedEntity entity = new ExtractedEntity(type, normalized, m.group(), confidence, EntitySource.PATTERN, m.start());
        return new Candidate(entity, m.start(), m.end(), priority);
    }

    // longest span wins; ties go to higher confidence, then rule priority
    private static List<ExtractedEntity> resolveOverlaps(List<Candidate> candidates) {
        candidates.sort(Comparator
                .comparingInt((Candidate c) -> c.end - c.start).reversed()
                .thenComparing(Comparator.comparingDouble((Candidate c) -> c.entity.confidence()).reversed())
                .thenComparingInt(c -> c.priority)
                .thenComparingInt(c -> c.start));

        List<Candidate> accepted = new ArrayList<>();
        for (Candidate c : candidates) {
            boolean overlaps = false;
            for (Candidate a : accepted) {
                if (c.start < a.end && a.start < c.end) {
                    overlaps = true;
                    break;
                }
            }
            if (!overlaps) {
                accepted.add(c);
            }
        }
        accepted.sort(Comparator.comparingInt(c -> c.start));

        List<ExtractedEntity> out = new ArrayList<>(accepted.size());
        java.util.Set<String> seen = new java.util.HashSet<>();
        for (Candidate c : accepted) {
            if (seen.add(c.entity.dedupKey())) {
                out.add(c.entity);
            }
        }
        return List.copyOf(out);
    }

    private record Candidate(ExtractedEntity entity, int start, int end, int priority) {
    }
}
