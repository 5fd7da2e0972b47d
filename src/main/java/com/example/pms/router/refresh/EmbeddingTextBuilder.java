package com.example.pms.router.refresh;

import com.example.pms.router.model.RecordType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds the text that is embedded for a record. Output is lowercased, units are written as
 * {@code <number> <unit>}, a small set of maintenance abbreviations is expanded, and anything
 * that looks like a credential, phone number or personal address is scrubbed. Query text never flows through here.
 */
public final class EmbeddingTextBuilder {

    public static final int EQUIPMENT_CONTEXT_CAP = 300;

    private static final Map<RecordType, Integer> CAPS = Map.of(
            RecordType.WORK_ORDER, 2000,
            RecordType.EQUIPMENT, 1500,
            RecordType.FAULT, 1500,
            RecordType.PART, 1000,
            RecordType.ATTACHMENT, 500,
            RecordType.NOTE, 1000);

    private static final Map<Pattern, String> SYNONYMS = new LinkedHashMap<>();

    static {
        SYNONYMS.put(Pattern.compile("\\bme\\b"), "main engine");
        SYNONYMS.put(Pattern.compile("\\bae\\b"), "auxiliary engine");
        SYNONYMS.put(Pattern.compile("\\bfw\\b"), "fresh water");
        SYNONYMS.put(Pattern.compile("\\bsw\\b"), "sea water");
        SYNONYMS.put(Pattern.compile("\\bhp\\b"), "hydraulic pump");
        SYNONYMS.put(Pattern.compile("\\bgen\\b"), "generator");
    }

    private static final Map<String, String> UNIT_ALIASES = Map.of(
            "volt", "v", "volts", "v",
            "kilowatt", "kw", "kilowatts", "kw",
            "hertz", "hz");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DEGREES = Pattern.compile("°\\s?([cf])\\b");
    // "24V", "24 volts" and "24 v" all become "24 v"
    private static final Pattern UNIT = Pattern.compile(
            "\\b(\\d+(?:\\.\\d+)?)\\s*(kva|kw|kilowatts?|kv|volts?|v|hz|hertz|bar|psi|kpa|mpa|rpm|nm|c|f)\\b");
    private static final Pattern PHONE = Pattern.compile(
            "\\+\\d{1,3}(?:[\\s.-]?\\(?\\d{1,4}\\)?){2,5}"
                    + "|\\b(?:tel|phone|mobile|cell)[.:]?\\s*\\+?\\d[\\d\\s().-]{6,}\\d");
    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern UUID = Pattern.compile(
            "\\b[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}\\b");
    private static final Pattern TOKEN = Pattern.compile("\\b[A-Za-z0-9+/]{40,}\\b");
    private static final Pattern PASSWORD = Pattern.compile("(?i)\\bpassword[:\\s]*\\S+");

    private EmbeddingTextBuilder() {
    }

    public static boolean supports(RecordType type) {
        return CAPS.containsKey(type);
    }

    public static int capFor(RecordType type) {
        return CAPS.getOrDefault(type, 1000);
    }

    /**
     * @return embedding text, or an empty string when the record has nothing worth embedding
     */
    public static String build(RecordType type, Map<String, String> fields) {
        if (!supports(type) || fields == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        boolean expandSynonyms = true;
        switch (type) {
            case WORK_ORDER -> {
                add(parts, "wo-", fields.get("wo_number"));
                add(parts, "", fields.get("title"));
                add(parts, "", fields.get("description"));
                add(parts, "notes: ", fields.get("completion_notes"));
                add(parts, "equipment: ", equipmentContext(fields));
            }
            case EQUIPMENT -> {
                add(parts, "", fields.get("name"));
                add(parts, "", fields.get("manufacturer"));
                add(parts, "model: ", fields.get("model"));
                add(parts, "s/n: ", fields.get("serial_number"));
                add(parts, "location: ", fields.get("location"));
                add(parts, "system: ", fields.get("system_type"));
            }
            case FAULT -> {
                add(parts, "", fields.get("title"));
                add(parts, "", fields.get("description"));
                add(parts, "severity: ", fields.get("severity"));
                add(parts, "status: ", fields.get("status"));
                add(parts, "equipment: ", equipmentContext(fields));
            }
            case PART -> {
                add(parts, "", fields.get("name"));
                add(parts, "p/n: ", fields.get("part_number"));
                add(parts, "", fields.get("manufacturer"));
                add(parts, "", fields.get("description"));
                add(parts, "category: ", fields.get("category"));
            }
            case ATTACHMENT -> {
                add(parts, "", fields.get("filename"));
                add(parts, "", fields.get("description"));
                add(parts, "type: ", fields.get("mime_type"));
                expandSynonyms = false;
            }
            case NOTE -> {
                add(parts, "", fields.get("note_text"));
                expandSynonyms = false;
            }
            default -> {
                return "";
            }
        }
        String text = scrub(String.join(" | ", parts));
        if (expandSynonyms) {
            text = expandSynonyms(text);
        }
        text = dedupeConsecutive(text);
        return cap(text, capFor(type));
    }

    /** Compact equipment description joined onto work orders and faults. */
    static String equipmentContext(Map<String, String> fields) {
        List<String> parts = new ArrayList<>();
        add(parts, "", fields.get("equipment_name"));
        add(parts, "", fields.get("equipment_manufacturer"));
        add(parts, "", fields.get("equipment_model"));
        add(parts, "location: ", fields.get("equipment_location"));
        if (parts.isEmpty()) {
            return null;
        }
        return cap(expandSynonyms(String.join(" - ", parts)), EQUIPMENT_CONTEXT_CAP);
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.toLowerCase(Locale.ROOT);
        text = DEGREES.matcher(text).replaceAll("$1");
        text = UNIT.matcher(text).replaceAll(m -> m.group(1) + " " + UNIT_ALIASES.getOrDefault(m.group(2), m.group(2)));
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String scrub(String text) {
        String out = EMAIL.matcher(text).replaceAll("[email]");
        out = UUID.matcher(out).replaceAll("[id]");
        out = PHONE.matcher(out).replaceAll("[phone]");
        out = TOKEN.matcher(out).replaceAll("[token]");
        return PASSWORD.matcher(out).replaceAll("[redacted]");
    }

    static String expandSynonyms(String text) {
        String out = text;
        for (Map.Entry<Pattern, String> entry : SYNONYMS.entrySet()) {
            out = entry.getKey().matcher(out).replaceAll(entry.getValue());
        }
        return out;
    }

    static String dedupeConsecutive(String text) {
        String[] tokens = text.split(" ");
        StringBuilder sb = new StringBuilder(text.length());
        String previous = null;
        for (String token : tokens) {
            if (token.isEmpty() || token.equals(previous)) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(token);
            previous = token;
        }
        return sb.toString();
    }

    private static void add(List<String> parts, String prefix, String value) {
        String normalized = normalize(value);
        if (!normalized.isEmpty()) {
            parts.add(prefix + normalized);
        }
    }

    private static String cap(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max).trim();
    }
}
