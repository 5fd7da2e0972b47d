package com.example.pms.router.model;

import java.util.Locale;
import java.util.Objects;

/**
 * An entity recognized in a query.
 *
 * @param type       entity class
 * @param text       normalized value, e.g. {@code "main engine 1"} for surface {@code "ME1"}
 * @param surface    text as it appeared in the query
 * @param confidence 0..1
 * @param source     which extraction pass produced it
 * @param start      offset of the surface text in the query, or -1 when it could not be located
 */
public record ExtractedEntity(EntityType type,
                              String text,
                              String surface,
                              double confidence,
                              EntitySource source,
                              int start) {

    public ExtractedEntity {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(source, "source");
        if (surface == null) {
            surface = text;
        }
    }

    /** Key used to deduplicate entities across extraction passes. */
    public String dedupKey() {
        return type.name() + "|" + text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    public int end() {
        return start < 0 ? -1 : start + surface.length();
    }

    public ExtractedEntity withStart(int newStart) {
        return new ExtractedEntity(type, text, surface, confidence, source, newStart);
    }
}
