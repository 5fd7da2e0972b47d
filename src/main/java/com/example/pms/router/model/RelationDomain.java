package com.example.pms.router.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relation groups, declared in the fixed order in which they are returned.
 */
public enum RelationDomain {
    INVENTORY("inventory"),
    WORK_ORDERS("work_orders"),
    FAULTS("faults"),
    SHOPPING("shopping"),
    DOCUMENTS("documents"),
    MANUALS("manuals"),
    EMAILS("emails"),
    CERTIFICATES("certificates"),
    HISTORY("history");

    private final String key;

    RelationDomain(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static RelationDomain fromKey(String key) {
        for (RelationDomain domain : values()) {
            if (domain.key.equalsIgnoreCase(key == null ? "" : key.trim())) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown relation domain: " + key);
    }
}
