package com.example.pms.router.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of maintenance records that can be focused, related, or embedded.
 */
public enum RecordType {
    EQUIPMENT("equipment", RelationDomain.INVENTORY),
    PART("part", RelationDomain.INVENTORY),
    FAULT("fault", RelationDomain.FAULTS),
    WORK_ORDER("work_order", RelationDomain.WORK_ORDERS),
    SHOPPING_ITEM("shopping_item", RelationDomain.SHOPPING),
    DOCUMENT("document", RelationDomain.DOCUMENTS),
    MANUAL("manual", RelationDomain.MANUALS),
    EMAIL("email", RelationDomain.EMAILS),
    CERTIFICATE("certificate", RelationDomain.CERTIFICATES),
    NOTE("note", RelationDomain.HISTORY),
    ATTACHMENT("attachment", RelationDomain.DOCUMENTS);

    private final String value;
    private final RelationDomain domain;

    RecordType(String value, RelationDomain domain) {
        this.value = value;
        this.domain = domain;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Domain group a record of this type is listed under when it is related to a focus. */
    public RelationDomain domain() {
        return domain;
    }

    public static RecordType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("record type must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (RecordType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown record type: " + raw);
    }
}
