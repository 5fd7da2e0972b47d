package com.example.pms.router.model;

public enum EntityType {
    EQUIPMENT,
    PART,
    PART_NUMBER,
    FAULT_CODE,
    SYMPTOM,
    MEASUREMENT,
    WORK_ORDER_NUMBER,
    PO_NUMBER;

    /** Lenient lookup used for model output; returns {@code null} when the name is unknown. */
    public static EntityType fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String normalized = name.trim().toUpperCase(java.util.Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (EntityType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
