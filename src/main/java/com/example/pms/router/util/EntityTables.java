package com.example.pms.router.util;

import com.example.pms.router.model.RecordType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Physical table behind each record type. Types whose table carries no embedding column map
 * to an empty value in {@link #embeddingTable(RecordType)}.
 */
public final class EntityTables {

    private static final Map<RecordType, String> TABLES = new EnumMap<>(RecordType.class);
    private static final Map<RecordType, Boolean> EMBEDDED = new EnumMap<>(RecordType.class);

    static {
        register(RecordType.EQUIPMENT, "equipment", true);
        register(RecordType.PART, "parts", true);
        register(RecordType.FAULT, "faults", true);
        register(RecordType.WORK_ORDER, "work_orders", true);
        register(RecordType.DOCUMENT, "documents", true);
        register(RecordType.MANUAL, "documents", true);
        register(RecordType.CERTIFICATE, "documents", true);
        register(RecordType.NOTE, "notes", true);
        register(RecordType.ATTACHMENT, "attachments", true);
        register(RecordType.SHOPPING_ITEM, "shopping_list_items", false);
        register(RecordType.EMAIL, "emails", false);
    }

    private EntityTables() {
    }

    private static void register(RecordType type, String table, boolean embedded) {
        TABLES.put(type, table);
        EMBEDDED.put(type, embedded);
    }

    public static String table(RecordType type) {
        return TABLES.get(type);
    }

    public static Optional<String> embeddingTable(RecordType type) {
        return Boolean.TRUE.equals(EMBEDDED.get(type)) ? Optional.of(TABLES.get(type)) : Optional.empty();
    }
}
