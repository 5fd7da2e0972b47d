package com.example.pms.router.extraction;

import com.example.pms.router.model.ExtractedEntity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Merges pattern and model results. Pattern entities win on a (type, text) collision and the
 * output is ordered by first appearance in the query.
 */
public final class EntityMerger {

    private EntityMerger() {
    }

    public static List<ExtractedEntity> merge(String query, List<ExtractedEntity> pattern, List<ExtractedEntity> model) {
        Map<String, ExtractedEntity> byKey = new LinkedHashMap<>();
        for (ExtractedEntity e : pattern) {
            byKey.putIfAbsent(e.dedupKey(), e);
        }

        String lowerQuery = query == null ? "" : query.toLowerCase(Locale.ROOT);
        for (ExtractedEntity e : model) {
            if (byKey.containsKey(e.dedupKey())) {
                continue;
            }
            ExtractedEntity located = e.start() >= 0 ? e : e.withStart(lowerQuery.indexOf(e.surface().toLowerCase(Locale.ROOT)));
            byKey.put(located.dedupKey(), located);
        }

        List<ExtractedEntity> located = new ArrayList<>();
        List<ExtractedEntity> unlocated = new ArrayList<>();
        for (ExtractedEntity e : byKey.values()) {
            (e.start() >= 0 ? located : unlocated).add(e);
        }
        // stable sort keeps pattern-before-model order for equal offsets
        located.sort(Comparator.comparingInt(ExtractedEntity::start));
        located.addAll(unlocated);
        return List.copyOf(located);
    }
}
