package com.example.pms.router.rerank;

import com.example.pms.router.model.FocusedEntity;
import com.example.pms.router.model.RelationItem;
import com.example.pms.router.relation.TierWeights;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * The two scoring functions over relation items.
 * <ul>
 *   <li>{@link #fkOnly} scores by tier weight alone.</li>
 *   <li>{@link #blended} adds {@code alpha * 100 * cosine} when both embeddings are present.</li>
 * </ul>
 * Both sort with the same tie-breaks (recency, then id), so with alpha 0 they agree.
 */
public final class ShadowReranker {

    public static final Comparator<RelationItem> ORDER = Comparator
            .comparingDouble(RelationItem::finalScore).reversed()
            .thenComparing(RelationItem::occurredAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(RelationItem::entityId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private ShadowReranker() {
    }

    public static RelationItem fkOnly(RelationItem item) {
        return item.withScore(null, item.tierWeight());
    }

    public static RelationItem blended(RelationItem item, FocusedEntity focus, double alpha) {
        if (focus == null || !focus.hasEmbedding() || !item.hasEmbedding()) {
            return fkOnly(item);
        }
        // raw similarity is kept for statistics; only the boost is clamped to [0, 1]
        double cosine = CosineSimilarity.of(focus.embedding(), item.embedding());
        double boost = clampAlpha(alpha) * TierWeights.MAX_SEMANTIC_BOOST * CosineSimilarity.clamp(cosine);
        return item.withScore(cosine, item.tierWeight() + boost);
    }

    public static List<RelationItem> rankFkOnly(List<RelationItem> items) {
        return items.stream().map(ShadowReranker::fkOnly).sorted(ORDER).toList();
    }

    public static List<RelationItem> rankBlended(List<RelationItem> items, FocusedEntity focus, double alpha) {
        return items.stream().map(i -> blended(i, focus, alpha)).sorted(ORDER).toList();
    }

    /** Response-path ranking: the blend term is only computed when alpha is positive. */
    public static List<RelationItem> rank(List<RelationItem> items, FocusedEntity focus, double alpha) {
        return alpha > 0.0 ? rankBlended(items, focus, alpha) : rankFkOnly(items);
    }

    static double clampAlpha(double alpha) {
        return Math.max(0.0, Math.min(1.0, alpha));
    }
}
