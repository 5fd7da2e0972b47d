package com.example.pms.router.rerank;

import com.example.pms.router.config.RouterProperties;
import com.example.pms.router.model.FocusedEntity;
import com.example.pms.router.model.RelationGroup;
import com.example.pms.router.model.RelationItem;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Logs how a blended ranking would differ from the served one. Only truncated ids and
 * aggregate numbers are written; entity text never is.
 */
@Slf4j
@Component
public class ShadowRerankLogger {

    private static final Logger SHADOW = LoggerFactory.getLogger("router.shadow");
    private static final int ID_PREFIX = 8;

    private final boolean enabled;
    private final double alpha;
    private final int topN;
    private final List<Double> simulationAlphas;

    @Autowired
    public ShadowRerankLogger(RouterProperties properties) {
        this(properties.getShadow().isEnabled(), properties.getShadow().getAlpha(), properties.getShadow().getTopN(),
                properties.getShadow().getSimulationAlphas());
    }

    public ShadowRerankLogger(boolean enabled, double alpha, int topN) {
        this(enabled, alpha, topN, List.of());
    }

    public ShadowRerankLogger(boolean enabled, double alpha, int topN, List<Double> simulationAlphas) {
        this.enabled = enabled;
        this.alpha = alpha;
        this.topN = Math.max(1, topN);
        this.simulationAlphas = simulationAlphas == null ? List.of() : List.copyOf(simulationAlphas);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void log(FocusedEntity focus, List<RelationGroup> served) {
        if (!enabled) {
            return;
        }
        try {
            if (focus == null || !focus.hasEmbedding()) {
                SHADOW.debug("shadow skipped focus={} reason=focus_embedding_missing",
                        focus == null ? "-" : truncateId(focus.id()));
                return;
            }
            for (RelationGroup group : served) {
                if (group.items().isEmpty()) {
                    continue;
                }
                GroupSummary summary = summarize(focus, group, alpha, topN);
                SHADOW.info("shadow focus={}:{} domain={} alpha={} items={} embedded={} avg_cosine={} median_cosine={} stdev_cosine={} deltas={}",
                        focus.type().value(), truncateId(focus.id()), group.domain().key(),
                        String.format(Locale.ROOT, "%.2f", alpha),
                        summary.items(), summary.embedded(),
                        fmt(summary.meanCosine()), fmt(summary.medianCosine()), fmt(summary.stdevCosine()),
                        summary.deltas());
            }
            if (!simulationAlphas.isEmpty()) {
                logAlphaSimulation(focus, served, simulationAlphas);
            }
        } catch (RuntimeException e) {
            log.warn("[shadow-rerank] Shadow logging failed – {}", e.getMessage());
        }
    }

    /**
     * Pure summary of one group: cosine statistics over embedded items and rank movement of the
     * served top-N under the blended score.
     */
    public static GroupSummary summarize(FocusedEntity focus, RelationGroup group, double alpha, int topN) {
        List<RelationItem> served = group.items();
        List<RelationItem> blended = ShadowReranker.rankBlended(served, focus, alpha);

        List<Double> cosines = new ArrayList<>();
        for (RelationItem item : blended) {
            if (item.cosine() != null) {
                cosines.add(item.cosine());
            }
        }

        Map<String, Integer> blendedRank = new HashMap<>();
        for (int i = 0; i < blended.size(); i++) {
            blendedRank.putIfAbsent(key(blended.get(i)), i);
        }
        List<RankDelta> deltas = new ArrayList<>();
        for (int i = 0; i < Math.min(topN, served.size()); i++) {
            RelationItem item = served.get(i);
            int shadowRank = blendedRank.getOrDefault(key(item), i);
            deltas.add(new RankDelta(truncateId(item.entityId()), i + 1, shadowRank + 1));
        }

        return new GroupSummary(served.size(), cosines.size(), mean(cosines), median(cosines), stdev(cosines), deltas);
    }

    /**
     * Logs the would-be top-N ordering of each group under every given alpha, so a rollout alpha
     * can be picked from production traffic.
     */
    public void logAlphaSimulation(FocusedEntity focus, List<RelationGroup> served, List<Double> alphas) {
        if (!enabled || focus == null || !focus.hasEmbedding()) {
            return;
        }
        for (RelationGroup group : served) {
            if (group.items().isEmpty()) {
                continue;
            }
            for (Double a : alphas) {
                if (a == null) {
                    continue;
                }
                List<String> order = simulateOrder(focus, group, a, topN);
                SHADOW.info("shadow_sim focus={}:{} domain={} alpha={} moved={} order={}",
                        focus.type().value(), truncateId(focus.id()), group.domain().key(), a,
                        changedPositions(group.items(), ShadowReranker.rankBlended(group.items(), focus, a)),
                        order);
            }
        }
    }

    /** Truncated ids of the first {@code topN} items as the blended score would order them. */
    public static List<String> simulateOrder(FocusedEntity focus, RelationGroup group, double alpha, int topN) {
        return ShadowReranker.rankBlended(group.items(), focus, alpha).stream()
                .limit(Math.max(1, topN))
                .map(item -> truncateId(item.entityId()))
                .toList();
    }

    /**
     * How many items the blended score would move relative to the FK-only order, over all groups.
     */
    public static RerankEffectiveness effectiveness(FocusedEntity focus, List<RelationGroup> groups, double alpha) {
        if (focus == null || !focus.hasEmbedding()) {
            return RerankEffectiveness.failed(RerankEffectiveness.NO_FOCUSED_EMBEDDING);
        }
        int total = 0;
        int embedded = 0;
        int changed = 0;
        for (RelationGroup group : groups == null ? List.<RelationGroup>of() : groups) {
            List<RelationItem> fkOnly = ShadowReranker.rankFkOnly(group.items());
            total += fkOnly.size();
            embedded += (int) fkOnly.stream().filter(RelationItem::hasEmbedding).count();
            changed += changedPositions(fkOnly, ShadowReranker.rankBlended(group.items(), focus, alpha));
        }
        if (total == 0) {
            return RerankEffectiveness.failed(RerankEffectiveness.NO_ITEMS);
        }
        return new RerankEffectiveness(alpha, total, embedded, changed, null);
    }

    private static int changedPositions(List<RelationItem> before, List<RelationItem> after) {
        int changed = 0;
        for (int i = 0; i < Math.min(before.size(), after.size()); i++) {
            if (!key(before.get(i)).equals(key(after.get(i)))) {
                changed++;
            }
        }
        return changed;
    }

    public static String truncateId(String id) {
        if (id == null) {
            return "-";
        }
        return id.length() <= ID_PREFIX ? id : id.substring(0, ID_PREFIX) + "...";
    }

    private static String key(RelationItem item) {
        return item.entityType().value() + ":" + item.entityId();
    }

    private static String fmt(Double value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "%.3f", value);
    }

    private static Double mean(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static Double median(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        List<Double> sorted = values.stream().sorted().toList();
        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 1 ? sorted.get(mid) : (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    private static Double stdev(List<Double> values) {
        Double mean = mean(values);
        if (mean == null) {
            return null;
        }
        double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / values.size();
        return Math.sqrt(variance);
    }

    public record RankDelta(String id, int servedRank, int shadowRank) {

        public int delta() {
            return servedRank - shadowRank;
        }

        @Override
        public String toString() {
            return id + "@" + servedRank + "->" + shadowRank;
        }
    }

    public record GroupSummary(int items, int embedded, Double meanCosine, Double medianCosine,
                               Double stdevCosine, List<RankDelta> deltas) {
    }

    public record RerankEffectiveness(double alpha, int totalItems, int embeddedItems,
                                      int itemsChangedPosition, String error) {

        public static final String NO_FOCUSED_EMBEDDING = "no_focused_embedding";
        public static final String NO_ITEMS = "no_items";

        static RerankEffectiveness failed(String error) {
            return new RerankEffectiveness(0.0, 0, 0, 0, error);
        }

        public boolean ok() {
            return error == null;
        }
    }
}
