package com.example.pms.router.relation;

import com.example.pms.router.config.RouterProperties;
import com.example.pms.router.model.AuthContext;
import com.example.pms.router.model.FkTier;
import com.example.pms.router.model.FocusedEntity;
import com.example.pms.router.model.RelationDomain;
import com.example.pms.router.model.RelationGroup;
import com.example.pms.router.model.RelationItem;
import com.example.pms.router.model.RelationResponse;
import com.example.pms.router.rerank.ShadowRerankLogger;
import com.example.pms.router.rerank.ShadowReranker;
import com.example.pms.router.validation.ErrorCode;
import com.example.pms.router.validation.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Expands a focused record into related records grouped by domain. Every lookup is a single
 * foreign-key hop bound to the caller's tenant; ordering is deterministic for a given store
 * state.
 */
@Slf4j
@Service
public class RelationExpansionEngine {

    private final RelationQueryDao dao;
    private final RelationQueryCatalog catalog;
    private final TierWeights weights;
    private final int limitPerDomain;
    private final double alpha;
    private final ShadowRerankLogger shadowLogger;
    private final Map<String, Set<RelationDomain>> hiddenByRole;

    @Autowired
    public RelationExpansionEngine(RelationQueryDao dao,
                                   RelationQueryCatalog catalog,
                                   TierWeights weights,
                                   ShadowRerankLogger shadowLogger,
                                   RouterProperties properties) {
        this(dao, catalog, weights, shadowLogger,
                properties.getRelations().getLimitPerDomain(),
                properties.getRerank().getAlpha(),
                properties.getRelations().getHiddenDomains());
    }

    public RelationExpansionEngine(RelationQueryDao dao,
                                   RelationQueryCatalog catalog,
                                   TierWeights weights,
                                   ShadowRerankLogger shadowLogger,
                                   int limitPerDomain,
                                   double alpha,
                                   Map<String, List<String>> hiddenDomains) {
        if (alpha < 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("router.rerank.alpha must be within [0, 1], was " + alpha);
        }
        this.dao = dao;
        this.catalog = catalog;
        this.weights = weights;
        this.shadowLogger = shadowLogger;
        this.limitPerDomain = Math.max(1, limitPerDomain);
        this.alpha = alpha;
        this.hiddenByRole = resolveHidden(hiddenDomains);
    }

    public RelationResponse expand(FocusedEntity focus, AuthContext auth) {
        return expand(focus, auth, allowedFor(auth));
    }

    public RelationResponse expand(FocusedEntity focus, AuthContext auth, Set<RelationDomain> allowed) {
        if (auth == null || !auth.hasTenant()) {
            throw new ValidationException(ErrorCode.MISSING_TENANT, "Tenant id is required.");
        }
        if (focus == null || focus.type() == null || focus.id() == null || focus.id().isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST, "Focus type and id are required.");
        }

        List<RelationQuery> queries = catalog.forFocus(focus.type());
        if (queries.isEmpty()) {
            log.debug("[relation-engine] {} for focus type {}", ErrorCode.UNKNOWN_ENTITY, focus.type().value());
            return new RelationResponse(focus.type(), focus.id(), alpha, emptyGroups());
        }

        Map<RelationDomain, Map<String, RelationItem>> collected = new EnumMap<>(RelationDomain.class);
        for (RelationQuery query : queries) {
            if (!allowed.contains(query.domain())) {
                continue;
            }
            for (RelationRow row : runQuery(query, focus, auth.tenantId())) {
                merge(collected, query.domain(), toItem(row, query.tier(), false), focus);
            }
        }
        for (RelationRow row : userAdded(focus, auth.tenantId())) {
            RelationDomain domain = row.type().domain();
            if (allowed.contains(domain)) {
                merge(collected, domain, toItem(row, FkTier.DIRECT, true), focus);
            }
        }

        FocusedEntity scoredFocus = focus;
        if (!focus.hasEmbedding() && (alpha > 0.0 || shadowLogger.isEnabled())) {
            scoredFocus = lookupFocusEmbedding(focus, auth.tenantId());
        }

        List<RelationGroup> groups = new ArrayList<>();
        for (RelationDomain domain : RelationDomain.values()) {
            Map<String, RelationItem> items = collected.get(domain);
            if (items == null || items.isEmpty()) {
                groups.add(RelationGroup.empty(domain));
                continue;
            }
            List<RelationItem> ranked = ShadowReranker.rank(new ArrayList<>(items.values()), scoredFocus, alpha);
            groups.add(new RelationGroup(domain, ranked.size() > limitPerDomain ? ranked.subList(0, limitPerDomain) : ranked));
        }

        shadowLogger.log(scoredFocus, groups);
        return new RelationResponse(focus.type(), focus.id(), alpha, groups);
    }

    public Set<RelationDomain> allowedFor(AuthContext auth) {
        Set<RelationDomain> allowed = EnumSet.allOf(RelationDomain.class);
        if (auth != null && auth.role() != null) {
            allowed.removeAll(hiddenByRole.getOrDefault(auth.role(), Set.of()));
        }
        return allowed;
    }

    private List<RelationRow> runQuery(RelationQuery query, FocusedEntity focus, String tenantId) {
        try {
            return dao.fetch(query, focus.id(), tenantId, limitPerDomain);
        } catch (DataAccessException e) {
            log.warn("[relation-engine] Query {} failed, domain {} degraded – {}",
                    query.name(), query.domain().key(), e.getMessage());
            return List.of();
        }
    }

    private List<RelationRow> userAdded(FocusedEntity focus, String tenantId) {
        try {
            return dao.fetchUserAdded(focus.type(), focus.id(), tenantId, limitPerDomain);
        } catch (DataAccessException e) {
            log.warn("[relation-engine] User-added relations unavailable – {}", e.getMessage());
            return List.of();
        }
    }

    private FocusedEntity lookupFocusEmbedding(FocusedEntity focus, String tenantId) {
        try {
            Optional<float[]> embedding = dao.findEmbedding(focus.type(), focus.id(), tenantId);
            if (embedding.isEmpty()) {
                log.debug("[relation-engine] {} for focus {}", ErrorCode.EMBEDDING_UNAVAILABLE,
                        ShadowRerankLogger.truncateId(focus.id()));
                return focus;
            }
            return focus.withEmbedding(embedding.get());
        } catch (DataAccessException e) {
            log.warn("[relation-engine] Focus embedding lookup failed – {}", e.getMessage());
            return focus;
        }
    }

    private RelationItem toItem(RelationRow row, FkTier tier, boolean userAdded) {
        return RelationItem.of(row.type(), row.id(), tier, weights.weightOf(tier), row.occurredAt(), row.embedding(), userAdded);
    }

    private static void merge(Map<RelationDomain, Map<String, RelationItem>> collected,
                              RelationDomain domain, RelationItem item, FocusedEntity focus) {
        if (item.entityId() == null
                || (item.entityType() == focus.type() && item.entityId().equals(focus.id()))) {
            return;
        }
        Map<String, RelationItem> items = collected.computeIfAbsent(domain, d -> new LinkedHashMap<>());
        String key = item.entityType().value() + ":" + item.entityId();
        RelationItem existing = items.get(key);
        if (existing == null || item.tier().ordinal() < existing.tier().ordinal()) {
            items.put(key, item);
        }
    }

    private static List<RelationGroup> emptyGroups() {
        List<RelationGroup> groups = new ArrayList<>();
        for (RelationDomain domain : RelationDomain.values()) {
            groups.add(RelationGroup.empty(domain));
        }
        return groups;
    }

    private static Map<String, Set<RelationDomain>> resolveHidden(Map<String, List<String>> hiddenDomains) {
        if (hiddenDomains == null || hiddenDomains.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Set<RelationDomain>> resolved = new LinkedHashMap<>();
        hiddenDomains.forEach((role, keys) -> {
            Set<RelationDomain> domains = EnumSet.noneOf(RelationDomain.class);
            if (keys != null) {
                keys.forEach(k -> domains.add(RelationDomain.fromKey(k)));
            }
            resolved.put(role.trim().toLowerCase(Locale.ROOT), domains);
        });
        return Map.copyOf(resolved);
    }
}
