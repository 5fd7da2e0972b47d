package com.example.pms.router.capability;

import com.example.pms.router.model.ActionVariant;
import com.example.pms.router.model.EntityType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Action table resolved once at start-up: action id to metadata, entity type to ordered
 * capabilities. Loading fails if a SIGNED action has no allowed roles or a mapping references an
 * unknown action.
 */
@Slf4j
public final class CapabilityRegistry {

    private final String version;
    private final Map<String, Capability> byActionId;
    private final Map<EntityType, List<Capability>> byEntityType;

    private CapabilityRegistry(String version,
                               Map<String, Capability> byActionId,
                               Map<EntityType, List<Capability>> byEntityType) {
        this.version = version;
        this.byActionId = byActionId;
        this.byEntityType = byEntityType;
    }

    public static CapabilityRegistry from(CapabilityDao.CapabilityCatalog catalog) {
        Map<String, Capability> byId = new LinkedHashMap<>();
        for (Capability c : catalog.capabilities()) {
            Capability normalized = normalize(c);
            if (byId.putIfAbsent(normalized.actionId(), normalized) != null) {
                throw new IllegalStateException("Duplicate capability id: " + c.actionId());
            }
        }

        Map<EntityType, List<Capability>> byType = new EnumMap<>(EntityType.class);
        catalog.mappings().forEach((type, actionIds) -> {
            List<Capability> resolved = new ArrayList<>(actionIds.size());
            for (String actionId : actionIds) {
                Capability c = byId.get(actionId);
                if (c == null) {
                    throw new IllegalStateException("Mapping for " + type + " references unknown action " + actionId);
                }
                resolved.add(c);
            }
            byType.put(type, List.copyOf(resolved));
        });

        CapabilityRegistry registry = new CapabilityRegistry(catalog.version(), Map.copyOf(byId), byType);
        log.info("[capability-registry] Loaded version={} actions={} entityTypes={}",
                catalog.version(), byId.size(), byType.size());
        return registry;
    }

    private static Capability normalize(Capability c) {
        if (c.variant() == ActionVariant.SIGNED) {
            if (c.allowedRoles().isEmpty()) {
                throw new IllegalStateException("SIGNED action " + c.actionId() + " must declare allowed roles");
            }
            if (!c.requiresSignature()) {
                return new Capability(c.actionId(), c.label(), c.domain(), c.variant(), c.allowedRoles(), true, c.tenantScope());
            }
        }
        return c;
    }

    public String version() {
        return version;
    }

    public Optional<Capability> find(String actionId) {
        return Optional.ofNullable(byActionId.get(actionId));
    }

    public List<Capability> forEntityType(EntityType type) {
        return byEntityType.getOrDefault(type, List.of());
    }

    public Collection<Capability> all() {
        return byActionId.values();
    }
}
