package com.example.pms.router.capability;

import com.example.pms.router.config.RouterProperties;
import com.example.pms.router.model.ActionVariant;
import com.example.pms.router.model.EntityType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the registry from a JSON resource ({@code router.capabilities.location}).
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ClasspathCapabilityDao implements CapabilityDao {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final RouterProperties properties;

    @Override
    public CapabilityCatalog loadCatalog() {
        String location = properties.getCapabilities().getLocation();
        try (InputStream in = resourceLoader.getResource(location).getInputStream()) {
            return toCatalog(objectMapper.readValue(in, CatalogJson.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read capability registry from " + location, e);
        }
    }

    static CapabilityCatalog toCatalog(CatalogJson json) {
        List<Capability> capabilities = new ArrayList<>();
        if (json.capabilities != null) {
            for (CapabilityJson c : json.capabilities) {
                if (c == null || c.actionId == null || c.actionId.isBlank()) {
                    continue;
                }
                ActionVariant variant = ActionVariant.valueOf(c.variant == null ? "READ" : c.variant.trim().toUpperCase(Locale.ROOT));
                capabilities.add(new Capability(
                        c.actionId.trim(),
                        c.label == null ? c.actionId.trim() : c.label,
                        c.domain,
                        variant,
                        lower(c.allowedRoles),
                        Boolean.TRUE.equals(c.requiresSignature),
                        c.tenantScope == null ? Set.of() : Set.copyOf(c.tenantScope)));
            }
        }

        Map<EntityType, List<String>> mappings = new EnumMap<>(EntityType.class);
        if (json.mappings != null) {
            for (MappingJson m : json.mappings) {
                EntityType type = m == null ? null : EntityType.fromName(m.entityType);
                if (type == null) {
                    log.warn("[capability-registry] skipping mapping for unknown entity type '{}'", m == null ? null : m.entityType);
                    continue;
                }
                mappings.put(type, m.actions == null ? List.of() : List.copyOf(m.actions));
            }
        }
        return new CapabilityCatalog(json.version, capabilities, mappings);
    }

    private static Set<String> lower(List<String> roles) {
        Set<String> out = new LinkedHashSet<>();
        if (roles != null) {
            for (String r : roles) {
                if (r != null && !r.isBlank()) {
                    out.add(r.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return out;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CatalogJson {
        public String version;
        public List<CapabilityJson> capabilities;
        public List<MappingJson> mappings;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CapabilityJson {
        public String actionId;
        public String label;
        public String domain;
        public String variant;
        public List<String> allowedRoles;
        public Boolean requiresSignature;
        public List<String> tenantScope;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class MappingJson {
        public String entityType;
        public List<String> actions;
    }
}
