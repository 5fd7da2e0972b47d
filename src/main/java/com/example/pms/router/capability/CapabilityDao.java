package com.example.pms.router.capability;

import com.example.pms.router.model.EntityType;

import java.util.List;
import java.util.Map;

/**
 * Read-only source of the capability registry.
 */
public interface CapabilityDao {

    CapabilityCatalog loadCatalog();

    /**
     * @param mappings entity type to action ids, in presentation order
     */
    record CapabilityCatalog(String version, List<Capability> capabilities, Map<EntityType, List<String>> mappings) {}
}
