package com.example.pms.router.capability;

import com.example.pms.router.model.ActionVariant;

import java.util.Set;

/**
 * Registry metadata for one action.
 *
 * @param tenantScope tenants the action is enabled for; empty means every tenant
 */
public record Capability(String actionId,
                         String label,
                         String domain,
                         ActionVariant variant,
                         Set<String> allowedRoles,
                         boolean requiresSignature,
                         Set<String> tenantScope) {

    public Capability {
        allowedRoles = allowedRoles == null ? Set.of() : Set.copyOf(allowedRoles);
        tenantScope = tenantScope == null ? Set.of() : Set.copyOf(tenantScope);
    }

    public boolean allowsRole(String role) {
        return role != null && allowedRoles.contains(role);
    }

    public boolean enabledFor(String tenantId) {
        return tenantScope.isEmpty() || tenantScope.contains(tenantId);
    }
}
