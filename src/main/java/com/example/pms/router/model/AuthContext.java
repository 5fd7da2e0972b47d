package com.example.pms.router.model;

import java.util.Locale;

/**
 * Resolved caller identity. Authentication happens upstream; this is trusted as given.
 */
public record AuthContext(String userId, String tenantId, String role) {

    public AuthContext {
        role = role == null ? null : role.trim().toLowerCase(Locale.ROOT);
    }

    public boolean hasTenant() {
        return tenantId != null && !tenantId.isBlank();
    }
}
