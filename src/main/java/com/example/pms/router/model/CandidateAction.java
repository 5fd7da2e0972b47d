package com.example.pms.router.model;

import java.util.Set;

/**
 * An operation the caller may invoke for one of the extracted entities.
 */
public record CandidateAction(String actionId,
                              String label,
                              ActionVariant variant,
                              Set<String> allowedRoles,
                              boolean requiresSignature,
                              EntityType entityType,
                              String entityText) {
}
