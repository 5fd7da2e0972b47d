package com.example.pms.router.model;

/**
 * Coarse processing lane for an incoming query, from most to least restrictive.
 */
public enum Lane {
    /** Rejected outright: no extraction, no model call. */
    BLOCKED,
    /** Strong domain shapes; deterministic lookups only. */
    NO_LLM,
    /** Recognized domain vocabulary; pattern extraction only. */
    RULES_ONLY,
    /** Free-form phrasing; model-assisted extraction allowed. */
    GPT
}
