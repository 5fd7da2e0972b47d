package com.example.pms.router.model;

/**
 * How directly a related record is linked to the focus, strongest first.
 */
public enum FkTier {
    /** One foreign-key hop from the focus, or a user-added link. */
    DIRECT,
    /** Shares a parent record with the focus. */
    SAME_PARENT,
    /** Shares a category or code with the focus. */
    SAME_CATEGORY
}
