package com.requestpool.policy;

/**
 * Where pool resolution and pool config lookups are answered.
 */
public enum PolicyMode {
    /**
     * No policy files configured. Every request goes to the default pool with static limits.
     */
    DEFAULT_ONLY,

    /**
     * Lookups are forwarded to the external policy service.
     */
    DELEGATED
}
