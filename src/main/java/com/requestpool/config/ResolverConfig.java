package com.requestpool.config;

/**
 * Startup configuration for the pool resolver.
 *
 * @param fairSchedulerAllocationPath Path to the fair scheduler allocation file (fair-scheduler.xml),
 *                                    either absolute or relative to the policy service's classpath
 * @param llamaSitePath               Path to the Llama configuration file (llama-site.xml). If set,
 *                                    fairSchedulerAllocationPath must also be set
 * @param defaultPoolMaxRequests      Maximum concurrent requests in the default pool. Negative means no limit.
 *                                    Ignored when the policy files are set
 * @param defaultPoolMemLimit         Memory limit spec of the default pool, see {@link MemSpecParser}.
 *                                    Empty or -1 means no limit. Ignored when the policy files are set
 * @param defaultPoolMaxQueued        Maximum queued requests in the default pool. Zero or negative means
 *                                    requests are rejected once maxRequests are running.
 *                                    Ignored when the policy files are set
 * @param policyServiceClass          Class bound by the bridge when the policy files are set
 */
public record ResolverConfig(
        String fairSchedulerAllocationPath,
        String llamaSitePath,
        long defaultPoolMaxRequests,
        String defaultPoolMemLimit,
        long defaultPoolMaxQueued,
        String policyServiceClass
) {
    public static final long DEFAULT_MAX_REQUESTS = -1;
    public static final String DEFAULT_MEM_LIMIT = "";
    public static final long DEFAULT_MAX_QUEUED = 0;
    public static final String DEFAULT_POLICY_SERVICE_CLASS = "com.cloudera.impala.util.RequestPoolUtils";

    public ResolverConfig {
        fairSchedulerAllocationPath = fairSchedulerAllocationPath == null ? "" : fairSchedulerAllocationPath;
        llamaSitePath = llamaSitePath == null ? "" : llamaSitePath;
        defaultPoolMemLimit = defaultPoolMemLimit == null ? DEFAULT_MEM_LIMIT : defaultPoolMemLimit;
        if (policyServiceClass == null || policyServiceClass.isBlank()) {
            policyServiceClass = DEFAULT_POLICY_SERVICE_CLASS;
        }
    }

    /**
     * True when no policy file is configured and every request goes to the default pool.
     */
    public boolean defaultPoolOnly() {
        return fairSchedulerAllocationPath.isEmpty() && llamaSitePath.isEmpty();
    }

    /**
     * Default-only configuration with every default-pool limit at its default.
     */
    public static ResolverConfig defaults() {
        return new ResolverConfig("", "", DEFAULT_MAX_REQUESTS, DEFAULT_MEM_LIMIT,
                DEFAULT_MAX_QUEUED, DEFAULT_POLICY_SERVICE_CLASS);
    }

    /**
     * Default-only configuration with the given default-pool limits.
     */
    public static ResolverConfig defaultPool(long maxRequests, String memLimit, long maxQueued) {
        return new ResolverConfig("", "", maxRequests, memLimit, maxQueued, DEFAULT_POLICY_SERVICE_CLASS);
    }

    /**
     * Delegated configuration bound to the given policy service class.
     */
    public static ResolverConfig delegated(String allocationPath, String llamaSitePath, String policyServiceClass) {
        return new ResolverConfig(allocationPath, llamaSitePath, DEFAULT_MAX_REQUESTS, DEFAULT_MEM_LIMIT,
                DEFAULT_MAX_QUEUED, policyServiceClass);
    }
}
