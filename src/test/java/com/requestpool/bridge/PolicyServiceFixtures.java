package com.requestpool.bridge;

import com.requestpool.model.PoolConfigParams;
import com.requestpool.model.PoolConfigResult;
import com.requestpool.model.ResolveRequestPoolParams;
import com.requestpool.model.ResolveRequestPoolResult;
import com.requestpool.wire.WireCodec;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Policy service classes bound by name in tests.
 */
public final class PolicyServiceFixtures {

    private PolicyServiceFixtures() {
    }

    /**
     * Places requests under "root." and denies the user "mallory".
     * Pools named "root.small" get tight limits; every other pool is unlimited.
     */
    public static class Placing {

        public static final AtomicInteger STARTS = new AtomicInteger();
        public static volatile String lastAllocationPath;
        public static volatile String lastLlamaSitePath;

        private final WireCodec codec = new WireCodec();
        private boolean started;

        public Placing(String allocationPath, String llamaSitePath) {
            lastAllocationPath = allocationPath;
            lastLlamaSitePath = llamaSitePath;
        }

        public void start() {
            started = true;
            STARTS.incrementAndGet();
        }

        public byte[] resolveRequestPool(byte[] bytes) {
            if (!started) {
                throw new IllegalStateException("not started");
            }
            ResolveRequestPoolParams params = codec.decode(bytes, ResolveRequestPoolParams.class);
            String requested = params.requestedPool();
            String pool;
            if (requested == null || requested.isEmpty()) {
                pool = "root." + params.user();
            } else if (requested.startsWith("root.")) {
                pool = requested;
            } else {
                pool = "root." + requested;
            }
            return codec.encode(new ResolveRequestPoolResult(pool, !"mallory".equals(params.user())));
        }

        public byte[] getPoolConfig(byte[] bytes) {
            PoolConfigParams params = codec.decode(bytes, PoolConfigParams.class);
            if ("root.small".equals(params.pool())) {
                return codec.encode(new PoolConfigResult(2, 4, 1024L * 1024L * 1024L));
            }
            return codec.encode(new PoolConfigResult(-1, 200, -1));
        }
    }

    /**
     * Starts, then fails every lookup.
     */
    public static class Failing {

        public Failing(String allocationPath, String llamaSitePath) {
        }

        public void start() {
        }

        public byte[] resolveRequestPool(byte[] bytes) {
            throw new IllegalStateException("allocation file is unreadable");
        }

        public byte[] getPoolConfig(byte[] bytes) {
            return new WireCodec().encode("not a pool config");
        }
    }

    public static class FailingStart {

        public FailingStart(String allocationPath, String llamaSitePath) {
        }

        public void start() {
            throw new IllegalArgumentException("no such file: fair-scheduler.xml");
        }

        public byte[] resolveRequestPool(byte[] bytes) {
            return bytes;
        }

        public byte[] getPoolConfig(byte[] bytes) {
            return bytes;
        }
    }

    public static class FailingConstructor {

        public FailingConstructor(String allocationPath, String llamaSitePath) {
            throw new IllegalStateException("cannot read " + allocationPath);
        }

        public void start() {
        }

        public byte[] resolveRequestPool(byte[] bytes) {
            return bytes;
        }

        public byte[] getPoolConfig(byte[] bytes) {
            return bytes;
        }
    }

    /**
     * Lacks getPoolConfig(byte[]).
     */
    public static class MissingConfigMethod {

        public MissingConfigMethod(String allocationPath, String llamaSitePath) {
        }

        public void start() {
        }

        public byte[] resolveRequestPool(byte[] bytes) {
            return bytes;
        }
    }

    /**
     * Lacks the (String, String) constructor.
     */
    public static class NoArgConstructor {

        public NoArgConstructor() {
        }

        public void start() {
        }

        public byte[] resolveRequestPool(byte[] bytes) {
            return bytes;
        }

        public byte[] getPoolConfig(byte[] bytes) {
            return bytes;
        }
    }
}
