package com.requestpool.bridge;

import com.requestpool.exception.ConfigurationException;
import com.requestpool.exception.PolicyServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.Objects;

/**
 * In-process bridge to a policy service class loaded by name.
 * <p>
 * The class must expose:
 * <pre>
 * public &lt;init&gt;(String allocationPath, String llamaSitePath)
 * public void start()
 * public byte[] resolveRequestPool(byte[] params)
 * public byte[] getPoolConfig(byte[] params)
 * </pre>
 * All four are bound once by {@link #bind}. The constructed service instance is held for the
 * lifetime of the client; there is no refresh or teardown.
 */
public final class ReflectivePolicyServiceClient implements PolicyServiceClient {

    private static final Logger log = LoggerFactory.getLogger(ReflectivePolicyServiceClient.class);

    static final MethodType CTOR_TYPE = MethodType.methodType(void.class, String.class, String.class);
    static final MethodType START_TYPE = MethodType.methodType(void.class);
    static final MethodType CALL_TYPE = MethodType.methodType(byte[].class, byte[].class);

    private final String className;
    private final Object service;
    private final MethodHandle resolveRequestPool;
    private final MethodHandle getPoolConfig;

    private ReflectivePolicyServiceClient(String className, Object service,
                                          MethodHandle resolveRequestPool, MethodHandle getPoolConfig) {
        this.className = className;
        this.service = service;
        this.resolveRequestPool = resolveRequestPool;
        this.getPoolConfig = getPoolConfig;
    }

    /**
     * Load the policy service class, bind its entry points, construct it and start it.
     *
     * @param className      Fully qualified policy service class name
     * @param classLoader    Loader to resolve the class with
     * @param allocationPath Fair scheduler allocation file path
     * @param llamaSitePath  Llama site file path, may be empty
     * @return Started client
     * @throws ConfigurationException if any entry point is missing or construction or start fails
     */
    public static ReflectivePolicyServiceClient bind(String className, ClassLoader classLoader,
                                                     String allocationPath, String llamaSitePath) {
        Objects.requireNonNull(className, "className");
        if (classLoader == null) {
            classLoader = ReflectivePolicyServiceClient.class.getClassLoader();
        }
        log.info("Binding policy service {}", className);

        Class<?> serviceClass;
        try {
            serviceClass = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ConfigurationException("Policy service class not found: " + className, e);
        }

        MethodHandles.Lookup lookup = MethodHandles.publicLookup();
        MethodHandle ctor = findConstructor(lookup, serviceClass);
        MethodHandle start = findMethod(lookup, serviceClass, "start", START_TYPE);
        MethodHandle resolve = findMethod(lookup, serviceClass, "resolveRequestPool", CALL_TYPE);
        MethodHandle config = findMethod(lookup, serviceClass, "getPoolConfig", CALL_TYPE);

        Object service;
        try {
            service = ctor.invoke(allocationPath, llamaSitePath);
        } catch (Throwable t) {
            throw new ConfigurationException("Failed to construct policy service " + className, t);
        }
        try {
            start.invoke(service);
        } catch (Throwable t) {
            throw new ConfigurationException("Failed to start policy service " + className, t);
        }

        log.info("Policy service {} started with allocation={}, llama-site={}",
                className, allocationPath, llamaSitePath);
        return new ReflectivePolicyServiceClient(className, service, resolve, config);
    }

    @Override
    public byte[] resolveRequestPool(byte[] params) {
        return call(resolveRequestPool, "resolveRequestPool", params);
    }

    @Override
    public byte[] getPoolConfig(byte[] params) {
        return call(getPoolConfig, "getPoolConfig", params);
    }

    public String getClassName() {
        return className;
    }

    private byte[] call(MethodHandle method, String name, byte[] params) {
        try {
            return (byte[]) method.invoke(service, params);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            throw new PolicyServiceException(className + "." + name + " failed: " + t.getMessage(), t);
        }
    }

    private static MethodHandle findConstructor(MethodHandles.Lookup lookup, Class<?> serviceClass) {
        try {
            return lookup.findConstructor(serviceClass, CTOR_TYPE);
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new ConfigurationException("Policy service " + serviceClass.getName()
                    + " has no public (String, String) constructor", e);
        }
    }

    private static MethodHandle findMethod(MethodHandles.Lookup lookup, Class<?> serviceClass,
                                           String name, MethodType type) {
        try {
            return lookup.findVirtual(serviceClass, name, type);
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new ConfigurationException("Policy service " + serviceClass.getName()
                    + " has no public method " + name + type, e);
        }
    }
}
