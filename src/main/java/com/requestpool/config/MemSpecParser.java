package com.requestpool.config;

import com.requestpool.exception.ConfigurationException;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.function.LongSupplier;

/**
 * Parses memory limit specifications.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>{@code <int>[bB]?} - bytes</li>
 *   <li>{@code <float>[mM]} - megabytes</li>
 *   <li>{@code <float>[gG]} - gigabytes</li>
 *   <li>{@code <int>%} - percentage of physical memory</li>
 * </ul>
 * An empty spec or a value of -1 bytes means no limit and parses to 0.
 */
public final class MemSpecParser {

    private static final long MEGABYTE = 1024L * 1024L;
    private static final long GIGABYTE = 1024L * MEGABYTE;
    private static final double LONG_RANGE = 0x1p63;

    private final LongSupplier physicalMemory;

    public MemSpecParser() {
        this(MemSpecParser::physicalMemoryBytes);
    }

    /**
     * @param physicalMemory Supplies total physical memory in bytes, used for percentage specs
     */
    public MemSpecParser(LongSupplier physicalMemory) {
        this.physicalMemory = physicalMemory;
    }

    /**
     * Parse a memory limit spec.
     *
     * @param spec Memory limit spec, may be null or empty
     * @return Limit in bytes, 0 when unset or unlimited
     * @throws ConfigurationException if the spec is malformed or negative
     */
    public long parse(String spec) {
        if (spec == null || spec.isEmpty()) {
            return 0;
        }

        long multiplier = -1;
        boolean percent = false;
        int numberLength = spec.length() - 1;
        switch (spec.charAt(spec.length() - 1)) {
            case 'g', 'G' -> multiplier = GIGABYTE;
            case 'm', 'M' -> multiplier = MEGABYTE;
            case 'b', 'B' -> { }
            case '%' -> percent = true;
            default -> numberLength = spec.length();
        }
        String number = spec.substring(0, numberLength);

        long bytes;
        if (multiplier != -1) {
            bytes = toBytes(spec, multiplier * parseDouble(spec, number));
        } else {
            long value = parseLong(spec, number);
            bytes = percent ? toBytes(spec, value / 100.0 * physicalMemory.getAsLong()) : value;
        }

        // -1 is accepted as "no limit"
        if (bytes == -1) {
            return 0;
        }
        if (bytes < 0) {
            throw new ConfigurationException("Invalid memory limit '" + spec + "': value is negative");
        }
        return bytes;
    }

    // Casting to long would clamp out-of-range values to Long.MAX_VALUE
    private static long toBytes(String spec, double bytes) {
        if (!Double.isFinite(bytes) || bytes >= LONG_RANGE) {
            throw malformed(spec);
        }
        return (long) bytes;
    }

    private static double parseDouble(String spec, String number) {
        // Double.parseDouble accepts forms like "1e3", "NaN" and "0x1p3"
        if (number.isEmpty() || !number.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)")) {
            throw malformed(spec);
        }
        return Double.parseDouble(number);
    }

    private static long parseLong(String spec, String number) {
        try {
            return Long.parseLong(number);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid memory limit '" + spec + "'", e);
        }
    }

    private static ConfigurationException malformed(String spec) {
        return new ConfigurationException("Invalid memory limit '" + spec + "'");
    }

    private static long physicalMemoryBytes() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            return sunOs.getTotalMemorySize();
        }
        throw new ConfigurationException("Physical memory size is not available on this JVM");
    }
}
