package com.whereq.governor.resource;

import com.whereq.governor.model.ResourceRequirement;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calculate a declared cost from an opaque job payload.
 *
 * Reads the {@code perf} section of the payload:
 * <pre>
 * { "perf": { "cpu_percent": 25, "ram_mb": "2g", "vram_mb": 1024 } }
 * </pre>
 * Memory values may be numbers (MB) or strings with a {@code g}, {@code m} or {@code k} suffix.
 */
@Slf4j
public class ResourceCalculator {

    public static final String PERF_SECTION = "perf";

    private static final List<String> CPU_KEYS = List.of("cpu_percent", "cpu");
    private static final List<String> MEM_KEYS = List.of("ram_mb", "memory_mb", "mem_mb");
    private static final List<String> ACCEL_KEYS = List.of("vram_mb", "gpu_mem_mb", "accel_mem_mb");

    private static final Pattern MEMORY_PATTERN = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*([gmk])?b?", Pattern.CASE_INSENSITIVE);

    /**
     * Calculate the declared cost of a payload
     *
     * @param payload job payload, may be null
     * @return declared cost; {@link ResourceRequirement#NONE} when the payload has no perf section
     */
    public ResourceRequirement calculate(Map<String, ?> payload) {
        if (payload == null || !(payload.get(PERF_SECTION) instanceof Map<?, ?> perf)) {
            return ResourceRequirement.NONE;
        }

        double cpu = clamp(parseNumber(first(perf, CPU_KEYS)));
        double mem = clamp(parseMemory(first(perf, MEM_KEYS)));
        double accel = clamp(parseMemory(first(perf, ACCEL_KEYS)));

        log.debug("Calculated declared cost: cpu={}%, mem={}MB, accel={}MB", cpu, mem, accel);

        return ResourceRequirement.of(cpu, mem, accel);
    }

    /**
     * Parse memory (e.g., 512, "2g", "2048m", "2048000k") to MB
     *
     * @param memory memory value
     * @return memory in MB, 0 when absent or unparseable
     */
    double parseMemory(Object memory) {
        if (memory == null) {
            return 0.0;
        }
        if (memory instanceof Number number) {
            return number.doubleValue();
        }
        Matcher matcher = MEMORY_PATTERN.matcher(memory.toString().trim());
        if (!matcher.matches()) {
            log.warn("Invalid memory format: {}, using 0", memory);
            return 0.0;
        }

        double value = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2);

        if (unit == null) {
            return value; // Assume MB if no unit
        }

        return switch (unit.toLowerCase(Locale.ROOT)) {
            case "g" -> value * 1024;
            case "k" -> value / 1024;
            default -> value;
        };
    }

    private double parseNumber(Object value) {
        if (value == null) {
            return 0.0;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim().replace("%", ""));
        } catch (NumberFormatException e) {
            log.warn("Invalid number: {}, using 0", value);
            return 0.0;
        }
    }

    private static Object first(Map<?, ?> section, List<String> keys) {
        for (String key : keys) {
            Object value = section.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return Math.max(value, 0.0);
    }
}
