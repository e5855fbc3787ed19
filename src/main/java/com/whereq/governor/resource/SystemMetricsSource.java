package com.whereq.governor.resource;

import com.whereq.governor.model.MetricsSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;
import java.util.OptionalDouble;

/**
 * Metrics source backed by the JVM management beans.
 * Reports system CPU load and used physical memory; accelerator memory is not visible
 * from the JVM and is always reported as zero.
 */
@Slf4j
public class SystemMetricsSource implements MetricsSource {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
    private final Clock clock;

    public SystemMetricsSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public MetricsSnapshot poll() {
        return MetricsSnapshot.builder()
            .cpuPercent(cpuPercent())
            .memMb(usedPhysicalMemoryMb())
            .accelMemMb(0.0)
            .observedAt(clock.instant())
            .build();
    }

    @Override
    public OptionalDouble currentMemoryMb() {
        long heapUsed = memory.getHeapMemoryUsage().getUsed();
        return OptionalDouble.of(heapUsed / BYTES_PER_MB);
    }

    private double cpuPercent() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            double load = sunOs.getCpuLoad();
            if (load >= 0) {
                return load * 100.0;
            }
        }
        // Fall back to load average per core
        double loadAverage = os.getSystemLoadAverage();
        if (loadAverage < 0) {
            return 0.0;
        }
        return Math.min(100.0, loadAverage / Math.max(1, os.getAvailableProcessors()) * 100.0);
    }

    private double usedPhysicalMemoryMb() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            long total = sunOs.getTotalMemorySize();
            long free = sunOs.getFreeMemorySize();
            return Math.max(0, total - free) / BYTES_PER_MB;
        }
        log.debug("Physical memory not exposed by {}, reporting JVM heap instead", os.getClass().getName());
        return memory.getHeapMemoryUsage().getUsed() / BYTES_PER_MB;
    }
}
