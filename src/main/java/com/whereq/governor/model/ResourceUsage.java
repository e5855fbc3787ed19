package com.whereq.governor.model;

import lombok.Value;

/**
 * Represents a resource load: observed, reserved or projected
 */
@Value
public class ResourceUsage {
    public static final ResourceUsage ZERO = new ResourceUsage(0, 0, 0);

    /**
     * CPU in percent
     */
    double cpuPercent;

    /**
     * Host memory in MB
     */
    double memMb;

    /**
     * Accelerator memory in MB
     */
    double accelMemMb;

    /**
     * Add two resource usages
     */
    public ResourceUsage add(ResourceUsage other) {
        return new ResourceUsage(
            this.cpuPercent + other.cpuPercent,
            this.memMb + other.memMb,
            this.accelMemMb + other.accelMemMb
        );
    }

    /**
     * Create from an observed metrics snapshot
     */
    public static ResourceUsage of(MetricsSnapshot snapshot) {
        return new ResourceUsage(snapshot.getCpuPercent(), snapshot.getMemMb(), snapshot.getAccelMemMb());
    }
}
