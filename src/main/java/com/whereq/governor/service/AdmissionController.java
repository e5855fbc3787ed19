package com.whereq.governor.service;

import com.whereq.governor.model.BudgetLimits;
import com.whereq.governor.model.ResourceRequirement;
import com.whereq.governor.model.ResourceUsage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Admission control for job submissions.
 * Decides whether to admit, delay, or reject jobs based on projected load.
 *
 * Not thread-safe on its own; callers evaluate under the governor lock so that the
 * reserved load and job counts they pass in cannot change underneath the decision.
 */
@Slf4j
public class AdmissionController {

    private final Counter admittedCounter;
    private final Counter delayedCounter;
    private final Counter rejectedCounter;

    public AdmissionController(MeterRegistry meterRegistry) {
        admittedCounter = Counter.builder("governor.admission.queued")
            .description("Number of jobs admitted at registration")
            .register(meterRegistry);

        delayedCounter = Counter.builder("governor.admission.delayed")
            .description("Number of jobs delayed for later admission")
            .register(meterRegistry);

        rejectedCounter = Counter.builder("governor.admission.rejected")
            .description("Number of jobs rejected due to full delayed queue")
            .register(meterRegistry);
    }

    /**
     * Decide on a new registration
     *
     * @param jobId job identifier, for logging
     * @param requirement declared cost of the new job
     * @param observed load reported by the metrics source
     * @param reserved declared cost of all queued and running jobs
     * @param holdingCount number of queued and running jobs
     * @param delayedCount number of delayed jobs
     * @param limits active limits
     * @return ADMIT, QUEUE (delay) or REJECT, with the blocking limit as reason
     */
    public Verdict admitJob(String jobId, ResourceRequirement requirement, ResourceUsage observed,
                            ResourceUsage reserved, int holdingCount, int delayedCount, BudgetLimits limits) {
        Verdict verdict = evaluate(requirement, observed, reserved, holdingCount, limits);

        if (verdict.isAdmitted()) {
            admittedCounter.increment();
            log.info("Job {} admitted: resources available ({})", jobId, summary(observed, reserved, holdingCount, limits));
            return verdict;
        }

        if (delayedCount < limits.getMaxQueueDepth()) {
            delayedCounter.increment();
            log.info("Job {} delayed: {} ({})", jobId, verdict.getReason(), summary(observed, reserved, holdingCount, limits));
            return verdict;
        }

        rejectedCounter.increment();
        log.warn("Job {} rejected: delayed queue is full (size >= {}), blocked by {}",
            jobId, limits.getMaxQueueDepth(), verdict.getReason());
        return Verdict.reject(verdict.getReason());
    }

    /**
     * Apply the admission predicate: every projected dimension within its limit and a free job slot.
     *
     * @return ADMIT, or QUEUE with the first limit that blocks
     */
    public Verdict evaluate(ResourceRequirement requirement, ResourceUsage observed, ResourceUsage reserved,
                            int holdingCount, BudgetLimits limits) {
        ResourceUsage projected = observed.add(reserved).add(requirement.toUsage());

        boolean slotAvailable = holdingCount < limits.getMaxRunningJobs();
        boolean cpuAvailable = projected.getCpuPercent() <= limits.getMaxCpuPercent();
        boolean memoryAvailable = projected.getMemMb() <= limits.getMaxMemMb();
        boolean accelAvailable = projected.getAccelMemMb() <= limits.getMaxAccelMemMb();

        log.debug("Admission check: projected cpu={}%, mem={}MB, accel={}MB, slots {}/{} | cpu={}, memory={}, accel={}, slots={}",
            projected.getCpuPercent(), projected.getMemMb(), projected.getAccelMemMb(),
            holdingCount, limits.getMaxRunningJobs(),
            cpuAvailable, memoryAvailable, accelAvailable, slotAvailable);

        if (!slotAvailable) {
            return Verdict.delay(String.format(Locale.ROOT, "job cap reached (%d/%d)",
                holdingCount, limits.getMaxRunningJobs()));
        }
        if (!cpuAvailable) {
            return Verdict.delay(String.format(Locale.ROOT, "cpu %.1f%%/%.1f%%",
                projected.getCpuPercent(), limits.getMaxCpuPercent()));
        }
        if (!memoryAvailable) {
            return Verdict.delay(String.format(Locale.ROOT, "mem %.0fMB/%.0fMB",
                projected.getMemMb(), limits.getMaxMemMb()));
        }
        if (!accelAvailable) {
            return Verdict.delay(String.format(Locale.ROOT, "accel %.0fMB/%.0fMB",
                projected.getAccelMemMb(), limits.getMaxAccelMemMb()));
        }
        return Verdict.admit();
    }

    private static String summary(ResourceUsage observed, ResourceUsage reserved, int holdingCount, BudgetLimits limits) {
        return String.format(Locale.ROOT, "CPU: %.1f+%.1f/%.1f%%, Memory: %.0f+%.0f/%.0f MB, Accel: %.0f+%.0f/%.0f MB, Jobs: %d/%d",
            observed.getCpuPercent(), reserved.getCpuPercent(), limits.getMaxCpuPercent(),
            observed.getMemMb(), reserved.getMemMb(), limits.getMaxMemMb(),
            observed.getAccelMemMb(), reserved.getAccelMemMb(), limits.getMaxAccelMemMb(),
            holdingCount, limits.getMaxRunningJobs());
    }

    /**
     * Admission decision
     */
    public enum AdmissionDecision {
        /**
         * Admit job immediately (capacity reserved)
         */
        ADMIT,

        /**
         * Delay job until capacity frees up
         */
        QUEUE,

        /**
         * Reject job (delayed queue full)
         */
        REJECT
    }

    /**
     * Decision plus the limit that caused it
     */
    @Value
    public static class Verdict {
        AdmissionDecision decision;
        String reason;

        static Verdict admit() {
            return new Verdict(AdmissionDecision.ADMIT, null);
        }

        static Verdict delay(String reason) {
            return new Verdict(AdmissionDecision.QUEUE, reason);
        }

        static Verdict reject(String reason) {
            return new Verdict(AdmissionDecision.REJECT, reason);
        }

        public boolean isAdmitted() {
            return decision == AdmissionDecision.ADMIT;
        }
    }
}
