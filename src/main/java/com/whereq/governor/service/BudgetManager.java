package com.whereq.governor.service;

import com.whereq.governor.cache.AssetCache;
import com.whereq.governor.event.EventNames;
import com.whereq.governor.event.EventPublisher;
import com.whereq.governor.exception.DuplicateJobException;
import com.whereq.governor.exception.InvalidStateException;
import com.whereq.governor.exception.QueueFullException;
import com.whereq.governor.model.AdmissionResult;
import com.whereq.governor.model.AssetEntry;
import com.whereq.governor.model.BudgetHealth;
import com.whereq.governor.model.BudgetLimits;
import com.whereq.governor.model.BudgetSnapshot;
import com.whereq.governor.model.Job;
import com.whereq.governor.model.JobOutcome;
import com.whereq.governor.model.JobState;
import com.whereq.governor.model.JobView;
import com.whereq.governor.model.MetricsSnapshot;
import com.whereq.governor.model.QueueTransition;
import com.whereq.governor.model.ResourceRequirement;
import com.whereq.governor.model.ResourceUsage;
import com.whereq.governor.resource.ResourceCalculator;
import com.whereq.governor.resource.ResourceMonitor;
import com.whereq.governor.service.AdmissionController.Verdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Central arbiter for job admission and the job lifecycle.
 *
 * Every state-changing operation runs under one governor lock, so two concurrent
 * registrations can never both be admitted on the same headroom. Events are collected
 * while the lock is held and published after it is released, and the asset cache is
 * trimmed outside the lock as well.
 */
@Slf4j
public class BudgetManager {

    private final ReentrantLock lock = new ReentrantLock();

    private final ResourceMonitor resourceMonitor;
    private final AdmissionController admissionController;
    private final ResourceCalculator resourceCalculator;
    private final AssetCache assetCache;
    private final EventPublisher events;
    private final Clock clock;
    private final JobStatusTracker tracker;
    private final MeterRegistry meterRegistry;
    private final Counter promotedCounter;

    private volatile BudgetLimits limits;
    private volatile Instant lastEvaluation;

    public BudgetManager(BudgetLimits initialLimits,
                         ResourceMonitor resourceMonitor,
                         AdmissionController admissionController,
                         ResourceCalculator resourceCalculator,
                         AssetCache assetCache,
                         EventPublisher events,
                         Clock clock,
                         MeterRegistry meterRegistry) {
        this.limits = Objects.requireNonNull(initialLimits, "initialLimits").validate();
        this.resourceMonitor = resourceMonitor;
        this.admissionController = admissionController;
        this.resourceCalculator = resourceCalculator;
        this.assetCache = assetCache;
        this.events = events;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.tracker = new JobStatusTracker(clock);

        promotedCounter = Counter.builder("governor.queue.promoted")
            .description("Number of delayed jobs promoted to queued")
            .register(meterRegistry);

        for (JobState state : List.of(JobState.QUEUED, JobState.DELAYED, JobState.RUNNING)) {
            Gauge.builder("governor.jobs." + state.wireName(), this, m -> m.countIn(state))
                .description("Number of " + state.wireName() + " jobs")
                .register(meterRegistry);
        }

        log.info("Budget manager initialized with limits {}", initialLimits);
    }

    /**
     * Replace the active limits and re-evaluate delayed jobs against them.
     * Jobs already queued or running are never revoked.
     *
     * @param newLimits new limits, validated before anything changes
     * @return promotions caused by the new limits
     */
    public List<QueueTransition> applyLimits(BudgetLimits newLimits) {
        Objects.requireNonNull(newLimits, "newLimits").validate();

        List<PendingEvent> outbox = new ArrayList<>();
        RefreshOutcome outcome;
        lock.lock();
        try {
            BudgetLimits previous = limits;
            limits = newLimits;
            log.info("Budget limits updated: {}", newLimits);
            outbox.add(new PendingEvent(EventNames.LIMITS_UPDATED, EventPublisher.payload(
                "limits", newLimits,
                "previous", previous)));
            outcome = refreshLocked(outbox);
        } finally {
            lock.unlock();
        }

        flush(outbox);
        trimAssetsIfPressured(outcome.metrics(), outcome.limits());
        return outcome.transitions();
    }

    public BudgetLimits limits() {
        return limits;
    }

    public AdmissionResult registerJob(String jobId, String kind, ResourceRequirement requirement) {
        return registerJob(jobId, kind, requirement, Map.of());
    }

    /**
     * Register a job whose cost is read from the {@code perf} section of its payload
     */
    public AdmissionResult registerJob(String jobId, String kind, Map<String, Object> payload) {
        return registerJob(jobId, kind, resourceCalculator.calculate(payload), payload);
    }

    /**
     * Admit a job now or delay it until capacity frees up
     *
     * @param jobId caller-assigned id, unique for the process lifetime
     * @param kind opaque job type
     * @param requirement declared cost
     * @param metadata caller-specific data kept on the job record
     * @return QUEUED or DELAYED with the blocking reason
     * @throws DuplicateJobException when the id was registered before
     * @throws QueueFullException when the job would be delayed but the delayed queue is full
     */
    public AdmissionResult registerJob(String jobId, String kind, ResourceRequirement requirement,
                                       Map<String, Object> metadata) {
        requireId(jobId);
        Objects.requireNonNull(requirement, "requirement");

        List<PendingEvent> outbox = new ArrayList<>();
        AdmissionResult result;
        BudgetLimits current;
        lock.lock();
        try {
            if (tracker.contains(jobId)) {
                throw new DuplicateJobException(jobId);
            }

            current = limits;
            MetricsSnapshot metrics = evaluateMetrics(current);
            Verdict verdict = admissionController.admitJob(jobId, requirement, ResourceUsage.of(metrics),
                tracker.reserved(), tracker.holdingCount(), tracker.count(JobState.DELAYED), current);

            if (verdict.getDecision() == AdmissionController.AdmissionDecision.REJECT) {
                throw new QueueFullException(jobId, current.getMaxQueueDepth());
            }

            JobState state = verdict.isAdmitted() ? JobState.QUEUED : JobState.DELAYED;
            Job job = tracker.create(jobId, kind, requirement, metadata, state, verdict.getReason());

            result = AdmissionResult.builder()
                .jobId(jobId)
                .queueState(state)
                .reason(verdict.getReason())
                .metrics(metrics)
                .limits(current)
                .build();

            outbox.add(new PendingEvent(EventNames.JOB_REGISTERED, EventPublisher.payload(
                "job", job.toView(),
                "queue_state", state.wireName(),
                "reason", verdict.getReason(),
                "metrics", metrics)));
        } finally {
            lock.unlock();
        }

        flush(outbox);
        trimAssetsIfPressured(result.getMetrics(), current);
        return result;
    }

    /**
     * Move a queued job to running
     *
     * @throws InvalidStateException when the job is not queued
     */
    public JobView startJob(String jobId) {
        List<PendingEvent> outbox = new ArrayList<>();
        JobView view;
        lock.lock();
        try {
            Job job = tracker.require(jobId);
            if (job.getState() != JobState.QUEUED) {
                throw new InvalidStateException(jobId, job.getState(), "start");
            }
            tracker.updateStatus(job, JobState.RUNNING, null);
            view = job.toView();
            outbox.add(new PendingEvent(EventNames.JOB_STARTED, EventPublisher.payload("job", view)));
        } finally {
            lock.unlock();
        }

        log.info("Job {} started", jobId);
        flush(outbox);
        return view;
    }

    public JobView finishJob(String jobId, JobOutcome outcome) {
        return finishJob(jobId, outcome, null);
    }

    /**
     * Finish a job, release its capacity and promote delayed jobs that now fit.
     * A delayed job never held capacity and always ends up canceled.
     *
     * @throws InvalidStateException when the job already finished
     */
    public JobView finishJob(String jobId, JobOutcome outcome, String reason) {
        Objects.requireNonNull(outcome, "outcome");

        List<PendingEvent> outbox = new ArrayList<>();
        JobView view;
        RefreshOutcome refresh = null;
        lock.lock();
        try {
            Job job = tracker.require(jobId);
            JobState previous = job.getState();
            if (previous.isTerminal()) {
                throw new InvalidStateException(jobId, previous, "finish");
            }

            JobState target = previous == JobState.DELAYED ? JobState.CANCELED : outcome.terminalState();
            tracker.updateStatus(job, target, reason);
            view = job.toView();

            Counter.builder("governor.jobs.finished")
                .tag("outcome", target.wireName())
                .description("Number of jobs finished per outcome")
                .register(meterRegistry)
                .increment();

            log.info("Job {} finished: {} → {}{}", jobId, previous, target, reason == null ? "" : " (" + reason + ")");
            outbox.add(new PendingEvent(EventNames.JOB_FINISHED, EventPublisher.payload(
                "job", view,
                "previous_state", previous.wireName(),
                "released_capacity", previous.holdsCapacity())));

            if (previous.holdsCapacity()) {
                refresh = refreshLocked(outbox);
            }
        } finally {
            lock.unlock();
        }

        flush(outbox);
        if (refresh != null) {
            trimAssetsIfPressured(refresh.metrics(), refresh.limits());
        }
        return view;
    }

    /**
     * Promote delayed jobs that fit, in submission order. A job that still does not fit
     * does not block smaller jobs behind it.
     *
     * @return promotions made by this call only
     */
    public List<QueueTransition> refreshQueue() {
        List<PendingEvent> outbox = new ArrayList<>();
        RefreshOutcome outcome;
        lock.lock();
        try {
            outcome = refreshLocked(outbox);
        } finally {
            lock.unlock();
        }

        flush(outbox);
        trimAssetsIfPressured(outcome.metrics(), outcome.limits());
        return outcome.transitions();
    }

    /**
     * Read-only view of limits, last metrics, jobs per state and cached assets
     */
    public BudgetSnapshot snapshot() {
        List<AssetEntry> assets = assetCache.entries();
        double footprint = assetCache.footprintMb();
        lock.lock();
        try {
            return BudgetSnapshot.builder()
                .limits(limits)
                .metrics(resourceMonitor.lastSnapshot())
                .jobIds(tracker.idsByState())
                .cacheFootprintMb(footprint)
                .assets(assets)
                .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts only, for health endpoints and logs
     */
    public BudgetHealth health() {
        int registeredAssets = assetCache.size();
        double footprint = assetCache.footprintMb();
        lock.lock();
        try {
            return BudgetHealth.builder()
                .limits(limits)
                .queued(tracker.count(JobState.QUEUED))
                .delayed(tracker.count(JobState.DELAYED))
                .running(tracker.count(JobState.RUNNING))
                .seenJobs(tracker.size())
                .registeredAssets(registeredAssets)
                .cacheFootprintMb(footprint)
                .lastEvaluation(lastEvaluation)
                .metrics(resourceMonitor.lastSnapshot())
                .build();
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobView> job(String jobId) {
        lock.lock();
        try {
            return tracker.find(jobId).map(Job::toView);
        } finally {
            lock.unlock();
        }
    }

    private RefreshOutcome refreshLocked(List<PendingEvent> outbox) {
        BudgetLimits current = limits;
        MetricsSnapshot metrics = evaluateMetrics(current);
        ResourceUsage observed = ResourceUsage.of(metrics);
        ResourceUsage reserved = tracker.reserved();
        int holding = tracker.holdingCount();

        List<QueueTransition> transitions = new ArrayList<>();
        for (Job job : tracker.delayedInOrder()) {
            Verdict verdict = admissionController.evaluate(job.getRequirement(), observed, reserved, holding, current);
            if (!verdict.isAdmitted()) {
                job.setReason(verdict.getReason());
                continue;
            }

            tracker.updateStatus(job, JobState.QUEUED, null);
            reserved = reserved.add(job.getRequirement().toUsage());
            holding++;
            promotedCounter.increment();

            QueueTransition transition = new QueueTransition(job.getJobId(), JobState.DELAYED, JobState.QUEUED,
                job.getLastTransitionAt());
            transitions.add(transition);
            outbox.add(new PendingEvent(EventNames.JOB_PROMOTED, EventPublisher.payload(
                "job", job.toView(),
                "from", JobState.DELAYED.wireName(),
                "to", JobState.QUEUED.wireName())));
        }

        if (!transitions.isEmpty()) {
            log.info("Promoted {} delayed job(s): {}", transitions.size(),
                transitions.stream().map(QueueTransition::getJobId).toList());
        }
        return new RefreshOutcome(transitions, metrics, current);
    }

    private MetricsSnapshot evaluateMetrics(BudgetLimits current) {
        MetricsSnapshot metrics = resourceMonitor.current(current.getEvaluationIntervalMs());
        lastEvaluation = clock.instant();
        return metrics;
    }

    /**
     * Trim the asset cache when observed memory is at or above its budget.
     * Called without the governor lock held.
     */
    private void trimAssetsIfPressured(MetricsSnapshot metrics, BudgetLimits current) {
        if (metrics == null || metrics.isUnknown()) {
            return;
        }
        boolean memoryPressure = atOrAbove(metrics.getMemMb(), current.getMaxMemMb());
        boolean accelPressure = atOrAbove(metrics.getAccelMemMb(), current.getMaxAccelMemMb());
        if (!memoryPressure && !accelPressure) {
            return;
        }
        if (assetCache.footprintMb() <= current.getLazyAssetTargetMb()) {
            log.debug("Memory pressure detected but cache footprint {}MB already within target {}MB",
                assetCache.footprintMb(), current.getLazyAssetTargetMb());
            return;
        }

        log.info("Memory pressure detected (mem={}MB/{}MB, accel={}MB/{}MB), trimming assets to {}MB",
            metrics.getMemMb(), current.getMaxMemMb(), metrics.getAccelMemMb(), current.getMaxAccelMemMb(),
            current.getLazyAssetTargetMb());
        assetCache.evictToTarget(current.getLazyAssetTargetMb());
    }

    // A zero budget only counts as pressure once something is actually in use
    private static boolean atOrAbove(double observed, double budget) {
        return budget > 0 ? observed >= budget : observed > 0;
    }

    private int countIn(JobState state) {
        lock.lock();
        try {
            return tracker.count(state);
        } finally {
            lock.unlock();
        }
    }

    private void flush(List<PendingEvent> outbox) {
        for (PendingEvent event : outbox) {
            events.publish(event.name(), event.payload());
        }
    }

    private static void requireId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("Job id must not be blank");
        }
    }

    private record PendingEvent(String name, Map<String, Object> payload) {
    }

    private record RefreshOutcome(List<QueueTransition> transitions, MetricsSnapshot metrics, BudgetLimits limits) {
    }
}
