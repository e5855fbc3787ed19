package com.whereq.governor.support;

import com.whereq.governor.cache.AssetCache;
import com.whereq.governor.cache.AssetUnloader;
import com.whereq.governor.cache.UnloadFailurePolicy;
import com.whereq.governor.event.EventPublisher;
import com.whereq.governor.model.BudgetLimits;
import com.whereq.governor.resource.ResourceCalculator;
import com.whereq.governor.resource.ResourceMonitor;
import com.whereq.governor.service.AdmissionController;
import com.whereq.governor.service.BudgetManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Fully wired governor with a fake clock, scripted metrics and synchronous event delivery
 */
public class GovernorFixture {

    public final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    public final ScriptedMetricsSource metrics = new ScriptedMetricsSource(clock);
    public final RecordingEventSink sink = new RecordingEventSink();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final EventPublisher events = new EventPublisher(sink, Schedulers.immediate(), clock);
    public final ResourceMonitor monitor = new ResourceMonitor(metrics, clock, Duration.ZERO,
        Schedulers.immediate(), meterRegistry);
    public final AssetCache cache;
    public final BudgetManager manager;

    public GovernorFixture(BudgetLimits limits) {
        this(limits, AssetUnloader.noop(), UnloadFailurePolicy.REMOVE);
    }

    public GovernorFixture(BudgetLimits limits, AssetUnloader unloader, UnloadFailurePolicy policy) {
        cache = new AssetCache(unloader, policy, events, clock, meterRegistry);
        manager = new BudgetManager(limits, monitor, new AdmissionController(meterRegistry),
            new ResourceCalculator(), cache, events, clock, meterRegistry);
    }

    /**
     * Limits that re-poll metrics on every evaluation
     */
    public static BudgetLimits.BudgetLimitsBuilder limits() {
        return BudgetLimits.builder().evaluationIntervalMs(0);
    }
}
