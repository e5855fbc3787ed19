package com.whereq.governor.resource;

import com.whereq.governor.exception.MetricsUnavailableException;
import com.whereq.governor.model.MetricsSnapshot;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Polls the {@link MetricsSource} and caches the last good snapshot.
 *
 * A snapshot is reused until the last poll attempt is older than the evaluation
 * interval. A poll that fails or exceeds the poll timeout is logged and answered with
 * the last known snapshot, never with zero load, and the source is not polled again
 * until the interval has passed.
 */
@Slf4j
public class ResourceMonitor {

    private final MetricsSource source;
    private final Clock clock;
    private final Duration pollTimeout;
    private final Scheduler pollScheduler;

    private volatile MetricsSnapshot last = MetricsSnapshot.UNKNOWN;
    private volatile Instant lastAttemptAt;

    /**
     * @param source metrics source to poll
     * @param clock clock used for staleness checks
     * @param pollTimeout upper bound for one poll; zero polls inline without a bound
     * @param pollScheduler scheduler the poll runs on when a timeout applies
     * @param meterRegistry registry for the last-snapshot gauges
     */
    public ResourceMonitor(MetricsSource source, Clock clock, Duration pollTimeout,
                           Scheduler pollScheduler, MeterRegistry meterRegistry) {
        this.source = source;
        this.clock = clock;
        this.pollTimeout = pollTimeout == null ? Duration.ZERO : pollTimeout;
        this.pollScheduler = pollScheduler;

        Gauge.builder("governor.metrics.cpu", this, m -> m.last.getCpuPercent())
            .description("Last observed CPU usage in percent")
            .register(meterRegistry);

        Gauge.builder("governor.metrics.mem", this, m -> m.last.getMemMb())
            .description("Last observed memory usage in MB")
            .register(meterRegistry);

        Gauge.builder("governor.metrics.accel", this, m -> m.last.getAccelMemMb())
            .description("Last observed accelerator memory usage in MB")
            .register(meterRegistry);
    }

    /**
     * Get a snapshot no older than the given age, polling when the cached one is stale
     *
     * @param maxAgeMs evaluation interval in milliseconds; 0 always polls
     * @return fresh or last known snapshot
     */
    public MetricsSnapshot current(long maxAgeMs) {
        Instant attempted = lastAttemptAt;
        if (attempted != null && Duration.between(attempted, clock.instant()).toMillis() < maxAgeMs) {
            return last;
        }
        return refresh();
    }

    /**
     * Poll now, falling back to the last known snapshot on failure
     */
    public MetricsSnapshot refresh() {
        try {
            MetricsSnapshot snapshot = poll();
            last = snapshot;
            log.debug("Metrics polled: cpu={}%, mem={}MB, accel={}MB",
                snapshot.getCpuPercent(), snapshot.getMemMb(), snapshot.getAccelMemMb());
            return snapshot;
        } catch (MetricsUnavailableException e) {
            if (last.isUnknown()) {
                log.warn("{}; no snapshot observed yet, admission uses reserved load only", e.getMessage());
            } else {
                log.warn("{}; reusing snapshot observed at {}", e.getMessage(), last.getObservedAt());
            }
            return last;
        } finally {
            lastAttemptAt = clock.instant();
        }
    }

    /**
     * Last known snapshot, without polling
     */
    public MetricsSnapshot lastSnapshot() {
        return last;
    }

    private MetricsSnapshot poll() {
        MetricsSnapshot snapshot;
        try {
            if (pollTimeout.isZero() || pollTimeout.isNegative()) {
                snapshot = source.poll();
            } else {
                snapshot = Mono.fromCallable(source::poll)
                    .subscribeOn(pollScheduler)
                    .timeout(pollTimeout)
                    .block();
            }
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new MetricsUnavailableException("Metrics poll failed: " + describe(e), e);
        }
        if (snapshot == null) {
            throw new MetricsUnavailableException("Metrics source returned no snapshot", null);
        }
        return snapshot;
    }

    private static String describe(Throwable error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? " " + cause.getMessage() : "");
    }
}
