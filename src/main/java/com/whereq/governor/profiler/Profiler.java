package com.whereq.governor.profiler;

import com.whereq.governor.event.EventNames;
import com.whereq.governor.event.EventPublisher;
import com.whereq.governor.resource.MetricsSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-safe recorder of marks and spans with on-demand dashboards.
 *
 * Recording is lock-free: spans and marks go to concurrent deques bounded to the most
 * recent {@code historySize} entries, and per-name aggregates are immutable totals
 * swapped by compare-and-set that cover every span ever recorded in the current
 * generation. {@link #reset()} swaps the
 * whole generation in one step.
 */
@Slf4j
public class Profiler {

    public static final String DEFAULT_CATEGORY = "general";

    private final MetricsSource memorySource;
    private final EventPublisher events;
    private final Clock clock;
    private final int historySize;
    private final boolean enabled;

    private final AtomicReference<Generation> current = new AtomicReference<>(new Generation());

    /**
     * @param memorySource source of memory readings around spans, may be null
     * @param events outbound event queue
     * @param clock clock for timestamps and durations
     * @param historySize number of recent spans and marks kept
     * @param enabled when false, nothing is recorded
     */
    public Profiler(MetricsSource memorySource, EventPublisher events, Clock clock, int historySize, boolean enabled) {
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be >= 1, got " + historySize);
        }
        this.memorySource = memorySource;
        this.events = events;
        this.clock = clock;
        this.historySize = historySize;
        this.enabled = enabled;
    }

    /**
     * Record an instantaneous mark
     *
     * @param name mark name
     * @param category mark category, {@value #DEFAULT_CATEGORY} when null
     * @param metadata extra data, copied
     * @return the mark
     */
    public ProfileMark mark(String name, String category, Map<String, Object> metadata) {
        ProfileMark mark = new ProfileMark(requireName(name), categoryOrDefault(category), clock.instant(), copy(metadata));
        if (enabled) {
            current.get().addMark(mark, historySize);
            log.debug("Profiler mark {}/{}", mark.getCategory(), name);
        }
        return mark;
    }

    /**
     * Open a span; it is recorded when the returned scope is closed
     */
    public ProfileScope span(String name, String category, Map<String, Object> metadata) {
        return new ProfileScope(this, requireName(name), categoryOrDefault(category), copy(metadata),
            clock.instant(), readMemory());
    }

    /**
     * Run a task inside a span. A failure is recorded on the span and rethrown.
     */
    public <T> T profile(String name, String category, Map<String, Object> metadata, Callable<T> task) throws Exception {
        try (ProfileScope scope = span(name, category, metadata)) {
            try {
                return task.call();
            } catch (Exception | Error e) {
                scope.fail(e);
                throw e;
            }
        }
    }

    /**
     * Record a span measured elsewhere
     *
     * @param durationMs measured duration, negative values are recorded as 0
     * @param memoryDeltaMb measured memory growth, negative values are recorded as 0
     */
    public ProfileSpan recordSpan(String name, String category, double durationMs, double memoryDeltaMb,
                                  Map<String, Object> metadata) {
        Instant end = clock.instant();
        double duration = Math.max(durationMs, 0.0);
        ProfileSpan span = ProfileSpan.builder()
            .name(requireName(name))
            .category(categoryOrDefault(category))
            .startTs(end.minusNanos((long) (duration * 1_000_000)))
            .endTs(end)
            .durationMs(duration)
            .memoryDeltaMb(Math.max(memoryDeltaMb, 0.0))
            .metadata(copy(metadata))
            .build();
        record(span);
        return span;
    }

    void complete(String name, String category, Map<String, Object> metadata, Instant start, OptionalDouble startMemoryMb) {
        Instant end = clock.instant();
        double memoryDelta = 0.0;
        OptionalDouble endMemoryMb = readMemory();
        if (startMemoryMb.isPresent() && endMemoryMb.isPresent()) {
            memoryDelta = Math.max(endMemoryMb.getAsDouble() - startMemoryMb.getAsDouble(), 0.0);
        }
        ProfileSpan span = ProfileSpan.builder()
            .name(name)
            .category(category)
            .startTs(start)
            .endTs(end)
            .durationMs(Math.max(Duration.between(start, end).toNanos() / 1_000_000.0, 0.0))
            .memoryDeltaMb(memoryDelta)
            .metadata(metadata)
            .build();
        record(span);
    }

    private void record(ProfileSpan span) {
        if (!enabled) {
            return;
        }
        current.get().addSpan(span, historySize);
        log.debug("Recorded span {}/{} duration={}ms memory={}MB",
            span.getCategory(), span.getName(), span.getDurationMs(), span.getMemoryDeltaMb());
    }

    /**
     * Aggregate the log without mutating it and emit a {@code profiler.snapshot} event
     *
     * @param limit number of entries in each top list and recent window
     * @return the dashboard
     */
    public ProfilerDashboard dashboard(int limit) {
        int window = Math.max(limit, 0);
        Generation generation = current.get();
        List<AggregateStats> aggregates = generation.aggregates();

        Map<String, CategoryStats> categories = new TreeMap<>();
        Map<String, List<AggregateStats>> byCategory = new TreeMap<>();
        for (AggregateStats stats : aggregates) {
            byCategory.computeIfAbsent(stats.getCategory(), k -> new ArrayList<>()).add(stats);
        }
        byCategory.forEach((category, items) -> categories.put(category, new CategoryStats(
            category,
            items.stream().mapToLong(AggregateStats::getCount).sum(),
            items.stream().mapToDouble(AggregateStats::getTotalMs).sum(),
            items.stream().mapToDouble(AggregateStats::getTotalMemoryMb).sum())));

        ProfilerDashboard dashboard = ProfilerDashboard.builder()
            .topTime(top(aggregates, Comparator.comparingDouble(AggregateStats::getTotalMs), window))
            .topMemory(top(aggregates, Comparator.comparingDouble(AggregateStats::getTotalMemoryMb), window))
            .categories(categories)
            .recentMarks(tail(generation.marks, window))
            .recentSpans(tail(generation.spans, window))
            .generatedAt(clock.instant())
            .build();

        events.publish(EventNames.PROFILER_SNAPSHOT, EventPublisher.payload(
            "top_time", dashboard.getTopTime(),
            "top_memory", dashboard.getTopMemory(),
            "categories", dashboard.getCategories(),
            "marks", dashboard.getRecentMarks()));
        return dashboard;
    }

    /**
     * Aggregates for every span name recorded since the last reset
     */
    public List<AggregateStats> aggregates() {
        return current.get().aggregates();
    }

    /**
     * Span names ranked by their worst single span
     */
    public List<AggregateStats> topOffenders(int limit, OffenderRanking ranking) {
        Comparator<AggregateStats> order = ranking == OffenderRanking.MEMORY
            ? Comparator.comparingDouble(AggregateStats::getMaxMemoryMb)
            : Comparator.comparingDouble(AggregateStats::getMaxMs);
        return top(aggregates(), order, Math.max(limit, 0));
    }

    /**
     * Most recent spans, oldest first
     */
    public List<ProfileSpan> history(int limit) {
        return tail(current.get().spans, Math.max(limit, 0));
    }

    /**
     * Most recent marks, oldest first
     */
    public List<ProfileMark> marks(int limit) {
        return tail(current.get().marks, Math.max(limit, 0));
    }

    /**
     * Clear all spans, marks and aggregates
     */
    public void reset() {
        current.set(new Generation());
        events.publish(EventNames.PROFILER_RESET, EventPublisher.payload("timestamp", clock.instant()));
        log.info("Profiler reset");
    }

    public boolean isEnabled() {
        return enabled;
    }

    private OptionalDouble readMemory() {
        if (memorySource == null || !enabled) {
            return OptionalDouble.empty();
        }
        try {
            return memorySource.currentMemoryMb();
        } catch (RuntimeException e) {
            log.debug("Memory reading failed: {}", e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private static List<AggregateStats> top(List<AggregateStats> aggregates, Comparator<AggregateStats> order, int limit) {
        return aggregates.stream()
            .sorted(order.reversed())
            .limit(limit)
            .toList();
    }

    private static <T> List<T> tail(Deque<T> entries, int limit) {
        List<T> copy = new ArrayList<>(entries);
        return List.copyOf(copy.subList(Math.max(copy.size() - limit, 0), copy.size()));
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Profiler entry name must not be blank");
        }
        return name;
    }

    private static String categoryOrDefault(String category) {
        return category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
    }

    private static Map<String, Object> copy(Map<String, Object> metadata) {
        return metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Everything recorded between two resets
     */
    private static final class Generation {
        private final Deque<ProfileSpan> spans = new ConcurrentLinkedDeque<>();
        private final Deque<ProfileMark> marks = new ConcurrentLinkedDeque<>();
        private final AtomicInteger spanCount = new AtomicInteger();
        private final AtomicInteger markCount = new AtomicInteger();
        private final ConcurrentHashMap<AggregateKey, Accumulator> accumulators = new ConcurrentHashMap<>();

        void addSpan(ProfileSpan span, int historySize) {
            spans.addLast(span);
            if (spanCount.incrementAndGet() > historySize && spans.pollFirst() != null) {
                spanCount.decrementAndGet();
            }
            accumulators.computeIfAbsent(new AggregateKey(span.getCategory(), span.getName()), k -> new Accumulator())
                .add(span);
        }

        void addMark(ProfileMark mark, int historySize) {
            marks.addLast(mark);
            if (markCount.incrementAndGet() > historySize && marks.pollFirst() != null) {
                markCount.decrementAndGet();
            }
        }

        List<AggregateStats> aggregates() {
            List<AggregateStats> out = new ArrayList<>();
            accumulators.forEach((key, acc) -> out.add(acc.toStats(key)));
            return out;
        }
    }

    private record AggregateKey(String category, String name) {
    }

    /**
     * Per-name totals held as one immutable value, so a reader always sees count,
     * totals and maxima from the same set of spans
     */
    private static final class Accumulator {
        private final AtomicReference<Totals> totals = new AtomicReference<>(Totals.EMPTY);

        void add(ProfileSpan span) {
            totals.updateAndGet(t -> t.plus(span));
        }

        AggregateStats toStats(AggregateKey key) {
            Totals t = totals.get();
            return AggregateStats.builder()
                .name(key.name())
                .category(key.category())
                .count(t.count())
                .totalMs(t.totalMs())
                .maxMs(t.maxMs())
                .totalMemoryMb(t.totalMemoryMb())
                .maxMemoryMb(t.maxMemoryMb())
                .lastTimestamp(t.last())
                .build();
        }
    }

    private record Totals(long count, double totalMs, double maxMs, double totalMemoryMb, double maxMemoryMb,
                          Instant last) {

        static final Totals EMPTY = new Totals(0, 0.0, 0.0, 0.0, 0.0, null);

        Totals plus(ProfileSpan span) {
            Instant end = span.getEndTs();
            return new Totals(
                count + 1,
                totalMs + span.getDurationMs(),
                Math.max(maxMs, span.getDurationMs()),
                totalMemoryMb + span.getMemoryDeltaMb(),
                Math.max(maxMemoryMb, span.getMemoryDeltaMb()),
                last == null || end.isAfter(last) ? end : last);
        }
    }
}
