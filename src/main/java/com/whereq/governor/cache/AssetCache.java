package com.whereq.governor.cache;

import com.whereq.governor.event.EventNames;
import com.whereq.governor.event.EventPublisher;
import com.whereq.governor.exception.InvalidSizeException;
import com.whereq.governor.exception.UnknownAssetException;
import com.whereq.governor.model.AssetEntry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Working set of lazily loaded assets with least-recently-used eviction.
 *
 * Mutations are serialized by the cache's own lock, which is independent of the
 * governor lock. The unloader runs on the evicting thread while that lock is held.
 */
@Slf4j
public class AssetCache {

    /**
     * Eviction order: oldest use first, earliest registration on ties
     */
    static final Comparator<AssetEntry> LRU_ORDER = Comparator
        .comparing(AssetEntry::getLastUsedAt)
        .thenComparingLong(AssetEntry::getSequence);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, AssetEntry> entries = new HashMap<>();
    private final AssetUnloader unloader;
    private final UnloadFailurePolicy failurePolicy;
    private final EventPublisher events;
    private final Clock clock;

    private final Counter evictedCounter;
    private final Counter unloadFailureCounter;

    private long nextSequence;
    private volatile double footprintMb;

    public AssetCache(AssetUnloader unloader, UnloadFailurePolicy failurePolicy, EventPublisher events,
                      Clock clock, MeterRegistry meterRegistry) {
        this.unloader = unloader;
        this.failurePolicy = failurePolicy;
        this.events = events;
        this.clock = clock;

        evictedCounter = Counter.builder("governor.assets.evicted")
            .description("Number of assets evicted from the cache")
            .register(meterRegistry);

        unloadFailureCounter = Counter.builder("governor.assets.unload.failed")
            .description("Number of unload callbacks that reported a failure")
            .register(meterRegistry);

        Gauge.builder("governor.assets.footprint", this, AssetCache::footprintMb)
            .description("Resident asset size in MB")
            .register(meterRegistry);
    }

    /**
     * Add or replace an asset. A replacement counts as a new registration.
     *
     * @param assetId asset identifier
     * @param sizeMb resident size in MB
     * @param metadata caller-specific data, copied
     * @return the stored entry
     * @throws InvalidSizeException when the size is negative or not finite
     */
    public AssetEntry register(String assetId, double sizeMb, Map<String, Object> metadata) {
        requireId(assetId);
        if (Double.isNaN(sizeMb) || Double.isInfinite(sizeMb) || sizeMb < 0) {
            throw new InvalidSizeException(assetId, sizeMb);
        }

        AssetEntry entry;
        AssetEntry previous;
        lock.lock();
        try {
            Instant now = clock.instant();
            entry = AssetEntry.builder()
                .assetId(assetId)
                .sizeMb(sizeMb)
                .registeredAt(now)
                .lastUsedAt(now)
                .sequence(nextSequence++)
                .stale(false)
                .metadata(metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                .build();
            previous = entries.put(assetId, entry);
            recalculateFootprint();
        } finally {
            lock.unlock();
        }

        if (previous != null) {
            log.debug("Replaced lazy asset {} ({}MB -> {}MB)", assetId, previous.getSizeMb(), sizeMb);
        } else {
            log.debug("Registered lazy asset {} (size={}MB)", assetId, sizeMb);
        }
        events.publish(EventNames.ASSET_REGISTERED, EventPublisher.payload(
            "asset_id", assetId,
            "size_mb", sizeMb,
            "replaced", previous != null,
            "metadata", entry.getMetadata(),
            "footprint_mb", footprintMb));
        return entry;
    }

    /**
     * Mark an asset as used now
     *
     * @param assetId asset identifier
     * @return the updated entry
     * @throws UnknownAssetException when the asset is not registered
     */
    public AssetEntry touch(String assetId) {
        lock.lock();
        try {
            AssetEntry entry = entries.get(assetId);
            if (entry == null) {
                throw new UnknownAssetException(assetId);
            }
            AssetEntry touched = entry.withLastUsedAt(clock.instant()).withStale(false);
            entries.put(assetId, touched);
            log.debug("Asset {} marked as used", assetId);
            return touched;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evict least-recently-used assets until the resident total is at most {@code targetMb}
     *
     * @param targetMb footprint to trim down to
     * @return ids of the evicted assets, in eviction order
     */
    public List<String> evictToTarget(double targetMb) {
        if (Double.isNaN(targetMb) || targetMb < 0) {
            throw new IllegalArgumentException("Eviction target must be >= 0, got " + targetMb);
        }

        List<AssetEntry> evicted = new ArrayList<>();
        lock.lock();
        try {
            Set<String> retained = new HashSet<>();
            double resident = sumResident();
            while (resident > targetMb) {
                Optional<AssetEntry> candidate = entries.values().stream()
                    .filter(e -> !retained.contains(e.getAssetId()))
                    .min(LRU_ORDER);
                if (candidate.isEmpty()) {
                    log.warn("Cannot reach eviction target {}MB: {} stale assets retained ({}MB resident)",
                        targetMb, retained.size(), resident);
                    break;
                }

                AssetEntry entry = candidate.get();
                boolean released = invokeUnloader(entry);
                if (released || failurePolicy == UnloadFailurePolicy.REMOVE) {
                    if (!entries.remove(entry.getAssetId(), entry)) {
                        // The unloader touched or replaced the entry; it is in use again
                        retained.add(entry.getAssetId());
                    } else {
                        evicted.add(entry);
                    }
                    if (!released) {
                        log.warn("Unload failed for asset {}, removed from accounting anyway", entry.getAssetId());
                    }
                } else {
                    retained.add(entry.getAssetId());
                    if (entries.replace(entry.getAssetId(), entry, entry.withStale(true))) {
                        log.warn("Unload failed for asset {}, retained as stale", entry.getAssetId());
                    } else {
                        log.warn("Unload failed for asset {}, which was used again during the unload", entry.getAssetId());
                    }
                }
                resident = sumResident();
            }
            recalculateFootprint();
        } finally {
            lock.unlock();
        }

        if (!evicted.isEmpty()) {
            double freed = evicted.stream().mapToDouble(AssetEntry::getSizeMb).sum();
            log.info("Evicted {}MB worth of assets ({} items), footprint now {}MB (target {}MB)",
                freed, evicted.size(), footprintMb, targetMb);
            evictedCounter.increment(evicted.size());
            for (AssetEntry entry : evicted) {
                events.publish(EventNames.ASSET_EVICTED, EventPublisher.payload(
                    "asset_id", entry.getAssetId(),
                    "size_mb", entry.getSizeMb(),
                    "last_used_at", entry.getLastUsedAt(),
                    "target_mb", targetMb));
            }
        }
        return evicted.stream().map(AssetEntry::getAssetId).toList();
    }

    /**
     * Current resident size in MB; readable without the cache lock
     */
    public double footprintMb() {
        return footprintMb;
    }

    public Optional<AssetEntry> get(String assetId) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(assetId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * All entries in eviction order
     */
    public List<AssetEntry> entries() {
        lock.lock();
        try {
            return entries.values().stream().sorted(LRU_ORDER).toList();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean invokeUnloader(AssetEntry entry) {
        try {
            boolean released = unloader.unload(entry);
            if (!released) {
                unloadFailureCounter.increment();
            }
            return released;
        } catch (RuntimeException e) {
            unloadFailureCounter.increment();
            log.warn("Unload callback threw for asset {}", entry.getAssetId(), e);
            return false;
        }
    }

    private double sumResident() {
        return entries.values().stream().mapToDouble(AssetEntry::getSizeMb).sum();
    }

    private void recalculateFootprint() {
        footprintMb = sumResident();
    }

    private static void requireId(String assetId) {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("Asset id must not be blank");
        }
    }
}
