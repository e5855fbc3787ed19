package com.whereq.governor.service;

import com.whereq.governor.cache.UnloadFailurePolicy;
import com.whereq.governor.event.EventNames;
import com.whereq.governor.event.GovernorEvent;
import com.whereq.governor.exception.DuplicateJobException;
import com.whereq.governor.exception.InvalidLimitsException;
import com.whereq.governor.exception.InvalidStateException;
import com.whereq.governor.exception.QueueFullException;
import com.whereq.governor.exception.UnknownJobException;
import com.whereq.governor.model.AdmissionResult;
import com.whereq.governor.model.BudgetHealth;
import com.whereq.governor.model.BudgetLimits;
import com.whereq.governor.model.BudgetSnapshot;
import com.whereq.governor.model.JobOutcome;
import com.whereq.governor.model.JobState;
import com.whereq.governor.model.JobView;
import com.whereq.governor.model.QueueTransition;
import com.whereq.governor.model.ResourceRequirement;
import com.whereq.governor.support.GovernorFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BudgetManager")
class BudgetManagerTest {

    private static ResourceRequirement mem(double memMb) {
        return ResourceRequirement.of(0, memMb);
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("delays the second job when the job cap is reached and promotes it once the first finishes")
        void delayedJobIsPromotedWhenCapacityFrees() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits()
                .maxRunningJobs(1)
                .maxMemMb(1000)
                .build());
            BudgetManager manager = governor.manager;

            AdmissionResult a = manager.registerJob("a", "inference", mem(400));
            AdmissionResult b = manager.registerJob("b", "inference", mem(400));

            assertEquals(JobState.QUEUED, a.getQueueState());
            assertEquals(JobState.DELAYED, b.getQueueState());
            assertEquals("job cap reached (1/1)", b.getReason());

            manager.finishJob("a", JobOutcome.COMPLETE);

            assertThat(manager.job("b")).map(JobView::getState).contains(JobState.QUEUED);
            List<GovernorEvent> promotions = governor.sink.named(EventNames.JOB_PROMOTED);
            assertThat(promotions).hasSize(1);
            assertThat(((JobView) promotions.get(0).getPayload().get("job")).getJobId()).isEqualTo("b");
        }

        @Test
        @DisplayName("includes observed load in the projection")
        void observedLoadCountsAgainstLimits() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().maxCpuPercent(85).build());
            governor.metrics.load(80, 0, 0);

            AdmissionResult result = governor.manager.registerJob("hot", "render", ResourceRequirement.of(10, 0));

            assertEquals(JobState.DELAYED, result.getQueueState());
            assertEquals("cpu 90.0%/85.0%", result.getReason());
            assertEquals(80.0, result.getMetrics().getCpuPercent());
        }

        @Test
        @DisplayName("admits a job whose projection lands exactly on the limit")
        void projectionEqualToLimitIsAdmitted() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().maxMemMb(1000).build());
            governor.metrics.load(0, 600, 0);

            AdmissionResult result = governor.manager.registerJob("edge", "batch", mem(400));

            assertTrue(result.isQueued());
        }

        @Test
        @DisplayName("reads the declared cost from a payload perf section")
        void registersFromPayload() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().maxMemMb(1000).build());

            AdmissionResult result = governor.manager.registerJob("p", "train",
                Map.of("perf", Map.of("ram_mb", "2g")));

            assertEquals(JobState.DELAYED, result.getQueueState());
            assertEquals("mem 2048MB/1000MB", result.getReason());
            assertThat(governor.manager.job("p").orElseThrow().getRequirement().getMemMb()).isEqualTo(2048.0);
        }

        @Test
        @DisplayName("rejects a duplicate id, even after the first job finished")
        void duplicateIdsAreRejected() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().build());
            governor.manager.registerJob("a", "batch", mem(10));
            governor.manager.finishJob("a", JobOutcome.COMPLETE);

            assertThrows(DuplicateJobException.class,
                () -> governor.manager.registerJob("a", "batch", mem(10)));
        }

        @Test
        @DisplayName("throws QueueFullException and creates no job when the delayed queue is full")
        void queueFullRejectsWithoutState() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits()
                .maxRunningJobs(0)
                .maxQueueDepth(1)
                .build());

            governor.manager.registerJob("a", "batch", mem(10));
            QueueFullException error = assertThrows(QueueFullException.class,
                () -> governor.manager.registerJob("b", "batch", mem(10)));

            assertEquals("b", error.getJobId());
            assertThat(governor.manager.job("b")).isEmpty();
            assertThat(governor.manager.snapshot().idsIn(JobState.DELAYED)).containsExactly("a");
            assertThat(governor.meterRegistry.counter("governor.admission.rejected").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("falls back to reserved load when metrics were never available")
        void admitsOnReservedLoadWithoutMetrics() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().maxMemMb(1000).build());
            governor.metrics.failWith(new IllegalStateException("sensor offline"));

            AdmissionResult first = governor.manager.registerJob("a", "batch", mem(600));
            AdmissionResult second = governor.manager.registerJob("b", "batch", mem(600));

            assertTrue(first.isQueued());
            assertTrue(first.getMetrics().isUnknown());
            assertEquals(JobState.DELAYED, second.getQueueState());
        }

        @Test
        @DisplayName("does not poll a failing metrics source again within the evaluation interval")
        void failingSourceIsPolledOncePerInterval() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits()
                .evaluationIntervalMs(10_000)
                .build());
            governor.manager.registerJob("first", "batch", mem(1));
            governor.clock.advanceMillis(10_000);
            governor.metrics.failWith(new IllegalStateException("sensor hung"));
            int before = governor.metrics.pollCount();

            for (int i = 0; i < 5; i++) {
                governor.manager.registerJob("job-" + i, "batch", mem(1));
            }

            assertEquals(1, governor.metrics.pollCount() - before);
        }

        @Test
        @DisplayName("rejects blank ids")
        void blankIdIsInvalid() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().build());

            assertThrows(IllegalArgumentException.class, () -> governor.manager.registerJob(" ", "batch", mem(1)));
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("stamps timestamps along queued, running and complete")
        void fullLifecycle() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().build());
            BudgetManager manager = governor.manager;

            manager.registerJob("a", "batch", mem(10));
            governor.clock.advanceMillis(100);
            JobView running = manager.startJob("a");
            governor.clock.advanceMillis(100);
            JobView finished = manager.finishJob("a", JobOutcome.ERROR, "boom");

            assertEquals(JobState.RUNNING, running.getState());
            assertEquals(JobState.ERROR, finished.getState());
            assertEquals("boom", finished.getReason());
            assertThat(finished.getStartedAt()).isEqualTo(finished.getSubmittedAt().plusMillis(100));
            assertThat(finished.getFinishedAt()).isEqualTo(finished.getStartedAt().plusMillis(100));
            assertThat(governor.sink.names()).containsSubsequence(
                EventNames.JOB_REGISTERED, EventNames.JOB_STARTED, EventNames.JOB_FINISHED);
            assertThat(governor.meterRegistry.counter("governor.jobs.finished", "outcome", "error").count())
                .isEqualTo(1.0);
        }

        @Test
        @DisplayName("refuses to start a delayed job")
        void delayedJobCannotStart() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().maxRunningJobs(0).build());
            governor.manager.registerJob("a", "batch", mem(10));

            InvalidStateException error = assertThrows(InvalidStateException.class,
                () -> governor.manager.startJob("a"));
            assertEquals(JobState.DELAYED, error.getCurrentState());
        }

        @Test
        @DisplayName("refuses to finish a job twice")
        void terminalJobCannotFinishAgain() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().build());
            governor.manager.registerJob("a", "batch", mem(10));
            governor.manager.finishJob("a", JobOutcome.COMPLETE);

            assertThrows(InvalidStateException.class,
                () -> governor.manager.finishJob("a", JobOutcome.COMPLETE));
        }

        @Test
        @DisplayName("cancels a delayed job whatever outcome is reported")
        void finishingDelayedJobCancelsIt() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().maxRunningJobs(0).build());
            governor.manager.registerJob("a", "batch", mem(10));

            JobView view = governor.manager.finishJob("a", JobOutcome.COMPLETE);

            assertEquals(JobState.CANCELED, view.getState());
        }

        @Test
        @DisplayName("raises UnknownJobException for ids never registered")
        void unknownJob() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().build());

            assertThrows(UnknownJobException.class, () -> governor.manager.startJob("ghost"));
            assertThrows(UnknownJobException.class, () -> governor.manager.finishJob("ghost", JobOutcome.CANCELED));
            assertThat(governor.manager.job("ghost")).isEmpty();
        }
    }

    @Nested
    @DisplayName("queue refresh")
    class Refresh {

        @Test
        @DisplayName("lets a later, smaller job pass an earlier one that still does not fit")
        void smallerJobPassesBlockedHead() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits()
                .maxRunningJobs(10)
                .maxMemMb(1000)
                .build());
            BudgetManager manager = governor.manager;
            manager.registerJob("a", "batch", mem(800));
            manager.registerJob("e", "batch", mem(100));
            manager.registerJob("big", "batch", mem(950));
            manager.registerJob("small", "batch", mem(150));

            manager.finishJob("a", JobOutcome.COMPLETE);

            assertThat(manager.snapshot().idsIn(JobState.DELAYED)).containsExactly("big");
            assertThat(manager.job("small")).map(JobView::getState).contains(JobState.QUEUED);
            assertThat(manager.job("big").orElseThrow().getReason()).isEqualTo("mem 1050MB/1000MB");
        }

        @Test
        @DisplayName("counts each promotion before evaluating the next delayed job")
        void promotionsAccumulate() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits()
                .maxRunningJobs(10)
                .maxMemMb(1000)
                .build());
            BudgetManager manager = governor.manager;
            manager.registerJob("a", "batch", mem(1000));
            manager.registerJob("b", "batch", mem(600));
            manager.registerJob("c", "batch", mem(600));

            manager.finishJob("a", JobOutcome.COMPLETE);

            BudgetSnapshot snapshot = manager.snapshot();
            assertThat(snapshot.idsIn(JobState.QUEUED)).containsExactly("b");
            assertThat(snapshot.idsIn(JobState.DELAYED)).containsExactly("c");
        }

        @Test
        @DisplayName("promotes when observed load drops and returns nothing on a second call")
        void refreshIsIdempotent() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().maxCpuPercent(85).build());
            governor.metrics.load(90, 0, 0);
            governor.manager.registerJob("a", "batch", ResourceRequirement.of(5, 0));
            governor.manager.registerJob("b", "batch", ResourceRequirement.of(5, 0));

            governor.metrics.load(10, 0, 0);
            List<QueueTransition> first = governor.manager.refreshQueue();
            List<QueueTransition> second = governor.manager.refreshQueue();

            assertThat(first).extracting(QueueTransition::getJobId).containsExactly("a", "b");
            assertThat(first).allSatisfy(t -> {
                assertEquals(JobState.DELAYED, t.getFrom());
                assertEquals(JobState.QUEUED, t.getTo());
            });
            assertThat(second).isEmpty();
            assertThat(governor.meterRegistry.counter("governor.queue.promoted").count()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("limits")
    class Limits {

        @Test
        @DisplayName("raising the job cap promotes delayed jobs")
        void applyLimitsPromotes() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().maxRunningJobs(1).build());
            governor.manager.registerJob("a", "batch", mem(10));
            governor.manager.registerJob("b", "batch", mem(10));

            List<QueueTransition> transitions = governor.manager.applyLimits(
                governor.manager.limits().withMaxRunningJobs(2));

            assertThat(transitions).extracting(QueueTransition::getJobId).containsExactly("b");
            assertEquals(2, governor.manager.limits().getMaxRunningJobs());
            assertThat(governor.sink.names()).contains(EventNames.LIMITS_UPDATED);
        }

        @Test
        @DisplayName("shrinking limits never revokes admitted jobs")
        void shrinkingLimitsKeepsAdmittedJobs() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().maxRunningJobs(3).build());
            governor.manager.registerJob("a", "batch", mem(10));
            governor.manager.registerJob("b", "batch", mem(10));

            governor.manager.applyLimits(governor.manager.limits().withMaxRunningJobs(0));

            assertThat(governor.manager.snapshot().idsIn(JobState.QUEUED)).containsExactly("a", "b");
            AdmissionResult next = governor.manager.registerJob("c", "batch", mem(10));
            assertEquals(JobState.DELAYED, next.getQueueState());
        }

        @Test
        @DisplayName("leaves the active limits untouched when new ones are invalid")
        void invalidLimitsAreRejected() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().build());
            BudgetLimits before = governor.manager.limits();

            assertThatThrownBy(() -> governor.manager.applyLimits(before.withMaxMemMb(-1)))
                .isInstanceOf(InvalidLimitsException.class)
                .hasMessageContaining("maxMemMb");
            assertThat(governor.manager.limits()).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("memory pressure")
    class MemoryPressure {

        @Test
        @DisplayName("trims the asset cache to the target when memory is at the budget")
        void evictsAssetsUnderPressure() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits()
                .maxMemMb(1000)
                .lazyAssetTargetMb(300)
                .build(), entry -> true, UnloadFailurePolicy.REMOVE);
            governor.cache.register("x", 300, Map.of());
            governor.clock.advanceMillis(1);
            governor.cache.register("y", 300, Map.of());
            governor.metrics.load(0, 1000, 0);

            governor.manager.refreshQueue();

            assertThat(governor.cache.footprintMb()).isEqualTo(300.0);
            assertThat(governor.cache.get("x")).isEmpty();
            assertThat(governor.cache.get("y")).isPresent();
            assertThat(governor.sink.named(EventNames.ASSET_EVICTED)).hasSize(1);
        }

        @Test
        @DisplayName("leaves the cache alone below the budget")
        void noEvictionWithoutPressure() {
            GovernorFixture governor = new GovernorFixture(GovernorFixture.limits()
                .maxMemMb(1000)
                .lazyAssetTargetMb(0)
                .build());
            governor.cache.register("x", 300, Map.of());
            governor.metrics.load(0, 999, 0);

            governor.manager.refreshQueue();

            assertThat(governor.cache.size()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("reports counts and footprint in health")
    void health() {
        GovernorFixture governor = new GovernorFixture(GovernorFixture.limits().maxRunningJobs(2).build());
        governor.manager.registerJob("a", "batch", mem(10));
        governor.manager.registerJob("b", "batch", mem(10));
        governor.manager.registerJob("c", "batch", mem(10));
        governor.manager.startJob("a");
        governor.cache.register("asset", 42, Map.of());

        BudgetHealth health = governor.manager.health();

        assertEquals(1, health.getQueued());
        assertEquals(1, health.getRunning());
        assertEquals(1, health.getDelayed());
        assertEquals(3, health.getSeenJobs());
        assertEquals(1, health.getRegisteredAssets());
        assertEquals(42.0, health.getCacheFootprintMb());
        assertEquals(governor.clock.instant(), health.getLastEvaluation());
        assertThat(governor.meterRegistry.get("governor.jobs.delayed").gauge().value()).isEqualTo(1.0);
    }
}
