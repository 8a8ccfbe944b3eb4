package com.example.syncedscheduler.service;

import com.example.syncedscheduler.config.SchedulerMetrics;
import com.example.syncedscheduler.domain.enums.FiringOutcome;
import com.example.syncedscheduler.lock.InMemoryDistributedLock;
import com.example.syncedscheduler.schedule.CronJobSpec;
import com.example.syncedscheduler.schedule.OneOffJobSpec;
import com.example.syncedscheduler.store.InMemoryWatermarkStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Several simulated instances share one watermark store and one lock, as they would in production.
 */
@DisplayName("Multi-instance deduplication Tests")
class MultiInstanceDedupTest {

    private static final Instant FIRED_AT = Instant.parse("2026-10-19T10:00:00.003Z");

    private InMemoryWatermarkStore sharedStore;
    private InMemoryDistributedLock sharedLock;
    private Clock clock;

    @BeforeEach
    void setUp() {
        sharedStore = new InMemoryWatermarkStore();
        sharedLock = new InMemoryDistributedLock();
        clock = Clock.fixed(FIRED_AT, ZoneOffset.UTC);
    }

    private DedupGuard newInstance() {
        return new DedupGuard(sharedStore, sharedLock, new SchedulerMetrics(new SimpleMeterRegistry()), clock);
    }

    @Test
    @DisplayName("Should execute a recurring job once when all instances fire together")
    void shouldExecuteOnceAcrossInstances() throws Exception {
        var instances = 8;
        var spec = new CronJobSpec("0 * * * *");
        var executions = new AtomicInteger();
        var start = new CountDownLatch(1);
        var pool = Executors.newFixedThreadPool(instances);

        try {
            var futures = new ArrayList<Future<FiringOutcome>>();
            for (var i = 0; i < instances; i++) {
                var guard = newInstance();
                Callable<FiringOutcome> firing = () -> {
                    start.await();
                    var now = ZonedDateTime.now(clock);
                    return guard.guard("digest", spec.nextFiring(now), executions::incrementAndGet);
                };
                futures.add(pool.submit(firing));
            }
            start.countDown();

            var executed = 0;
            for (var future : futures) {
                if (future.get(5, TimeUnit.SECONDS) == FiringOutcome.EXECUTED) {
                    executed++;
                }
            }

            assertThat(executed).isEqualTo(1);
            assertThat(executions.get()).isEqualTo(1);
            assertThat(sharedStore.get("digest").getAsLong())
                    .isEqualTo(Instant.parse("2026-10-19T11:00:00Z").toEpochMilli());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Hourly digest: first instance runs, second finds its occurrence claimed")
    void digestScenario() {
        var spec = new CronJobSpec("0 * * * *");
        var instanceA = newInstance();
        var instanceB = newInstance();
        var ranOn = new ArrayList<String>();
        var now = ZonedDateTime.now(clock);

        var outcomeA = instanceA.guard("digest", spec.nextFiring(now), () -> ranOn.add("A"));
        var outcomeB = instanceB.guard("digest", spec.nextFiring(now), () -> ranOn.add("B"));

        assertThat(outcomeA).isEqualTo(FiringOutcome.EXECUTED);
        assertThat(outcomeB).isEqualTo(FiringOutcome.SKIPPED);
        assertThat(ranOn).containsExactly("A");
    }

    @Test
    @DisplayName("Should run the next hourly occurrence once time has moved past the watermark")
    void shouldRunNextOccurrence() {
        var spec = new CronJobSpec("0 * * * *");
        var executions = new AtomicInteger();
        newInstance().guard("digest", spec.nextFiring(ZonedDateTime.now(clock)), executions::incrementAndGet);

        var nextHour = Clock.fixed(Instant.parse("2026-10-19T11:00:00.002Z"), ZoneOffset.UTC);
        var laterInstance = new DedupGuard(sharedStore, sharedLock, new SchedulerMetrics(new SimpleMeterRegistry()), nextHour);
        var outcome = laterInstance.guard("digest", spec.nextFiring(ZonedDateTime.now(nextHour)), executions::incrementAndGet);

        assertThat(outcome).isEqualTo(FiringOutcome.EXECUTED);
        assertThat(executions.get()).isEqualTo(2);
        assertThat(sharedStore.get("digest").getAsLong())
                .isEqualTo(Instant.parse("2026-10-19T12:00:00Z").toEpochMilli());
    }

    @Test
    @DisplayName("Should execute a one-off job once across instances")
    void shouldExecuteOneOffOnce() {
        var spec = new OneOffJobSpec(Instant.parse("2026-10-19T10:00:00Z"));
        var executions = new AtomicInteger();
        var now = ZonedDateTime.now(clock);

        for (var i = 0; i < 3; i++) {
            newInstance().guard("launch", spec.nextFiring(now), executions::incrementAndGet);
        }

        assertThat(executions.get()).isEqualTo(1);
    }
}
