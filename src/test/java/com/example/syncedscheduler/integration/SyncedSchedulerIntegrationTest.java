package com.example.syncedscheduler.integration;

import com.example.syncedscheduler.TestcontainersConfiguration;
import com.example.syncedscheduler.config.SchedulerMetrics;
import com.example.syncedscheduler.config.SyncedSchedulerProperties;
import com.example.syncedscheduler.domain.enums.FiringOutcome;
import com.example.syncedscheduler.domain.repository.JobWatermarkRepository;
import com.example.syncedscheduler.lock.DistributedLock;
import com.example.syncedscheduler.schedule.CronJobSpec;
import com.example.syncedscheduler.service.DedupGuard;
import com.example.syncedscheduler.service.SyncedScheduler;
import com.example.syncedscheduler.store.WatermarkStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs the guard against PostgreSQL through the real watermark store and ShedLock provider.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("SyncedScheduler Integration Tests")
class SyncedSchedulerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SyncedScheduler syncedScheduler;

    @Autowired
    private WatermarkStore watermarkStore;

    @Autowired
    private DistributedLock distributedLock;

    @Autowired
    private JobWatermarkRepository watermarkRepository;

    @Autowired
    private SyncedSchedulerProperties properties;

    @Autowired
    private Clock clock;

    private ThreadPoolTaskScheduler secondInstanceScheduler;

    @AfterEach
    void tearDown() {
        syncedScheduler.getJobs().forEach(handle -> handle.cancel());
        if (secondInstanceScheduler != null) {
            secondInstanceScheduler.shutdown();
        }
    }

    private DedupGuard newGuard() {
        return new DedupGuard(watermarkStore, distributedLock, new SchedulerMetrics(new SimpleMeterRegistry()), clock);
    }

    @Test
    @DisplayName("Should execute a cron occurrence once when instances race on the database lock")
    void shouldExecuteOnceAgainstDatabase() throws Exception {
        // Given
        var instances = 4;
        var spec = new CronJobSpec("0 * * * *");
        var executions = new AtomicInteger();
        var start = new CountDownLatch(1);
        var pool = Executors.newFixedThreadPool(instances);
        var now = ZonedDateTime.now(clock);
        var firing = spec.nextFiring(now);

        try {
            var futures = new ArrayList<Future<FiringOutcome>>();
            for (var i = 0; i < instances; i++) {
                var guard = newGuard();
                Callable<FiringOutcome> task = () -> {
                    start.await();
                    return guard.guard("it-hourly-digest", firing, executions::incrementAndGet);
                };
                futures.add(pool.submit(task));
            }

            // When
            start.countDown();
            var executed = 0;
            for (var future : futures) {
                if (future.get(30, TimeUnit.SECONDS) == FiringOutcome.EXECUTED) {
                    executed++;
                }
            }

            // Then
            assertThat(executed).isEqualTo(1);
            assertThat(executions.get()).isEqualTo(1);
            var watermark = watermarkRepository.findById("it-hourly-digest").orElseThrow();
            assertThat(watermark.getNextExecution()).isEqualTo(firing.getNextExecution());
            assertThat(watermark.getUpdatedBy()).isNotBlank();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should run a one-off job once when two instances schedule it")
    void shouldRunOneOffOnceAcrossInstances() throws Exception {
        // Given
        secondInstanceScheduler = new ThreadPoolTaskScheduler();
        secondInstanceScheduler.setThreadNamePrefix("second-instance-");
        secondInstanceScheduler.initialize();
        var secondInstance = new SyncedScheduler(newGuard(), secondInstanceScheduler, properties,
                new SchedulerMetrics(new SimpleMeterRegistry()), clock);

        var executions = new AtomicInteger();
        var firstRun = new CountDownLatch(1);
        Runnable action = () -> {
            executions.incrementAndGet();
            firstRun.countDown();
        };
        var date = Instant.now().plusSeconds(1);

        // When
        syncedScheduler.scheduleJob("it-launch", date, action);
        secondInstance.scheduleJob("it-launch", date, action);

        // Then
        assertThat(firstRun.await(10, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(1000);
        assertThat(executions.get()).isEqualTo(1);
        assertThat(watermarkStore.get("it-launch")).hasValue(date.toEpochMilli());
    }

    @Test
    @DisplayName("Should lock and claim a job with the longest accepted name")
    void shouldClaimLongestJobName() {
        // Given
        var jobName = "it-" + "n".repeat(197);
        var firing = new CronJobSpec("0 * * * *").nextFiring(ZonedDateTime.now(clock));
        var executions = new AtomicInteger();

        // When
        var outcome = newGuard().guard(jobName, firing, executions::incrementAndGet);

        // Then
        assertThat(outcome).isEqualTo(FiringOutcome.EXECUTED);
        assertThat(executions.get()).isEqualTo(1);
        assertThat(watermarkStore.get(jobName)).hasValue(firing.getNextExecution());
    }

    @Test
    @DisplayName("Should report no watermark for a job never claimed")
    void shouldReportMissingWatermark() {
        assertThat(watermarkStore.get("it-never-fired")).isEmpty();
    }

    @Test
    @DisplayName("Should expose registered jobs and shared watermarks over the API")
    void shouldExposeJobsAndWatermarks() throws Exception {
        // Given
        syncedScheduler.scheduleJob("it-api-digest", "0 0 * * *", () -> {
        });
        watermarkStore.set("it-api-digest", 1_792_454_400_000L);

        // When / Then
        mockMvc.perform(get("/api/v1/jobs/it-api-digest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.kind").value("CRON"))
                .andExpect(jsonPath("$.data.watermark.nextExecution").value(1_792_454_400_000L));

        mockMvc.perform(post("/api/v1/jobs/it-api-digest/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.cancelled").value(true));

        mockMvc.perform(get("/api/v1/jobs/it-api-digest"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/watermarks/it-api-digest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.jobName").value("it-api-digest"));
    }
}
