package com.example.bulkscheduler.service.registry;

import com.example.bulkscheduler.domain.entity.ScheduledJob;
import com.example.bulkscheduler.service.schedule.ScheduleCalculator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobTimerRegistry Tests")
class JobTimerRegistryTest {

    private ThreadPoolTaskScheduler taskScheduler;
    private ExecutionLock executionLock;
    private List<Long> fired;
    private JobTimerRegistry registry;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(2);
        taskScheduler.setRemoveOnCancelPolicy(true);
        taskScheduler.initialize();

        var clock = Clock.fixed(Instant.parse("2025-03-14T11:00:00Z"), ZoneOffset.UTC);
        executionLock = new ExecutionLock(clock);
        fired = Collections.synchronizedList(new ArrayList<>());

        registry = new JobTimerRegistry(taskScheduler, new SyncTaskExecutor(), new ScheduleCalculator(clock),
                executionLock, fired::add, clock);
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
        taskScheduler.shutdown();
    }

    private ScheduledJob job(Long id, String scheduleTime, boolean active) {
        return ScheduledJob.builder()
                .id(id)
                .name("Job " + id)
                .scheduleTime(scheduleTime)
                .timezone("America/New_York")
                .isActive(active)
                .build();
    }

    @Nested
    @DisplayName("arm Tests")
    class ArmTests {

        @Test
        @DisplayName("Should arm an active job with a daily cron in its timezone")
        void shouldArmActiveJob() {
            // When
            var armed = registry.arm(job(1L, "06:30", true));

            // Then
            assertThat(armed).isTrue();
            assertThat(registry.isArmed(1L)).isTrue();
            var timer = registry.findTimer(1L).orElseThrow();
            assertThat(timer.getCronExpression()).isEqualTo("0 30 6 * * *");
            assertThat(timer.getZone().getId()).isEqualTo("America/New_York");
            assertThat(timer.isRunning()).isTrue();
        }

        @Test
        @DisplayName("Should not arm an inactive job")
        void shouldNotArmInactiveJob() {
            var armed = registry.arm(job(1L, "06:30", false));

            assertThat(armed).isFalse();
            assertThat(registry.isArmed(1L)).isFalse();
            assertThat(registry.armedCount()).isZero();
        }

        @Test
        @DisplayName("Should replace the previous timer on re-arm")
        void shouldReplacePreviousTimerOnRearm() {
            // Given
            registry.arm(job(42L, "06:30", true));
            var first = registry.findTimer(42L).orElseThrow();

            // When
            registry.arm(job(42L, "08:15", true));

            // Then
            var second = registry.findTimer(42L).orElseThrow();
            assertThat(registry.armedCount()).isEqualTo(1);
            assertThat(second).isNotSameAs(first);
            assertThat(second.getCronExpression()).isEqualTo("0 15 8 * * *");
            assertThat(first.isDestroyed()).isTrue();
            assertThat(first.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Should leave exactly one timer after concurrent re-arms of the same job")
        void shouldLeaveOneTimerAfterConcurrentRearms() throws Exception {
            // Given
            var threads = 8;
            var pool = Executors.newFixedThreadPool(threads);
            var start = new CountDownLatch(1);
            var done = new CountDownLatch(threads);

            // When
            for (int i = 0; i < threads; i++) {
                var minute = String.format("06:%02d", i);
                pool.execute(() -> {
                    try {
                        start.await();
                        registry.arm(job(42L, minute, true));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();

            // Then
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            pool.shutdownNow();
            assertThat(registry.armedCount()).isEqualTo(1);
            assertThat(registry.status().getJobs()).hasSize(1);
            assertThat(taskScheduler.getScheduledThreadPoolExecutor().getQueue()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("teardownAndDestroy Tests")
    class TeardownTests {

        @Test
        @DisplayName("Should destroy the timer and clear the execution lock")
        void shouldDestroyTimerAndClearLock() {
            // Given
            registry.arm(job(1L, "06:30", true));
            var timer = registry.findTimer(1L).orElseThrow();
            executionLock.tryAcquire(1L);

            // When
            var removed = registry.teardownAndDestroy(1L);

            // Then
            assertThat(removed).isTrue();
            assertThat(registry.isArmed(1L)).isFalse();
            assertThat(timer.isDestroyed()).isTrue();
            assertThat(executionLock.isHeld(1L)).isFalse();
        }

        @Test
        @DisplayName("Should be a no-op for an unknown job id")
        void shouldBeNoOpForUnknownJob() {
            assertThat(registry.teardownAndDestroy(404L)).isFalse();
            assertThat(registry.teardownAndDestroy(404L)).isFalse();
        }
    }

    @Nested
    @DisplayName("emergencyStopAll Tests")
    class EmergencyStopTests {

        @Test
        @DisplayName("Should stop every armed timer and report the count")
        void shouldStopEveryTimer() {
            // Given
            for (long id = 1; id <= 5; id++) {
                registry.arm(job(id, "06:30", true));
            }

            // When
            var stopped = registry.emergencyStopAll();

            // Then
            assertThat(stopped).isEqualTo(5);
            assertThat(registry.status().getTotalActive()).isZero();
            assertThat(registry.status().getJobs()).isEmpty();
        }

        @Test
        @DisplayName("Should report zero when nothing is armed")
        void shouldReportZeroWhenEmpty() {
            assertThat(registry.emergencyStopAll()).isZero();
        }

        @Test
        @DisplayName("Should clear all execution locks on wipe")
        void shouldClearLocksOnWipe() {
            registry.arm(job(1L, "06:30", true));
            executionLock.tryAcquire(2L);

            var wiped = registry.wipeAll();

            assertThat(wiped).isEqualTo(1);
            assertThat(executionLock.heldCount()).isZero();
        }
    }

    @Nested
    @DisplayName("status Tests")
    class StatusTests {

        @Test
        @DisplayName("Should report each armed timer ordered by job id")
        void shouldReportArmedTimers() {
            // Given
            registry.arm(job(2L, "07:00", true));
            registry.arm(job(1L, "06:30", true));
            executionLock.tryAcquire(2L);

            // When
            var status = registry.status();

            // Then
            assertThat(status.getTotalActive()).isEqualTo(2);
            assertThat(status.getJobs()).extracting("id").containsExactly(1L, 2L);
            assertThat(status.getJobs().get(0).isRunning()).isTrue();
            assertThat(status.getJobs().get(0).isDestroyed()).isFalse();
            assertThat(status.getJobs().get(0).isExecuting()).isFalse();
            assertThat(status.getJobs().get(1).isExecuting()).isTrue();
        }
    }

    @Nested
    @DisplayName("fire Tests")
    class FireTests {

        @Test
        @DisplayName("Should hand a fire of the current timer to the fire handler")
        void shouldDispatchCurrentTimer() {
            // Given
            registry.arm(job(1L, "06:30", true));
            var timer = registry.findTimer(1L).orElseThrow();

            // When
            registry.fire(timer);

            // Then
            assertThat(fired).containsExactly(1L);
        }

        @Test
        @DisplayName("Should ignore a fire from a replaced timer")
        void shouldIgnoreReplacedTimer() {
            // Given
            registry.arm(job(1L, "06:30", true));
            var stale = registry.findTimer(1L).orElseThrow();
            registry.arm(job(1L, "07:30", true));

            // When
            registry.fire(stale);

            // Then
            assertThat(fired).isEmpty();
        }

        @Test
        @DisplayName("Should ignore a fire from a torn-down timer")
        void shouldIgnoreTornDownTimer() {
            // Given
            registry.arm(job(1L, "06:30", true));
            var timer = registry.findTimer(1L).orElseThrow();
            registry.teardownAndDestroy(1L);

            // When
            registry.fire(timer);

            // Then
            assertThat(fired).isEmpty();
        }

        @Test
        @DisplayName("Should contain an exception thrown by the fire handler")
        void shouldContainHandlerException() {
            // Given
            var clock = Clock.systemUTC();
            var failing = new JobTimerRegistry(taskScheduler, new SyncTaskExecutor(), new ScheduleCalculator(clock),
                    executionLock, jobId -> {
                        throw new IllegalStateException("boom");
                    }, clock);
            failing.arm(job(1L, "06:30", true));
            var timer = failing.findTimer(1L).orElseThrow();

            // When
            failing.fire(timer);

            // Then
            assertThat(failing.isArmed(1L)).isTrue();
            failing.shutdown();
        }

        @Test
        @DisplayName("Should drop a fire rejected by a full execution pool")
        void shouldDropRejectedFire() {
            // Given
            var clock = Clock.systemUTC();
            var rejected = Collections.synchronizedList(new ArrayList<Long>());
            var handler = new JobFireHandler() {
                @Override
                public void onFire(Long jobId) {
                    fired.add(jobId);
                }

                @Override
                public void onRejected(Long jobId) {
                    rejected.add(jobId);
                }
            };
            TaskExecutor fullPool = task -> {
                throw new TaskRejectedException("queue full");
            };
            var busy = new JobTimerRegistry(taskScheduler, fullPool, new ScheduleCalculator(clock), executionLock, handler, clock);
            busy.arm(job(1L, "06:30", true));
            var timer = busy.findTimer(1L).orElseThrow();

            // When
            busy.fire(timer);

            // Then
            assertThat(fired).isEmpty();
            assertThat(rejected).containsExactly(1L);
            assertThat(busy.isArmed(1L)).isTrue();
            busy.shutdown();
        }
    }

    @Nested
    @DisplayName("withJobLock Tests")
    class JobLockTests {

        @Test
        @DisplayName("Should leave no lock entries behind for unknown job ids")
        void shouldLeaveNoEntriesForUnknownIds() {
            // When
            for (long id = 1; id <= 10_000; id++) {
                registry.teardownAndDestroy(id);
            }

            // Then
            assertThat(registry.jobLockCount()).isZero();
            assertThat(registry.armedCount()).isZero();
        }

        @Test
        @DisplayName("Should drop the lock entry once the job is torn down")
        void shouldDropEntryAfterTeardown() {
            registry.arm(job(1L, "06:30", true));
            registry.teardownAndDestroy(1L);

            assertThat(registry.jobLockCount()).isZero();
        }

        @Test
        @DisplayName("Should be re-entrant for the same job id")
        void shouldBeReentrant() {
            var result = registry.withJobLock(3L, () -> registry.withJobLock(3L, () -> "inner"));

            assertThat(result).isEqualTo("inner");
            assertThat(registry.jobLockCount()).isZero();
        }

        @Test
        @DisplayName("Should keep serializing callers of one job id while entries come and go")
        void shouldSerializeCallersOfOneJob() throws Exception {
            // Given
            var threads = 8;
            var pool = Executors.newFixedThreadPool(threads);
            var start = new CountDownLatch(1);
            var inside = new AtomicInteger();
            var maxInside = new AtomicInteger();

            // When
            var futures = new ArrayList<Future<?>>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int round = 0; round < 200; round++) {
                        registry.withJobLock(9L, () -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            inside.decrementAndGet();
                            return null;
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (var future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
            pool.shutdownNow();

            // Then
            assertThat(maxInside.get()).isEqualTo(1);
            assertThat(registry.jobLockCount()).isZero();
        }
    }
}
