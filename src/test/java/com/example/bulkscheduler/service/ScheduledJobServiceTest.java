package com.example.bulkscheduler.service;

import com.example.bulkscheduler.config.BulkSchedulerProperties;
import com.example.bulkscheduler.config.MetricsConfig;
import com.example.bulkscheduler.config.SafeguardProperties;
import com.example.bulkscheduler.domain.entity.ScheduledJob;
import com.example.bulkscheduler.domain.enums.AiModel;
import com.example.bulkscheduler.domain.enums.GenerationOrigin;
import com.example.bulkscheduler.domain.enums.RunOutcome;
import com.example.bulkscheduler.dto.CreateScheduledJobRequest;
import com.example.bulkscheduler.dto.ScheduledJobResponse;
import com.example.bulkscheduler.dto.SchedulerStatusResponse;
import com.example.bulkscheduler.dto.UpdateSafeguardsRequest;
import com.example.bulkscheduler.dto.UpdateScheduledJobRequest;
import com.example.bulkscheduler.exception.InvalidJobDefinitionException;
import com.example.bulkscheduler.exception.JobNotFoundException;
import com.example.bulkscheduler.mapper.ScheduledJobMapper;
import com.example.bulkscheduler.service.alert.SlackAlertService;
import com.example.bulkscheduler.service.executor.JobExecutionResult;
import com.example.bulkscheduler.service.executor.ScheduledJobExecutor;
import com.example.bulkscheduler.service.registry.ExecutionLock;
import com.example.bulkscheduler.service.registry.JobTimerRegistry;
import com.example.bulkscheduler.service.safeguard.ConfigurableGenerationSafeguard;
import com.example.bulkscheduler.service.schedule.ScheduleCalculator;
import com.example.bulkscheduler.service.store.ScheduledJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScheduledJobService Tests")
class ScheduledJobServiceTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final Instant NOW = ZonedDateTime.of(2025, 3, 14, 7, 0, 0, 0, NEW_YORK).toInstant();

    @Mock
    private ScheduledJobStore jobStore;

    @Mock
    private JobTimerRegistry timerRegistry;

    @Mock
    private ScheduledJobExecutor jobExecutor;

    @Mock
    private ScheduledJobMapper jobMapper;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    @Captor
    private ArgumentCaptor<ScheduledJob> jobCaptor;

    private SafeguardProperties safeguardProperties;
    private ScheduledJobService jobService;
    private ScheduledJob testJob;

    @BeforeEach
    void setUp() {
        var clock = Clock.fixed(NOW, NEW_YORK);
        safeguardProperties = new SafeguardProperties();

        jobService = new ScheduledJobService(jobStore, timerRegistry, new ExecutionLock(clock), jobExecutor,
                new ScheduleCalculator(clock), new ConfigurableGenerationSafeguard(safeguardProperties),
                safeguardProperties, new BulkSchedulerProperties(), jobMapper, slackAlertService, metricsConfig, clock);

        testJob = ScheduledJob.builder()
                .id(42L)
                .userId(1L)
                .name("Morning Beauty")
                .scheduleTime("06:30")
                .timezone("America/New_York")
                .isActive(true)
                .selectedNiches(new ArrayList<>(List.of("beauty")))
                .tones(new ArrayList<>(List.of("Enthusiastic")))
                .templates(new ArrayList<>(List.of("Short-Form Video Script")))
                .platforms(new ArrayList<>(List.of("TikTok")))
                .build();
    }

    private void givenMapperEchoes() {
        when(jobMapper.toResponse(any(ScheduledJob.class))).thenAnswer(inv -> {
            ScheduledJob job = inv.getArgument(0);
            return ScheduledJobResponse.builder()
                    .id(job.getId())
                    .name(job.getName())
                    .scheduleTime(job.getScheduleTime())
                    .isActive(job.getIsActive())
                    .nextRunAt(job.getNextRunAt())
                    .totalRuns(job.getTotalRuns())
                    .build();
        });
    }

    @SuppressWarnings("unchecked")
    private void givenJobLockRunsAction() {
        when(timerRegistry.withJobLock(eq(42L), any())).thenAnswer(inv -> ((Supplier<Object>) inv.getArgument(1)).get());
    }

    @Nested
    @DisplayName("Job Creation Tests")
    class JobCreationTests {

        @Test
        @DisplayName("Should apply defaults, store the job and arm it")
        void shouldApplyDefaultsStoreAndArm() {
            // Given
            var request = CreateScheduledJobRequest.builder()
                    .scheduleTime("06:30")
                    .selectedNiches(List.of("beauty", "skincare"))
                    .build();
            when(jobStore.insert(any(ScheduledJob.class))).thenAnswer(inv -> {
                ScheduledJob job = inv.getArgument(0);
                job.setId(42L);
                return job;
            });
            when(timerRegistry.arm(any())).thenReturn(true);
            when(timerRegistry.isArmed(42L)).thenReturn(true);
            givenMapperEchoes();

            // When
            var response = jobService.createJob(request);

            // Then
            verify(jobStore).insert(jobCaptor.capture());
            var saved = jobCaptor.getValue();
            assertThat(saved.getName()).isEqualTo("Daily beauty, skincare content (Enthusiastic)");
            assertThat(saved.getTimezone()).isEqualTo("America/New_York");
            assertThat(saved.getUserId()).isEqualTo(1L);
            assertThat(saved.getTones()).containsExactly("Enthusiastic");
            assertThat(saved.getTemplates()).containsExactly("Short-Form Video Script");
            assertThat(saved.getPlatforms()).containsExactly("TikTok");
            assertThat(saved.getAiModel()).isEqualTo(AiModel.CLAUDE);
            assertThat(saved.getUseExistingProducts()).isTrue();
            assertThat(saved.getSendToMakeWebhook()).isTrue();
            assertThat(saved.getIsActive()).isTrue();
            assertThat(saved.getTotalRuns()).isZero();
            assertThat(saved.getNextRunAt()).isEqualTo(ZonedDateTime.of(2025, 3, 15, 6, 30, 0, 0, NEW_YORK).toInstant());

            var inOrder = inOrder(jobStore, timerRegistry);
            inOrder.verify(jobStore).insert(any());
            inOrder.verify(timerRegistry).arm(saved);

            assertThat(response.getId()).isEqualTo(42L);
            assertThat(response.isArmed()).isTrue();
            assertThat(response.isExecuting()).isFalse();
        }

        @Test
        @DisplayName("Should keep supplied values")
        void shouldKeepSuppliedValues() {
            // Given
            var request = CreateScheduledJobRequest.builder()
                    .name("  Evening Tech  ")
                    .scheduleTime("19:15")
                    .timezone("Europe/London")
                    .selectedNiches(List.of("tech"))
                    .tones(List.of("Informative"))
                    .aiModel(AiModel.CHATGPT)
                    .affiliateId("  ")
                    .isActive(false)
                    .build();
            when(jobStore.insert(any(ScheduledJob.class))).thenAnswer(inv -> inv.getArgument(0));
            givenMapperEchoes();

            // When
            jobService.createJob(request);

            // Then
            verify(jobStore).insert(jobCaptor.capture());
            var saved = jobCaptor.getValue();
            assertThat(saved.getName()).isEqualTo("Evening Tech");
            assertThat(saved.getTimezone()).isEqualTo("Europe/London");
            assertThat(saved.getTones()).containsExactly("Informative");
            assertThat(saved.getAiModel()).isEqualTo(AiModel.CHATGPT);
            assertThat(saved.getAffiliateId()).isNull();
            assertThat(saved.getIsActive()).isFalse();
        }

        @Test
        @DisplayName("Should reject an unknown timezone before storing anything")
        void shouldRejectUnknownTimezone() {
            // Given
            var request = CreateScheduledJobRequest.builder()
                    .scheduleTime("06:30")
                    .timezone("Nowhere/Land")
                    .selectedNiches(List.of("beauty"))
                    .build();

            // When / Then
            assertThatThrownBy(() -> jobService.createJob(request))
                    .isInstanceOf(InvalidJobDefinitionException.class);
            verifyNoInteractions(jobStore, timerRegistry);
        }

        @Test
        @DisplayName("Should not arm anything when the store write fails")
        void shouldNotArmWhenStoreFails() {
            // Given
            var request = CreateScheduledJobRequest.builder()
                    .scheduleTime("06:30")
                    .selectedNiches(List.of("beauty"))
                    .build();
            when(jobStore.insert(any())).thenThrow(new DataAccessResourceFailureException("db down"));

            // When / Then
            assertThatThrownBy(() -> jobService.createJob(request))
                    .isInstanceOf(DataAccessResourceFailureException.class);
            verifyNoInteractions(timerRegistry);
        }

        @Test
        @DisplayName("Should remove the stored job when arming fails")
        void shouldRemoveJobWhenArmingFails() {
            // Given
            var request = CreateScheduledJobRequest.builder()
                    .scheduleTime("06:30")
                    .selectedNiches(List.of("beauty"))
                    .build();
            when(jobStore.insert(any())).thenAnswer(inv -> {
                ScheduledJob job = inv.getArgument(0);
                job.setId(42L);
                return job;
            });
            when(timerRegistry.arm(any())).thenThrow(new IllegalStateException("scheduler shut down"));

            // When / Then
            assertThatThrownBy(() -> jobService.createJob(request))
                    .isInstanceOf(IllegalStateException.class);
            verify(jobStore).delete(42L);
        }
    }

    @Nested
    @DisplayName("Job Update Tests")
    class JobUpdateTests {

        @Test
        @DisplayName("Should tear down, store and re-arm in order")
        @SuppressWarnings("unchecked")
        void shouldTearDownStoreAndRearm() {
            // Given
            givenJobLockRunsAction();
            givenMapperEchoes();
            when(jobStore.exists(42L)).thenReturn(true);
            when(jobStore.update(eq(42L), any())).thenAnswer(inv -> {
                ((Consumer<ScheduledJob>) inv.getArgument(1)).accept(testJob);
                return testJob;
            });
            when(timerRegistry.arm(testJob)).thenReturn(true);
            var request = UpdateScheduledJobRequest.builder().scheduleTime("08:15").tones(List.of("Calm")).build();

            // When
            var response = jobService.updateJob(42L, request);

            // Then
            var inOrder = inOrder(timerRegistry, jobStore);
            inOrder.verify(timerRegistry).teardownAndDestroy(42L);
            inOrder.verify(jobStore).update(eq(42L), any());
            inOrder.verify(timerRegistry).arm(testJob);

            assertThat(testJob.getScheduleTime()).isEqualTo("08:15");
            assertThat(testJob.getTones()).containsExactly("Calm");
            assertThat(testJob.getName()).isEqualTo("Morning Beauty");
            assertThat(testJob.getNextRunAt()).isEqualTo(ZonedDateTime.of(2025, 3, 14, 8, 15, 0, 0, NEW_YORK).toInstant());
            assertThat(response.getScheduleTime()).isEqualTo("08:15");
        }

        @Test
        @DisplayName("Should deactivate a job without leaving a timer")
        @SuppressWarnings("unchecked")
        void shouldDeactivateJob() {
            // Given
            givenJobLockRunsAction();
            givenMapperEchoes();
            when(jobStore.exists(42L)).thenReturn(true);
            when(jobStore.update(eq(42L), any())).thenAnswer(inv -> {
                ((Consumer<ScheduledJob>) inv.getArgument(1)).accept(testJob);
                return testJob;
            });

            // When
            var response = jobService.updateJob(42L, UpdateScheduledJobRequest.builder().isActive(false).build());

            // Then
            verify(timerRegistry).teardownAndDestroy(42L);
            assertThat(testJob.getIsActive()).isFalse();
            assertThat(response.getIsActive()).isFalse();
            assertThat(response.isArmed()).isFalse();
        }

        @Test
        @DisplayName("Should keep the current name when the new one is blank")
        @SuppressWarnings("unchecked")
        void shouldKeepNameWhenBlank() {
            // Given
            givenJobLockRunsAction();
            givenMapperEchoes();
            when(jobStore.exists(42L)).thenReturn(true);
            when(jobStore.update(eq(42L), any())).thenAnswer(inv -> {
                ((Consumer<ScheduledJob>) inv.getArgument(1)).accept(testJob);
                return testJob;
            });

            // When
            var response = jobService.updateJob(42L, UpdateScheduledJobRequest.builder().name("   ").build());

            // Then
            assertThat(testJob.getName()).isEqualTo("Morning Beauty");
            assertThat(response.getName()).isEqualTo("Morning Beauty");
        }

        @Test
        @DisplayName("Should throw when the job does not exist")
        void shouldThrowWhenJobMissing() {
            // Given
            givenJobLockRunsAction();
            when(jobStore.exists(42L)).thenReturn(false);

            // When / Then
            assertThatThrownBy(() -> jobService.updateJob(42L, new UpdateScheduledJobRequest()))
                    .isInstanceOf(JobNotFoundException.class);
            verify(timerRegistry, never()).teardownAndDestroy(any());
        }

        @Test
        @DisplayName("Should reject a malformed schedule before touching the timer")
        void shouldRejectMalformedSchedule() {
            // When / Then
            assertThatThrownBy(() -> jobService.updateJob(42L, UpdateScheduledJobRequest.builder().scheduleTime("25:00").build()))
                    .isInstanceOf(InvalidJobDefinitionException.class);
            verifyNoInteractions(timerRegistry, jobStore);
        }

        @Test
        @DisplayName("Should re-arm the stored definition when the update fails")
        void shouldRestoreTimerWhenUpdateFails() {
            // Given
            givenJobLockRunsAction();
            when(jobStore.exists(42L)).thenReturn(true);
            when(jobStore.update(eq(42L), any())).thenThrow(new DataAccessResourceFailureException("db down"));
            when(jobStore.findById(42L)).thenReturn(Optional.of(testJob));

            // When / Then
            assertThatThrownBy(() -> jobService.updateJob(42L, UpdateScheduledJobRequest.builder().name("x").build()))
                    .isInstanceOf(DataAccessResourceFailureException.class);
            verify(timerRegistry).teardownAndDestroy(42L);
            verify(timerRegistry).arm(testJob);
        }
    }

    @Nested
    @DisplayName("Job Deletion Tests")
    class JobDeletionTests {

        @Test
        @DisplayName("Should tear down the timer before deleting")
        void shouldTearDownBeforeDeleting() {
            // Given
            givenJobLockRunsAction();
            when(jobStore.exists(42L)).thenReturn(true);

            // When
            jobService.deleteJob(42L);

            // Then
            var inOrder = inOrder(timerRegistry, jobStore);
            inOrder.verify(timerRegistry).teardownAndDestroy(42L);
            inOrder.verify(jobStore).delete(42L);
        }

        @Test
        @DisplayName("Should throw when the job does not exist")
        void shouldThrowWhenJobMissing() {
            // Given
            givenJobLockRunsAction();
            when(jobStore.exists(42L)).thenReturn(false);

            // When / Then
            assertThatThrownBy(() -> jobService.deleteJob(42L)).isInstanceOf(JobNotFoundException.class);
            verify(jobStore, never()).delete(any());
        }

        @Test
        @DisplayName("Should restore the timer when the delete fails")
        void shouldRestoreTimerWhenDeleteFails() {
            // Given
            givenJobLockRunsAction();
            when(jobStore.exists(42L)).thenReturn(true);
            doThrow(new DataAccessResourceFailureException("db down")).when(jobStore).delete(42L);
            when(jobStore.findById(42L)).thenReturn(Optional.of(testJob));

            // When / Then
            assertThatThrownBy(() -> jobService.deleteJob(42L)).isInstanceOf(DataAccessResourceFailureException.class);
            verify(timerRegistry).arm(testJob);
        }
    }

    @Nested
    @DisplayName("Manual Trigger Tests")
    class ManualTriggerTests {

        @Test
        @DisplayName("Should run the job and return the refreshed job")
        void shouldRunJobAndReturnRefreshedJob() {
            // Given
            when(jobStore.findById(42L)).thenReturn(Optional.of(testJob));
            when(jobExecutor.runManual(testJob)).thenReturn(JobExecutionResult.success(42L, 5, "ok"));
            givenMapperEchoes();

            // When
            var response = jobService.triggerJob(42L);

            // Then
            assertThat(response.getOutcome()).isEqualTo(RunOutcome.SUCCEEDED);
            assertThat(response.getGeneratedCount()).isEqualTo(5);
            assertThat(response.getMessage()).isEqualTo("Generated 5 pieces of content");
            assertThat(response.getJob().getId()).isEqualTo(42L);
        }

        @Test
        @DisplayName("Should pass through a currently running result")
        void shouldPassThroughAlreadyRunning() {
            // Given
            when(jobStore.findById(42L)).thenReturn(Optional.of(testJob));
            when(jobExecutor.runManual(testJob)).thenReturn(JobExecutionResult.alreadyRunning(42L));
            givenMapperEchoes();

            // When
            var response = jobService.triggerJob(42L);

            // Then
            assertThat(response.getOutcome()).isEqualTo(RunOutcome.ALREADY_RUNNING);
            assertThat(response.getMessage()).isEqualTo("Job is currently running");
        }

        @Test
        @DisplayName("Should throw when the job does not exist")
        void shouldThrowWhenJobMissing() {
            when(jobStore.findById(42L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> jobService.triggerJob(42L)).isInstanceOf(JobNotFoundException.class);
            verifyNoInteractions(jobExecutor);
        }
    }

    @Nested
    @DisplayName("Registry Control Tests")
    class RegistryControlTests {

        @Test
        @DisplayName("Should stop all timers, record and alert")
        void shouldStopAllTimers() {
            // Given
            when(timerRegistry.emergencyStopAll()).thenReturn(3);

            // When
            var response = jobService.emergencyStop();

            // Then
            assertThat(response.getStoppedCount()).isEqualTo(3);
            assertThat(response.getStoppedAt()).isEqualTo(NOW);
            verify(metricsConfig).recordEmergencyStop(3);
            verify(slackAlertService).sendEmergencyStopAlert(3);
        }

        @Test
        @DisplayName("Should delegate status to the registry")
        void shouldDelegateStatus() {
            var status = SchedulerStatusResponse.builder().totalActive(2).build();
            when(timerRegistry.status()).thenReturn(status);

            assertThat(jobService.getStatus()).isSameAs(status);
        }

        @Test
        @DisplayName("Should report safeguard configuration and verdicts")
        void shouldReportSafeguardStatus() {
            // Given
            safeguardProperties.setProductionMode(true);

            // When
            var status = jobService.getSafeguardStatus();

            // Then
            assertThat(status.isProductionMode()).isTrue();
            assertThat(status.getDecisions()).hasSize(GenerationOrigin.values().length);
            assertThat(status.getDecisions())
                    .filteredOn(d -> d.getOrigin() == GenerationOrigin.MANUAL_TRIGGER)
                    .singleElement()
                    .satisfies(d -> assertThat(d.isAllowed()).isTrue());
            assertThat(status.getDecisions())
                    .filteredOn(d -> d.getOrigin() == GenerationOrigin.SCHEDULED_JOB)
                    .singleElement()
                    .satisfies(d -> assertThat(d.getReason()).contains("allow-scheduled-generation"));
        }
    }

    @Nested
    @DisplayName("Safeguard Control Tests")
    class SafeguardControlTests {

        @Test
        @DisplayName("Should switch scheduled generation on at runtime")
        void shouldEnableScheduledGeneration() {
            // Given
            safeguardProperties.setProductionMode(true);

            // When
            var status = jobService.updateSafeguards(UpdateSafeguardsRequest.builder()
                    .allowScheduledGeneration(true)
                    .build());

            // Then
            assertThat(safeguardProperties.isAllowScheduledGeneration()).isTrue();
            assertThat(status.isAllowScheduledGeneration()).isTrue();
            assertThat(status.getDecisions())
                    .filteredOn(d -> d.getOrigin() == GenerationOrigin.SCHEDULED_JOB)
                    .singleElement()
                    .satisfies(d -> assertThat(d.isAllowed()).isTrue());
        }

        @Test
        @DisplayName("Should block every origin when generation is switched off")
        void shouldDisableGeneration() {
            // When
            var status = jobService.updateSafeguards(UpdateSafeguardsRequest.builder()
                    .generationEnabled(false)
                    .build());

            // Then
            assertThat(status.isGenerationEnabled()).isFalse();
            assertThat(status.getDecisions()).allSatisfy(d -> assertThat(d.isAllowed()).isFalse());
            assertThat(safeguardProperties.isAllowManualGeneration()).isTrue();
        }

        @Test
        @DisplayName("Should leave settings alone for an empty request")
        void shouldIgnoreEmptyRequest() {
            jobService.updateSafeguards(new UpdateSafeguardsRequest());

            assertThat(safeguardProperties.isGenerationEnabled()).isTrue();
            assertThat(safeguardProperties.isAllowScheduledGeneration()).isFalse();
            assertThat(safeguardProperties.isAllowManualGeneration()).isTrue();
        }
    }

    @Nested
    @DisplayName("Startup Initialization Tests")
    class StartupInitializationTests {

        @Test
        @DisplayName("Should wipe the registry and arm every active job")
        void shouldWipeAndArmActiveJobs() {
            // Given
            var other = ScheduledJob.builder().id(43L).name("Broken").scheduleTime("07:00").timezone("UTC").build();
            when(jobStore.findActive()).thenReturn(List.of(testJob, other));
            when(timerRegistry.arm(testJob)).thenReturn(true);
            when(timerRegistry.arm(other)).thenThrow(new IllegalStateException("cannot schedule"));

            // When
            var armed = jobService.initializeScheduledJobs();

            // Then
            assertThat(armed).isEqualTo(1);
            var inOrder = inOrder(timerRegistry);
            inOrder.verify(timerRegistry).wipeAll();
            inOrder.verify(timerRegistry).arm(testJob);
            inOrder.verify(timerRegistry).arm(other);
        }

        @Test
        @DisplayName("Should arm nothing when blocked by safeguards")
        void shouldArmNothingWhenBlocked() {
            // Given
            safeguardProperties.setGenerationEnabled(false);

            // When
            var armed = jobService.initializeScheduledJobs();

            // Then
            assertThat(armed).isZero();
            verifyNoInteractions(timerRegistry, jobStore);
            verify(slackAlertService).sendErrorAlert(eq("Scheduled Jobs Not Started"), any(), any());
            verify(metricsConfig).recordSafeguardBlock(GenerationOrigin.STARTUP_INIT);
        }
    }

    @Nested
    @DisplayName("Job Retrieval Tests")
    class JobRetrievalTests {

        @Test
        @DisplayName("Should filter by owner when given")
        void shouldFilterByOwner() {
            // Given
            when(jobStore.findByUser(1L)).thenReturn(List.of(testJob));
            givenMapperEchoes();

            // When
            var jobs = jobService.listJobs(1L);

            // Then
            assertThat(jobs).hasSize(1);
            verify(jobStore, never()).findAll();
        }

        @Test
        @DisplayName("Should throw for run history of a missing job")
        void shouldThrowForRunsOfMissingJob() {
            when(jobStore.exists(7L)).thenReturn(false);

            assertThatThrownBy(() -> jobService.getRecentRuns(7L)).isInstanceOf(JobNotFoundException.class);
        }
    }
}
