package uk.gegc.coursemaker.features.job.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.coursemaker.BaseUnitTest;
import uk.gegc.coursemaker.features.job.application.GenerationJobMetrics;
import uk.gegc.coursemaker.features.job.application.GenerationJobPayloadCodec;
import uk.gegc.coursemaker.features.job.config.JobProperties;
import uk.gegc.coursemaker.features.job.domain.event.GenerationJobTerminatedEvent;
import uk.gegc.coursemaker.features.job.domain.exception.InvalidJobStateException;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.job.domain.model.payload.CourseOutlinePayload;
import uk.gegc.coursemaker.features.job.domain.model.payload.FullCoursePayload;
import uk.gegc.coursemaker.features.job.domain.model.payload.LessonContentPayload;
import uk.gegc.coursemaker.features.job.domain.model.payload.SmeIngestionPayload;
import uk.gegc.coursemaker.features.job.domain.repository.GenerationJobRepository;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("GenerationJobServiceImpl")
class GenerationJobServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private GenerationJobRepository jobRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final UUID tenantId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();

    private GenerationJobServiceImpl service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new GenerationJobServiceImpl(
                jobRepository,
                new GenerationJobPayloadCodec(new ObjectMapper()),
                new GenerationJobMetrics(new SimpleMeterRegistry()),
                eventPublisher,
                new JobProperties(),
                clock);
    }

    private GenerationJob job(GenerationJobStatus status) {
        GenerationJob job = new GenerationJob();
        job.setId(UUID.randomUUID());
        job.setTenantId(tenantId);
        job.setCreatedByUserId(userId);
        job.setType(GenerationJobType.LESSON_CONTENT);
        job.setStatus(status);
        job.setMaxRetries(3);
        return job;
    }

    @Nested
    @DisplayName("createJob")
    class CreateJob {

        @Test
        @DisplayName("persists a QUEUED job with zero progress and the payload refs")
        void createJob_queuedWithZeroProgress() {
            // Given
            UUID courseId = UUID.randomUUID();
            when(jobRepository.save(any(GenerationJob.class))).thenAnswer(inv -> {
                GenerationJob saved = inv.getArgument(0);
                saved.setId(UUID.randomUUID());
                return saved;
            });

            // When
            GenerationJob created = service.createJob(tenantId, userId,
                    new CourseOutlinePayload(courseId, "Intro to Rust", null));

            // Then
            assertThat(created.getStatus()).isEqualTo(GenerationJobStatus.QUEUED);
            assertThat(created.getProgressPercent()).isZero();
            assertThat(created.getType()).isEqualTo(GenerationJobType.COURSE_OUTLINE);
            assertThat(created.getCourseId()).isEqualTo(courseId);
            assertThat(created.getTenantId()).isEqualTo(tenantId);
            assertThat(created.getMaxRetries()).isEqualTo(3);
            assertThat(created.getCreatedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
            assertThat(created.getPayload()).contains("COURSE_OUTLINE");
        }

        @Test
        @DisplayName("rejects a payload missing a required ref")
        void createJob_missingRef_throws() {
            assertThatThrownBy(() -> service.createJob(tenantId, userId, new SmeIngestionPayload(UUID.randomUUID(), null)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("submissionId");
            verify(jobRepository, never()).save(any());
        }

        @Test
        @DisplayName("rejects FULL_COURSE jobs outside the batch path")
        void createJob_batchParentType_throws() {
            assertThatThrownBy(() -> service.createJob(tenantId, userId, new FullCoursePayload(UUID.randomUUID())))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("rejects a missing tenant")
        void createJob_missingTenant_throws() {
            assertThatThrownBy(() -> service.createJob(null, userId,
                    new LessonContentPayload(UUID.randomUUID(), UUID.randomUUID())))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Tenant");
        }
    }

    @Nested
    @DisplayName("createChildJob")
    class CreateChildJob {

        @Test
        @DisplayName("inherits tenant and creator from the parent")
        void createChild_inheritsParent() {
            // Given
            GenerationJob parent = job(GenerationJobStatus.PROCESSING);
            parent.setType(GenerationJobType.FULL_COURSE);
            when(jobRepository.save(any(GenerationJob.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            GenerationJob child = service.createChildJob(parent,
                    new LessonContentPayload(UUID.randomUUID(), UUID.randomUUID()));

            // Then
            assertThat(child.getParentJobId()).isEqualTo(parent.getId());
            assertThat(child.getTenantId()).isEqualTo(tenantId);
            assertThat(child.getCreatedByUserId()).isEqualTo(userId);
            assertThat(child.getStatus()).isEqualTo(GenerationJobStatus.QUEUED);
        }

        @Test
        @DisplayName("refuses a parent that is not a batch parent")
        void createChild_nonBatchParent_throws() {
            GenerationJob parent = job(GenerationJobStatus.PROCESSING);

            assertThatThrownBy(() -> service.createChildJob(parent,
                    new LessonContentPayload(UUID.randomUUID(), UUID.randomUUID())))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("refuses a terminal parent")
        void createChild_terminalParent_throws() {
            GenerationJob parent = job(GenerationJobStatus.FAILED);
            parent.setType(GenerationJobType.FULL_COURSE);

            assertThatThrownBy(() -> service.createChildJob(parent,
                    new LessonContentPayload(UUID.randomUUID(), UUID.randomUUID())))
                    .isInstanceOf(InvalidJobStateException.class);
        }
    }

    @Nested
    @DisplayName("claim")
    class Claim {

        @Test
        @DisplayName("returns the job when the conditional update wins")
        void claim_wins() {
            GenerationJob claimed = job(GenerationJobStatus.PROCESSING);
            when(jobRepository.claim(eq(claimed.getId()), eq(GenerationJobStatus.QUEUED),
                    eq(GenerationJobStatus.PROCESSING), any(), anyString())).thenReturn(1);
            when(jobRepository.findById(claimed.getId())).thenReturn(Optional.of(claimed));

            assertThat(service.claim(claimed.getId())).contains(claimed);
        }

        @Test
        @DisplayName("returns empty when another worker already claimed the job")
        void claim_lostRace() {
            UUID id = UUID.randomUUID();
            when(jobRepository.claim(eq(id), any(), any(), any(), anyString())).thenReturn(0);

            assertThat(service.claim(id)).isEmpty();
            verify(jobRepository, never()).findById(id);
        }

        @Test
        @DisplayName("claimNext moves on to the next candidate after a lost race")
        void claimNext_skipsLostCandidate() {
            // Given
            UUID first = UUID.randomUUID();
            GenerationJob second = job(GenerationJobStatus.PROCESSING);
            when(jobRepository.findClaimCandidates(eq(GenerationJobStatus.QUEUED), anyCollection(), any(), any()))
                    .thenReturn(List.of(first, second.getId()));
            when(jobRepository.claim(eq(first), any(), any(), any(), anyString())).thenReturn(0);
            when(jobRepository.claim(eq(second.getId()), any(), any(), any(), anyString())).thenReturn(1);
            when(jobRepository.findById(second.getId())).thenReturn(Optional.of(second));

            // When
            Optional<GenerationJob> result = service.claimNext(Set.of(GenerationJobType.LESSON_CONTENT));

            // Then
            assertThat(result).contains(second);
        }

        @Test
        @DisplayName("claimNext without capabilities claims nothing")
        void claimNext_noCapabilities() {
            assertThat(service.claimNext(Set.of())).isEmpty();
            verify(jobRepository, never()).findClaimCandidates(any(), anyCollection(), any(), any());
        }
    }

    @Nested
    @DisplayName("updateProgress")
    class UpdateProgress {

        @Test
        @DisplayName("clamps the percentage into 0..100")
        void updateProgress_clamps() {
            UUID id = UUID.randomUUID();
            when(jobRepository.updateProgress(id, GenerationJobStatus.PROCESSING, 100, "done")).thenReturn(1);

            service.updateProgress(id, 140, "done");

            verify(jobRepository).updateProgress(id, GenerationJobStatus.PROCESSING, 100, "done");
        }

        @Test
        @DisplayName("ignores a regression on a PROCESSING job")
        void updateProgress_regressionIgnored() {
            GenerationJob running = job(GenerationJobStatus.PROCESSING);
            running.setProgressPercent(60);
            when(jobRepository.updateProgress(running.getId(), GenerationJobStatus.PROCESSING, 30, "back")).thenReturn(0);
            when(jobRepository.findById(running.getId())).thenReturn(Optional.of(running));

            service.updateProgress(running.getId(), 30, "back");

            assertThat(running.getProgressPercent()).isEqualTo(60);
        }

        @Test
        @DisplayName("rejects progress on a job that is not PROCESSING")
        void updateProgress_notProcessing_throws() {
            GenerationJob done = job(GenerationJobStatus.COMPLETED);
            when(jobRepository.updateProgress(eq(done.getId()), any(), anyInt(), anyString())).thenReturn(0);
            when(jobRepository.findById(done.getId())).thenReturn(Optional.of(done));

            assertThatThrownBy(() -> service.updateProgress(done.getId(), 50, "late"))
                    .isInstanceOf(InvalidJobStateException.class);
        }
    }

    @Nested
    @DisplayName("complete")
    class Complete {

        @Test
        @DisplayName("publishes a terminated event when the job completes")
        void complete_publishesEvent() {
            // Given
            GenerationJob job = job(GenerationJobStatus.COMPLETED);
            when(jobRepository.complete(eq(job.getId()), eq(GenerationJobStatus.PROCESSING),
                    eq(GenerationJobStatus.COMPLETED), eq("lessons/1"), eq(120L), anyString(), any())).thenReturn(1);
            when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

            // When
            service.complete(job.getId(), "lessons/1", 120);

            // Then
            ArgumentCaptor<GenerationJobTerminatedEvent> captor = ArgumentCaptor.forClass(GenerationJobTerminatedEvent.class);
            verify(eventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().jobId()).isEqualTo(job.getId());
            assertThat(captor.getValue().status()).isEqualTo(GenerationJobStatus.COMPLETED);
        }

        @Test
        @DisplayName("is a no-op on an already terminal job")
        void complete_terminal_noop() {
            GenerationJob cancelled = job(GenerationJobStatus.CANCELLED);
            when(jobRepository.complete(eq(cancelled.getId()), any(), any(), any(), anyLong(), anyString(), any()))
                    .thenReturn(0);
            when(jobRepository.findById(cancelled.getId())).thenReturn(Optional.of(cancelled));

            GenerationJob result = service.complete(cancelled.getId(), "x", 10);

            assertThat(result.getStatus()).isEqualTo(GenerationJobStatus.CANCELLED);
            verify(eventPublisher, never()).publishEvent(any());
        }
    }

    @Nested
    @DisplayName("fail")
    class Fail {

        @Test
        @DisplayName("requeues a retryable failure while retry budget remains")
        void fail_retryable_requeues() {
            // Given
            GenerationJob running = job(GenerationJobStatus.PROCESSING);
            running.setRetryCount(1);
            when(jobRepository.findById(running.getId())).thenReturn(Optional.of(running));
            when(jobRepository.requeueForRetry(eq(running.getId()), eq(GenerationJobStatus.PROCESSING),
                    eq(GenerationJobStatus.QUEUED), any(LocalDateTime.class), eq("provider timeout"), anyString()))
                    .thenReturn(1);

            // When
            service.fail(running.getId(), "provider timeout", true);

            // Then
            ArgumentCaptor<LocalDateTime> nextAttempt = ArgumentCaptor.forClass(LocalDateTime.class);
            verify(jobRepository).requeueForRetry(eq(running.getId()), any(), any(), nextAttempt.capture(), any(), any());
            assertThat(nextAttempt.getValue()).isAfter(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
            verify(jobRepository, never()).markFailed(any(), any(), any(), any(), any(), any());
            verify(eventPublisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("fails permanently once maxRetries attempts have been used")
        void fail_budgetExhausted_marksFailed() {
            // Given
            GenerationJob running = job(GenerationJobStatus.PROCESSING);
            running.setRetryCount(3);
            GenerationJob failed = job(GenerationJobStatus.FAILED);
            failed.setId(running.getId());
            failed.setRetryCount(3);
            when(jobRepository.findById(running.getId())).thenReturn(Optional.of(running), Optional.of(failed));
            when(jobRepository.markFailed(eq(running.getId()), eq(GenerationJobStatus.PROCESSING),
                    eq(GenerationJobStatus.FAILED), eq("still failing"), anyString(), any())).thenReturn(1);

            // When
            GenerationJob result = service.fail(running.getId(), "still failing", true);

            // Then
            assertThat(result.getStatus()).isEqualTo(GenerationJobStatus.FAILED);
            assertThat(result.getRetryCount()).isEqualTo(3);
            verify(jobRepository, never()).requeueForRetry(any(), any(), any(), any(), any(), any());
            verify(eventPublisher).publishEvent(any(GenerationJobTerminatedEvent.class));
        }

        @Test
        @DisplayName("a permanent failure skips the retry budget")
        void fail_permanent_marksFailed() {
            GenerationJob running = job(GenerationJobStatus.PROCESSING);
            when(jobRepository.findById(running.getId())).thenReturn(Optional.of(running));
            when(jobRepository.markFailed(eq(running.getId()), any(), any(), any(), any(), any())).thenReturn(1);

            service.fail(running.getId(), "bad request", false);

            verify(jobRepository, never()).requeueForRetry(any(), any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("is a no-op on an already terminal job")
        void fail_terminal_noop() {
            GenerationJob completed = job(GenerationJobStatus.COMPLETED);
            when(jobRepository.findById(completed.getId())).thenReturn(Optional.of(completed));

            GenerationJob result = service.fail(completed.getId(), "late", true);

            assertThat(result.getStatus()).isEqualTo(GenerationJobStatus.COMPLETED);
            verify(jobRepository, never()).markFailed(any(), any(), any(), any(), any(), any());
            verify(eventPublisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("truncates very long error messages")
        void fail_truncatesError() {
            GenerationJob running = job(GenerationJobStatus.PROCESSING);
            when(jobRepository.findById(running.getId())).thenReturn(Optional.of(running));
            when(jobRepository.markFailed(any(), any(), any(), anyString(), any(), any())).thenReturn(1);

            service.fail(running.getId(), "x".repeat(5000), false);

            ArgumentCaptor<String> error = ArgumentCaptor.forClass(String.class);
            verify(jobRepository).markFailed(any(), any(), any(), error.capture(), any(), any());
            assertThat(error.getValue()).hasSize(GenerationJobServiceImpl.MAX_ERROR_LENGTH);
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("is a no-op on a terminal job")
        void cancel_terminal_noop() {
            GenerationJob completed = job(GenerationJobStatus.COMPLETED);
            when(jobRepository.findById(completed.getId())).thenReturn(Optional.of(completed));

            GenerationJob result = service.cancel(completed.getId());

            assertThat(result.getStatus()).isEqualTo(GenerationJobStatus.COMPLETED);
            verify(jobRepository, never()).cancel(any(), anyCollection(), any(), any(), any());
        }

        @Test
        @DisplayName("cascades to the active children of a batch parent")
        void cancel_parent_cascades() {
            // Given
            GenerationJob parent = job(GenerationJobStatus.PROCESSING);
            parent.setType(GenerationJobType.FULL_COURSE);
            GenerationJob cancelledParent = job(GenerationJobStatus.CANCELLED);
            cancelledParent.setId(parent.getId());
            cancelledParent.setType(GenerationJobType.FULL_COURSE);
            UUID childA = UUID.randomUUID();
            UUID childB = UUID.randomUUID();

            when(jobRepository.findById(parent.getId())).thenReturn(Optional.of(parent), Optional.of(cancelledParent));
            when(jobRepository.cancel(eq(parent.getId()), anyCollection(), eq(GenerationJobStatus.CANCELLED), any(), any()))
                    .thenReturn(1);
            when(jobRepository.findChildIdsByStatusIn(eq(parent.getId()), anyCollection()))
                    .thenReturn(List.of(childA, childB));
            when(jobRepository.cancel(eq(childA), anyCollection(), any(), any(), any())).thenReturn(1);
            when(jobRepository.cancel(eq(childB), anyCollection(), any(), any(), any())).thenReturn(0);
            when(jobRepository.findById(childA)).thenReturn(Optional.of(job(GenerationJobStatus.CANCELLED)));

            // When
            GenerationJob result = service.cancel(parent.getId());

            // Then
            assertThat(result.getStatus()).isEqualTo(GenerationJobStatus.CANCELLED);
            verify(jobRepository).cancel(eq(childA), anyCollection(), any(), any(), any());
            verify(jobRepository).cancel(eq(childB), anyCollection(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("reclaimStale")
    class ReclaimStale {

        @Test
        @DisplayName("requeues jobs with budget and fails jobs without")
        void reclaimStale_mixed() {
            // Given
            GenerationJob withBudget = job(GenerationJobStatus.PROCESSING);
            GenerationJob exhausted = job(GenerationJobStatus.PROCESSING);
            exhausted.setRetryCount(3);
            when(jobRepository.findStaleJobs(eq(GenerationJobStatus.PROCESSING), eq(GenerationJobType.FULL_COURSE), any()))
                    .thenReturn(List.of(withBudget, exhausted));
            when(jobRepository.reclaimStale(eq(withBudget.getId()), any(), any(), any(), anyString())).thenReturn(1);
            when(jobRepository.markFailed(eq(exhausted.getId()), any(), any(), anyString(), anyString(), any()))
                    .thenReturn(1);
            when(jobRepository.findById(exhausted.getId())).thenReturn(Optional.of(exhausted));

            // When
            List<UUID> requeued = service.reclaimStale(Duration.ofMinutes(15));

            // Then
            assertThat(requeued).containsExactly(withBudget.getId());
            verify(eventPublisher).publishEvent(any(GenerationJobTerminatedEvent.class));
        }
    }
}
