package uk.gegc.coursemaker.features.notification.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import uk.gegc.coursemaker.BaseUnitTest;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.notification.application.NewNotification;
import uk.gegc.coursemaker.features.notification.application.NotificationService;
import uk.gegc.coursemaker.features.notification.domain.model.NotificationPriority;
import uk.gegc.coursemaker.features.notification.domain.model.NotificationType;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JobMilestoneNotifierImplTest extends BaseUnitTest {

    @Mock
    private NotificationService notificationService;

    @InjectMocks
    private JobMilestoneNotifierImpl notifier;

    private GenerationJob job(GenerationJobType type) {
        GenerationJob job = new GenerationJob();
        job.setId(UUID.randomUUID());
        job.setTenantId(UUID.randomUUID());
        job.setCreatedByUserId(UUID.randomUUID());
        job.setCourseId(UUID.randomUUID());
        job.setType(type);
        job.setStatus(GenerationJobStatus.PROCESSING);
        return job;
    }

    private NewNotification captured() {
        ArgumentCaptor<NewNotification> notification = ArgumentCaptor.forClass(NewNotification.class);
        verify(notificationService).create(notification.capture());
        return notification.getValue();
    }

    @Test
    @DisplayName("a finished outline tells the requesting user it is ready for review")
    void jobCompleted_outline() {
        GenerationJob job = job(GenerationJobType.COURSE_OUTLINE);

        notifier.jobCompleted(job);

        NewNotification notification = captured();
        assertThat(notification.type()).isEqualTo(NotificationType.OUTLINE_READY);
        assertThat(notification.userId()).isEqualTo(job.getCreatedByUserId());
        assertThat(notification.tenantId()).isEqualTo(job.getTenantId());
        assertThat(notification.title()).isEqualTo("Course outline ready");
        assertThat(notification.actionUrl()).isEqualTo("/api/v1/generation/jobs/" + job.getId());
        assertThat(notification.jobId()).isEqualTo(job.getId());
    }

    @Test
    @DisplayName("a failed ingestion is a high priority notification carrying the error")
    void jobFailed_ingestion() {
        GenerationJob job = job(GenerationJobType.SME_INGESTION);
        job.setErrorMessage("Submission has no readable text");

        notifier.jobFailed(job);

        NewNotification notification = captured();
        assertThat(notification.type()).isEqualTo(NotificationType.INGESTION_FAILED);
        assertThat(notification.priority()).isEqualTo(NotificationPriority.HIGH);
        assertThat(notification.message()).isEqualTo("Submission has no readable text");
    }

    @Test
    @DisplayName("a batch start names the number of lessons")
    void batchStarted_countsLessons() {
        notifier.batchStarted(job(GenerationJobType.FULL_COURSE), 5);

        NewNotification notification = captured();
        assertThat(notification.type()).isEqualTo(NotificationType.GENERATION_STARTED);
        assertThat(notification.message()).contains("5 lessons");
    }

    @Test
    @DisplayName("child jobs of a batch never notify on their own")
    void childJob_silent() {
        GenerationJob child = job(GenerationJobType.LESSON_CONTENT);
        child.setParentJobId(UUID.randomUUID());

        notifier.jobStarted(child);
        notifier.jobCompleted(child);
        notifier.jobFailed(child);

        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("a job without a requesting user is skipped")
    void noUser_silent() {
        GenerationJob job = job(GenerationJobType.LESSON_CONTENT);
        job.setCreatedByUserId(null);

        notifier.jobCompleted(job);

        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("a notification failure never reaches the job pipeline")
    void serviceFailure_contained() {
        when(notificationService.create(any(NewNotification.class))).thenThrow(new ValidationException("broken"));

        assertThatCode(() -> notifier.jobCompleted(job(GenerationJobType.LESSON_CONTENT))).doesNotThrowAnyException();
    }
}
