package uk.gegc.coursemaker.features.notification.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.notification.application.JobMilestoneNotifier;
import uk.gegc.coursemaker.features.notification.application.NewNotification;
import uk.gegc.coursemaker.features.notification.application.NotificationService;
import uk.gegc.coursemaker.features.notification.domain.model.NotificationPriority;
import uk.gegc.coursemaker.features.notification.domain.model.NotificationType;

@Slf4j
@Component
@RequiredArgsConstructor
public class JobMilestoneNotifierImpl implements JobMilestoneNotifier {

    static final String JOB_URL_PREFIX = "/api/v1/generation/jobs/";

    private final NotificationService notificationService;

    @Override
    public void jobStarted(GenerationJob job) {
        notify(job, NotificationType.GENERATION_STARTED, NotificationPriority.LOW,
                describe(job.getType()) + " started",
                "We are working on it. You will be notified when it is ready.");
    }

    @Override
    public void jobCompleted(GenerationJob job) {
        NotificationType type = switch (job.getType()) {
            case SME_INGESTION -> NotificationType.INGESTION_COMPLETE;
            case COURSE_OUTLINE -> NotificationType.OUTLINE_READY;
            default -> NotificationType.GENERATION_COMPLETE;
        };
        String message = job.getType() == GenerationJobType.COURSE_OUTLINE
                ? "The course outline is ready for review."
                : job.getProgressMessage();
        notify(job, type, NotificationPriority.NORMAL, describe(job.getType()) + " ready", message);
    }

    @Override
    public void jobFailed(GenerationJob job) {
        NotificationType type = job.getType() == GenerationJobType.SME_INGESTION
                ? NotificationType.INGESTION_FAILED
                : NotificationType.GENERATION_FAILED;
        String message = job.getErrorMessage() != null ? job.getErrorMessage() : "Generation did not complete.";
        notify(job, type, NotificationPriority.HIGH, describe(job.getType()) + " failed", message);
    }

    @Override
    public void batchStarted(GenerationJob parent, int lessonCount) {
        notify(parent, NotificationType.GENERATION_STARTED, NotificationPriority.LOW,
                "Course generation started",
                "Generating " + lessonCount + " lessons. You will be notified when the course is ready.");
    }

    private void notify(GenerationJob job, NotificationType type, NotificationPriority priority,
                        String title, String message) {
        if (job == null || job.isChild()) {
            return;
        }
        if (job.getCreatedByUserId() == null) {
            log.debug("Job {} has no requesting user; skipping {} notification", job.getId(), type);
            return;
        }
        try {
            notificationService.create(NewNotification.builder()
                    .tenantId(job.getTenantId())
                    .userId(job.getCreatedByUserId())
                    .type(type)
                    .priority(priority)
                    .title(title)
                    .message(message)
                    .actionUrl(JOB_URL_PREFIX + job.getId())
                    .jobId(job.getId())
                    .courseId(job.getCourseId())
                    .taskId(job.getSmeTaskId())
                    .build());
        } catch (Exception e) {
            log.warn("Failed to create {} notification for job {}", type, job.getId(), e);
        }
    }

    private static String describe(GenerationJobType type) {
        return switch (type) {
            case SME_INGESTION -> "Knowledge ingestion";
            case COURSE_OUTLINE -> "Course outline";
            case LESSON_CONTENT -> "Lesson";
            case COMPONENT_REGEN -> "Lesson component";
            case FULL_COURSE -> "Course";
        };
    }
}
