package uk.gegc.coursemaker.features.generation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.coursemaker.features.batch.application.BatchCoordinator;
import uk.gegc.coursemaker.features.generation.application.GenerationOrchestrator;
import uk.gegc.coursemaker.features.generation.domain.model.OutlineLesson;
import uk.gegc.coursemaker.features.generation.domain.repository.OutlineLessonRepository;
import uk.gegc.coursemaker.features.job.application.GenerationJobService;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.payload.ComponentRegenPayload;
import uk.gegc.coursemaker.features.job.domain.model.payload.CourseOutlinePayload;
import uk.gegc.coursemaker.features.job.domain.model.payload.GenerationJobPayload;
import uk.gegc.coursemaker.features.job.domain.model.payload.LessonContentPayload;
import uk.gegc.coursemaker.features.job.domain.model.payload.SmeIngestionPayload;
import uk.gegc.coursemaker.features.worker.application.GenerationJobDispatcher;
import uk.gegc.coursemaker.shared.exception.ResourceNotFoundException;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationOrchestratorImpl implements GenerationOrchestrator {

    private final GenerationJobService jobService;
    private final GenerationJobDispatcher dispatcher;
    private final BatchCoordinator batchCoordinator;
    private final OutlineLessonRepository outlineLessonRepository;

    @Override
    public GenerationJob startSmeIngestion(UUID tenantId, UUID userId, UUID smeTaskId, UUID submissionId) {
        return createAndDispatch(tenantId, userId, new SmeIngestionPayload(smeTaskId, submissionId));
    }

    @Override
    public GenerationJob generateOutline(UUID tenantId, UUID userId, UUID courseId,
                                         String courseTitle, String audienceNotes) {
        return createAndDispatch(tenantId, userId, new CourseOutlinePayload(courseId, courseTitle, audienceNotes));
    }

    @Override
    public GenerationJob generateLesson(UUID tenantId, UUID userId, UUID courseId, UUID lessonId) {
        requireOutlineLesson(tenantId, courseId, lessonId);
        return createAndDispatch(tenantId, userId, new LessonContentPayload(courseId, lessonId));
    }

    @Override
    public GenerationJob regenerateComponent(UUID tenantId, UUID userId, UUID courseId, UUID lessonId,
                                             UUID componentId, String modificationPrompt) {
        return createAndDispatch(tenantId, userId,
                new ComponentRegenPayload(courseId, lessonId, componentId, modificationPrompt));
    }

    @Override
    public GenerationJob generateAllLessons(UUID tenantId, UUID userId, UUID courseId, List<UUID> lessonIds) {
        List<OutlineLesson> outline = outlineLessonRepository.findByTenantIdAndCourseIdOrderByPositionAsc(tenantId, courseId);
        if (outline.isEmpty()) {
            throw new ValidationException("Course " + courseId + " has no outline; generate and approve an outline first");
        }

        List<UUID> selected;
        if (lessonIds == null || lessonIds.isEmpty()) {
            selected = outline.stream().map(OutlineLesson::getId).toList();
        } else {
            Set<UUID> known = outline.stream().map(OutlineLesson::getId).collect(Collectors.toSet());
            for (UUID lessonId : lessonIds) {
                if (!known.contains(lessonId)) {
                    throw new ValidationException("Lesson " + lessonId + " is not part of the outline of course " + courseId);
                }
            }
            selected = lessonIds;
        }

        return batchCoordinator.startLessonBatch(tenantId, userId, courseId, selected);
    }

    private GenerationJob createAndDispatch(UUID tenantId, UUID userId, GenerationJobPayload payload) {
        GenerationJob job = jobService.createJob(tenantId, userId, payload);
        if (!dispatcher.dispatch(job)) {
            log.warn("Job {} saved but not enqueued; it will be picked up by polling", job.getId());
        }
        return job;
    }

    private void requireOutlineLesson(UUID tenantId, UUID courseId, UUID lessonId) {
        if (courseId == null || lessonId == null) {
            throw new ValidationException("courseId and lessonId are required");
        }
        outlineLessonRepository.findByIdAndTenantIdAndCourseId(lessonId, tenantId, courseId)
                .orElseThrow(() -> new ResourceNotFoundException("Outline lesson not found with ID: " + lessonId));
    }
}
