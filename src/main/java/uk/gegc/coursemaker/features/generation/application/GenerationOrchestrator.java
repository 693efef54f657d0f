package uk.gegc.coursemaker.features.generation.application;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;

import java.util.List;
import java.util.UUID;

/**
 * Entry points that turn a user request into a queued generation job.
 * All methods return immediately; the work runs on the worker pool.
 */
public interface GenerationOrchestrator {

    GenerationJob startSmeIngestion(UUID tenantId, UUID userId, UUID smeTaskId, UUID submissionId);

    GenerationJob generateOutline(UUID tenantId, UUID userId, UUID courseId, String courseTitle, String audienceNotes);

    GenerationJob generateLesson(UUID tenantId, UUID userId, UUID courseId, UUID lessonId);

    GenerationJob regenerateComponent(UUID tenantId, UUID userId, UUID courseId, UUID lessonId,
                                      UUID componentId, String modificationPrompt);

    /**
     * Approve the outline: start one lesson job per outline lesson under a FULL_COURSE parent.
     *
     * @param lessonIds subset of the outline to generate; {@code null} or empty means the whole outline
     * @return the batch parent job
     */
    GenerationJob generateAllLessons(UUID tenantId, UUID userId, UUID courseId, List<UUID> lessonIds);
}
