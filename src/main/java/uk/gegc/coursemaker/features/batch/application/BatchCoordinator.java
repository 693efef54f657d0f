package uk.gegc.coursemaker.features.batch.application;

import uk.gegc.coursemaker.features.job.domain.event.GenerationJobTerminatedEvent;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;

import java.util.List;
import java.util.UUID;

/**
 * Fans a course out into one lesson job per outline lesson and folds the children's
 * outcomes back into a single parent job.
 */
public interface BatchCoordinator {

    /**
     * Create a FULL_COURSE parent plus one LESSON_CONTENT child per lesson and enqueue the children.
     *
     * @return the parent job, already PROCESSING
     */
    GenerationJob startLessonBatch(UUID tenantId, UUID userId, UUID courseId, List<UUID> lessonIds);

    /**
     * Re-evaluate the parent of a child that just reached a terminal state.
     */
    void onChildTerminal(GenerationJobTerminatedEvent event);

    /**
     * Re-run aggregation for a parent whose children's termination events may have been lost.
     *
     * @return true if this call moved the parent to a terminal state
     */
    boolean reconcileParent(UUID parentJobId);
}
