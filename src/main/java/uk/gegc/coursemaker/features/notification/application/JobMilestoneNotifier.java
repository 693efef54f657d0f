package uk.gegc.coursemaker.features.notification.application;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;

/**
 * Turns job lifecycle milestones into notifications for the user who requested the job.
 * Children of a batch are silent; the batch parent speaks for them.
 *
 * <p>Implementations never throw: a notification problem must not affect the job.
 */
public interface JobMilestoneNotifier {

    void jobStarted(GenerationJob job);

    void jobCompleted(GenerationJob job);

    void jobFailed(GenerationJob job);

    void batchStarted(GenerationJob parent, int lessonCount);
}
