package uk.gegc.coursemaker.features.worker.application;

import uk.gegc.coursemaker.features.queue.domain.model.QueueTask;

/**
 * Handler for queue tasks that are not generation jobs, such as tenant provisioning.
 * Throwing nacks the task, so queue retries and dead-lettering apply.
 */
public interface QueueTaskHandler {

    String handlesTaskType();

    void handle(QueueTask task);
}
