package uk.gegc.coursemaker.features.job.domain.event;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;

import java.util.UUID;

/**
 * Published after a job reaches COMPLETED, FAILED or CANCELLED.
 * Batch aggregation listens for it to re-evaluate the parent.
 */
public record GenerationJobTerminatedEvent(
        UUID jobId,
        UUID tenantId,
        GenerationJobType type,
        GenerationJobStatus status,
        UUID parentJobId
) {

    public boolean isChild() {
        return parentJobId != null;
    }
}
