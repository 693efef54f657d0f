package uk.gegc.coursemaker.features.job.domain.repository.projection;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;

/**
 * Per-status tally of a parent's children.
 */
public interface ChildStatusCount {

    GenerationJobStatus getStatus();

    long getTotal();

    Long getTokens();
}
