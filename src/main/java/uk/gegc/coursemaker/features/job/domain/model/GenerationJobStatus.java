package uk.gegc.coursemaker.features.job.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a generation job.
 * <pre>
 * QUEUED -> PROCESSING -> COMPLETED | QUEUED (retry) | FAILED | CANCELLED
 * QUEUED -> CANCELLED
 * </pre>
 */
public enum GenerationJobStatus {

    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<GenerationJobStatus> ACTIVE = EnumSet.of(QUEUED, PROCESSING);

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
