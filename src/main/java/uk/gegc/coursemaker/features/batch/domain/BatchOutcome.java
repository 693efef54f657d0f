package uk.gegc.coursemaker.features.batch.domain;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;

public record BatchOutcome(GenerationJobStatus status, String message) {

    public static BatchOutcome completed(String message) {
        return new BatchOutcome(GenerationJobStatus.COMPLETED, message);
    }

    public static BatchOutcome failed(String message) {
        return new BatchOutcome(GenerationJobStatus.FAILED, message);
    }

    public boolean isFailure() {
        return status == GenerationJobStatus.FAILED;
    }
}
