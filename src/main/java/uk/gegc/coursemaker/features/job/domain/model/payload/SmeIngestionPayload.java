package uk.gegc.coursemaker.features.job.domain.model.payload;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;

import java.util.UUID;

import static uk.gegc.coursemaker.features.job.domain.model.payload.GenerationJobPayload.requireRef;

public record SmeIngestionPayload(UUID smeTaskId, UUID submissionId) implements GenerationJobPayload {

    @Override
    public GenerationJobType jobType() {
        return GenerationJobType.SME_INGESTION;
    }

    @Override
    public void validate() {
        requireRef(smeTaskId, "smeTaskId", jobType());
        requireRef(submissionId, "submissionId", jobType());
    }
}
