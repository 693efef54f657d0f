package uk.gegc.coursemaker.features.job.domain.model.payload;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;

import java.util.UUID;

import static uk.gegc.coursemaker.features.job.domain.model.payload.GenerationJobPayload.requireRef;

public record FullCoursePayload(UUID courseId) implements GenerationJobPayload {

    @Override
    public GenerationJobType jobType() {
        return GenerationJobType.FULL_COURSE;
    }

    @Override
    public void validate() {
        requireRef(courseId, "courseId", jobType());
    }
}
