package uk.gegc.coursemaker.features.job.domain.model.payload;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;

import java.util.UUID;

import static uk.gegc.coursemaker.features.job.domain.model.payload.GenerationJobPayload.requireRef;

public record LessonContentPayload(UUID courseId, UUID lessonId) implements GenerationJobPayload {

    @Override
    public GenerationJobType jobType() {
        return GenerationJobType.LESSON_CONTENT;
    }

    @Override
    public void validate() {
        requireRef(courseId, "courseId", jobType());
        requireRef(lessonId, "lessonId", jobType());
    }
}
