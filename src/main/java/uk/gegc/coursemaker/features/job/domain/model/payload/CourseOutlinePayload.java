package uk.gegc.coursemaker.features.job.domain.model.payload;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.util.UUID;

import static uk.gegc.coursemaker.features.job.domain.model.payload.GenerationJobPayload.requireRef;

public record CourseOutlinePayload(UUID courseId, String courseTitle, String audienceNotes)
        implements GenerationJobPayload {

    public static final int MAX_AUDIENCE_NOTES_LENGTH = 4000;

    @Override
    public GenerationJobType jobType() {
        return GenerationJobType.COURSE_OUTLINE;
    }

    @Override
    public void validate() {
        requireRef(courseId, "courseId", jobType());
        if (audienceNotes != null && audienceNotes.length() > MAX_AUDIENCE_NOTES_LENGTH) {
            throw new ValidationException("audienceNotes must not exceed " + MAX_AUDIENCE_NOTES_LENGTH + " characters");
        }
    }
}
