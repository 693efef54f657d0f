package uk.gegc.coursemaker.features.job.domain.model.payload;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.util.UUID;

/**
 * Typed input of a generation job, one variant per {@link GenerationJobType}.
 *
 * <p>Each variant declares which correlation refs it needs and checks them in {@link #validate()},
 * which runs when the job is created. The refs are also copied onto the job row so they
 * can be filtered and indexed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SmeIngestionPayload.class, name = "SME_INGESTION"),
        @JsonSubTypes.Type(value = CourseOutlinePayload.class, name = "COURSE_OUTLINE"),
        @JsonSubTypes.Type(value = LessonContentPayload.class, name = "LESSON_CONTENT"),
        @JsonSubTypes.Type(value = ComponentRegenPayload.class, name = "COMPONENT_REGEN"),
        @JsonSubTypes.Type(value = FullCoursePayload.class, name = "FULL_COURSE")
})
public interface GenerationJobPayload {

    GenerationJobType jobType();

    /**
     * @throws ValidationException if a ref required by this job type is missing or malformed
     */
    void validate();

    default UUID courseId() {
        return null;
    }

    default UUID lessonId() {
        return null;
    }

    default UUID smeTaskId() {
        return null;
    }

    default UUID submissionId() {
        return null;
    }

    static void requireRef(Object value, String field, GenerationJobType type) {
        if (value == null) {
            throw new ValidationException(field + " is required for " + type + " jobs");
        }
    }
}
