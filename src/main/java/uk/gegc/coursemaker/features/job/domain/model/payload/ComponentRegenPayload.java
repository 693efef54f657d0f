package uk.gegc.coursemaker.features.job.domain.model.payload;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.util.UUID;

import static uk.gegc.coursemaker.features.job.domain.model.payload.GenerationJobPayload.requireRef;

public record ComponentRegenPayload(UUID courseId, UUID lessonId, UUID componentId, String modificationPrompt)
        implements GenerationJobPayload {

    public static final int MAX_PROMPT_LENGTH = 2000;

    @Override
    public GenerationJobType jobType() {
        return GenerationJobType.COMPONENT_REGEN;
    }

    @Override
    public void validate() {
        requireRef(courseId, "courseId", jobType());
        requireRef(lessonId, "lessonId", jobType());
        requireRef(componentId, "componentId", jobType());
        if (modificationPrompt != null && modificationPrompt.length() > MAX_PROMPT_LENGTH) {
            throw new ValidationException("modificationPrompt must not exceed " + MAX_PROMPT_LENGTH + " characters");
        }
    }
}
