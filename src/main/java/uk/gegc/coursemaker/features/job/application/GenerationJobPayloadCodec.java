package uk.gegc.coursemaker.features.job.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.payload.GenerationJobPayload;
import uk.gegc.coursemaker.shared.exception.ValidationException;

/**
 * JSON mapping between {@link GenerationJobPayload} variants and the job's {@code payload} column.
 */
@Component
@RequiredArgsConstructor
public class GenerationJobPayloadCodec {

    private final ObjectMapper objectMapper;

    public String write(GenerationJobPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Job payload cannot be serialized: " + e.getOriginalMessage());
        }
    }

    /**
     * Reads the job's payload as the expected variant.
     *
     * @throws IllegalStateException if the stored payload is missing or of another variant
     */
    public <T extends GenerationJobPayload> T read(GenerationJob job, Class<T> expectedType) {
        if (job.getPayload() == null) {
            throw new IllegalStateException("Job " + job.getId() + " has no payload");
        }
        try {
            GenerationJobPayload payload = objectMapper.readValue(job.getPayload(), GenerationJobPayload.class);
            if (!expectedType.isInstance(payload)) {
                throw new IllegalStateException("Job " + job.getId() + " carries a " + payload.getClass().getSimpleName()
                        + " payload, expected " + expectedType.getSimpleName());
            }
            return expectedType.cast(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Job " + job.getId() + " has an unreadable payload: " + e.getOriginalMessage(), e);
        }
    }
}
