package uk.gegc.coursemaker.features.generation.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.shared.exception.TransientProviderException;

/**
 * Reads model output as JSON into an output record. Malformed output is reported as a
 * transient provider failure: asking again usually produces valid JSON.
 */
@Component
@RequiredArgsConstructor
public class GeneratedOutputParser {

    private final ObjectMapper objectMapper;

    public <T> T parse(String rawResponse, Class<T> outputType) {
        String cleaned = cleanJsonResponse(rawResponse);
        try {
            T output = objectMapper.readerFor(outputType)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(cleaned);
            if (output == null) {
                throw new TransientProviderException("AI returned no " + outputType.getSimpleName());
            }
            return output;
        } catch (JsonProcessingException e) {
            throw new TransientProviderException("AI returned unparseable " + outputType.getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    static String cleanJsonResponse(String response) {
        String cleaned = response == null ? "" : response.trim();

        // Strip markdown code fences (```json ... ``` or ``` ... ```)
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
