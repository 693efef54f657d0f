package uk.gegc.coursemaker.features.generation.application;

import uk.gegc.coursemaker.shared.exception.PermanentProviderException;
import uk.gegc.coursemaker.shared.exception.TransientProviderException;

/**
 * Single call to the AI provider. Implementations do not retry; retries belong to the job.
 */
public interface ContentGenerationClient {

    /**
     * @throws TransientProviderException on throttling, timeouts and empty responses
     * @throws PermanentProviderException when the provider rejects the request
     */
    AiCompletion generate(String systemPrompt, String userPrompt);
}
