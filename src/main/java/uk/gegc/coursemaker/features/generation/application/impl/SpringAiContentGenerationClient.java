package uk.gegc.coursemaker.features.generation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Service;
import uk.gegc.coursemaker.features.generation.application.AiCompletion;
import uk.gegc.coursemaker.features.generation.application.ContentGenerationClient;
import uk.gegc.coursemaker.shared.exception.PermanentProviderException;
import uk.gegc.coursemaker.shared.exception.TransientProviderException;

import java.util.List;

/**
 * {@link ContentGenerationClient} over the Spring AI {@link ChatClient}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpringAiContentGenerationClient implements ContentGenerationClient {

    private final ChatClient chatClient;

    @Override
    public AiCompletion generate(String systemPrompt, String userPrompt) {
        Prompt prompt = new Prompt(List.of(
                new SystemMessage(systemPrompt),
                new UserMessage(userPrompt)
        ));

        ChatResponse response;
        try {
            response = chatClient.prompt(prompt)
                    .call()
                    .chatResponse();
        } catch (TransientAiException e) {
            throw new TransientProviderException("AI provider temporarily unavailable: " + e.getMessage(), e);
        } catch (NonTransientAiException e) {
            throw new PermanentProviderException("AI provider rejected the request: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (isRateLimitError(e)) {
                throw new TransientProviderException("AI provider rate limit hit: " + e.getMessage(), e);
            }
            throw e;
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new TransientProviderException("No response received from AI service");
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new TransientProviderException("Empty response received from AI service");
        }

        long tokensUsed = 0L;
        if (response.getMetadata() != null && response.getMetadata().getUsage() != null
                && response.getMetadata().getUsage().getTotalTokens() != null) {
            tokensUsed = response.getMetadata().getUsage().getTotalTokens().longValue();
        }
        log.debug("AI call returned {} characters using {} tokens", text.length(), tokensUsed);
        return new AiCompletion(text, tokensUsed);
    }

    private boolean isRateLimitError(Exception e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        return message.contains("429")
                || message.contains("rate limit")
                || message.contains("rate_limit_exceeded")
                || message.contains("Too Many Requests");
    }
}
