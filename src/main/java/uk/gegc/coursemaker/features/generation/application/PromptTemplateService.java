package uk.gegc.coursemaker.features.generation.application;

import java.util.Map;

/**
 * Prompt templates kept under {@code classpath:prompts/}.
 */
public interface PromptTemplateService {

    String buildSystemPrompt();

    /**
     * Load {@code prompts/<templateName>} and replace each {@code {key}} with its value.
     */
    String render(String templateName, Map<String, String> values);
}
