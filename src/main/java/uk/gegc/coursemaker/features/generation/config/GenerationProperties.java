package uk.gegc.coursemaker.features.generation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for content generation handlers.
 */
@Data
@Component
@ConfigurationProperties(prefix = "coursemaker.generation")
public class GenerationProperties {

    /**
     * Number of top-ranked knowledge chunks fed into outline and lesson prompts.
     * Default: 20
     */
    private int rankedKnowledgeLimit = 20;

    /**
     * Time a tenant's ranked knowledge stays in the tenant cache.
     * Default: 5 minutes
     */
    private Duration knowledgeCacheTtl = Duration.ofMinutes(5);

    /**
     * Submission text beyond this many characters is cut before prompting.
     * Default: 60000
     */
    private int maxSubmissionChars = 60_000;
}
