package uk.gegc.coursemaker.features.generation.application;

/**
 * Raw model output and the tokens it cost.
 */
public record AiCompletion(String text, long tokensUsed) {
}
