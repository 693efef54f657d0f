package uk.gegc.coursemaker.features.generation.application.output;

/**
 * Model output for lesson and component generation.
 */
public record ContentDraft(String title, String content) {
}
