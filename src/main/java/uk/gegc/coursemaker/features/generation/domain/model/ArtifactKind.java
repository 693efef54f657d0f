package uk.gegc.coursemaker.features.generation.domain.model;

public enum ArtifactKind {
    OUTLINE,
    LESSON,
    COMPONENT,
    KNOWLEDGE_SUMMARY
}
