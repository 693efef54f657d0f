package uk.gegc.coursemaker.features.generation.application.output;

import java.util.List;

/**
 * Model output for SME ingestion.
 */
public record KnowledgeExtraction(String summary, List<Chunk> chunks) {

    public record Chunk(String content, Double relevanceScore) {
    }
}
