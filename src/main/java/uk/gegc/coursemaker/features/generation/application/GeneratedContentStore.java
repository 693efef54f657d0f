package uk.gegc.coursemaker.features.generation.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.coursemaker.features.generation.application.output.ContentDraft;
import uk.gegc.coursemaker.features.generation.application.output.KnowledgeExtraction;
import uk.gegc.coursemaker.features.generation.application.output.OutlineDraft;
import uk.gegc.coursemaker.features.generation.domain.model.ArtifactKind;
import uk.gegc.coursemaker.features.generation.domain.model.GeneratedArtifact;
import uk.gegc.coursemaker.features.generation.domain.model.KnowledgeChunk;
import uk.gegc.coursemaker.features.generation.domain.model.OutlineLesson;
import uk.gegc.coursemaker.features.generation.domain.repository.GeneratedArtifactRepository;
import uk.gegc.coursemaker.features.generation.domain.repository.KnowledgeChunkRepository;
import uk.gegc.coursemaker.features.generation.domain.repository.OutlineLessonRepository;
import uk.gegc.coursemaker.shared.exception.StorageException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persists handler results. Each method is one transaction and replaces what an earlier
 * attempt of the same job may have written, so a redelivered job leaves one copy behind.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class GeneratedContentStore {

    static final double DEFAULT_RELEVANCE = 0.5;

    private final KnowledgeChunkRepository chunkRepository;
    private final OutlineLessonRepository outlineLessonRepository;
    private final GeneratedArtifactRepository artifactRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GeneratedArtifact storeKnowledge(UUID tenantId, UUID smeTaskId, UUID submissionId,
                                            KnowledgeExtraction extraction) {
        int removed = chunkRepository.deleteBySubmission(tenantId, submissionId);
        if (removed > 0) {
            log.info("Replacing {} knowledge chunk(s) from an earlier ingestion of submission {}", removed, submissionId);
        }

        List<KnowledgeChunk> chunks = new ArrayList<>();
        int position = 0;
        for (KnowledgeExtraction.Chunk extracted : extraction.chunks()) {
            if (extracted == null || extracted.content() == null || extracted.content().isBlank()) {
                continue;
            }
            KnowledgeChunk chunk = new KnowledgeChunk();
            chunk.setTenantId(tenantId);
            chunk.setSmeTaskId(smeTaskId);
            chunk.setSubmissionId(submissionId);
            chunk.setPosition(position++);
            chunk.setContent(extracted.content().trim());
            chunk.setRelevanceScore(clampScore(extracted.relevanceScore()));
            chunks.add(chunk);
        }
        chunkRepository.saveAll(chunks);

        GeneratedArtifact artifact = newArtifact(tenantId, ArtifactKind.KNOWLEDGE_SUMMARY, extraction.summary());
        artifact.setSmeTaskId(smeTaskId);
        GeneratedArtifact saved = artifactRepository.save(artifact);
        log.info("Stored {} knowledge chunk(s) and summary {} for submission {}", chunks.size(), saved.getId(), submissionId);
        return saved;
    }

    public GeneratedArtifact storeOutline(UUID tenantId, UUID courseId, OutlineDraft draft) {
        outlineLessonRepository.deleteByCourse(tenantId, courseId);

        List<OutlineLesson> lessons = new ArrayList<>();
        int position = 0;
        for (OutlineDraft.Section section : draft.sections()) {
            if (section.lessons() == null) {
                continue;
            }
            for (OutlineDraft.Lesson drafted : section.lessons()) {
                OutlineLesson lesson = new OutlineLesson();
                lesson.setTenantId(tenantId);
                lesson.setCourseId(courseId);
                lesson.setSectionTitle(section.title());
                lesson.setPosition(position++);
                lesson.setTitle(drafted.title());
                lesson.setSummary(drafted.summary());
                lessons.add(lesson);
            }
        }
        outlineLessonRepository.saveAll(lessons);

        GeneratedArtifact artifact = newArtifact(tenantId, ArtifactKind.OUTLINE, toJson(draft));
        artifact.setCourseId(courseId);
        GeneratedArtifact saved = artifactRepository.save(artifact);
        log.info("Stored outline {} with {} lesson(s) for course {}", saved.getId(), lessons.size(), courseId);
        return saved;
    }

    public GeneratedArtifact storeLesson(UUID tenantId, UUID courseId, UUID lessonId, ContentDraft draft) {
        GeneratedArtifact artifact = newArtifact(tenantId, ArtifactKind.LESSON, draft.content());
        artifact.setCourseId(courseId);
        artifact.setLessonId(lessonId);
        GeneratedArtifact saved = artifactRepository.save(artifact);
        log.info("Stored lesson artifact {} for lesson {}", saved.getId(), lessonId);
        return saved;
    }

    public GeneratedArtifact storeComponent(UUID tenantId, UUID courseId, UUID lessonId, UUID componentId,
                                            ContentDraft draft) {
        GeneratedArtifact artifact = newArtifact(tenantId, ArtifactKind.COMPONENT, draft.content());
        artifact.setCourseId(courseId);
        artifact.setLessonId(lessonId);
        artifact.setComponentId(componentId);
        GeneratedArtifact saved = artifactRepository.save(artifact);
        log.info("Stored component artifact {} for component {} of lesson {}", saved.getId(), componentId, lessonId);
        return saved;
    }

    private GeneratedArtifact newArtifact(UUID tenantId, ArtifactKind kind, String content) {
        GeneratedArtifact artifact = new GeneratedArtifact();
        artifact.setTenantId(tenantId);
        artifact.setKind(kind);
        artifact.setContent(content);
        artifact.setCreatedAt(LocalDateTime.now(clock));
        return artifact;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static double clampScore(Double score) {
        if (score == null || score.isNaN()) {
            return DEFAULT_RELEVANCE;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
