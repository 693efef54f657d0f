package uk.gegc.coursemaker.features.generation.application.handler;

import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.generation.application.ContentGenerationClient;
import uk.gegc.coursemaker.features.generation.application.GeneratedContentStore;
import uk.gegc.coursemaker.features.generation.application.GeneratedOutputParser;
import uk.gegc.coursemaker.features.generation.application.KnowledgeRankingService;
import uk.gegc.coursemaker.features.generation.application.KnowledgeRankingService.RankedKnowledge;
import uk.gegc.coursemaker.features.generation.application.PromptTemplateService;
import uk.gegc.coursemaker.features.generation.application.output.ContentDraft;
import uk.gegc.coursemaker.features.generation.domain.model.OutlineLesson;
import uk.gegc.coursemaker.features.generation.domain.repository.OutlineLessonRepository;
import uk.gegc.coursemaker.features.job.application.GenerationJobPayloadCodec;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.job.domain.model.payload.LessonContentPayload;
import uk.gegc.coursemaker.shared.exception.ResourceNotFoundException;
import uk.gegc.coursemaker.shared.exception.TransientProviderException;

import java.util.Map;

/**
 * Writes the content of one outline lesson.
 */
@Component
public class LessonContentHandler
        extends CheckpointedJobHandler<LessonContentPayload, LessonContentHandler.LessonContext, ContentDraft> {

    private final OutlineLessonRepository outlineLessonRepository;
    private final KnowledgeRankingService knowledgeRanking;
    private final GeneratedContentStore contentStore;

    public LessonContentHandler(GenerationJobPayloadCodec payloadCodec,
                                ContentGenerationClient generationClient,
                                PromptTemplateService promptTemplates,
                                GeneratedOutputParser outputParser,
                                OutlineLessonRepository outlineLessonRepository,
                                KnowledgeRankingService knowledgeRanking,
                                GeneratedContentStore contentStore) {
        super(payloadCodec, generationClient, promptTemplates, outputParser);
        this.outlineLessonRepository = outlineLessonRepository;
        this.knowledgeRanking = knowledgeRanking;
        this.contentStore = contentStore;
    }

    @Override
    public GenerationJobType handlesType() {
        return GenerationJobType.LESSON_CONTENT;
    }

    @Override
    protected Class<LessonContentPayload> payloadType() {
        return LessonContentPayload.class;
    }

    @Override
    protected Class<ContentDraft> outputType() {
        return ContentDraft.class;
    }

    @Override
    protected LessonContext gatherContext(GenerationJob job, LessonContentPayload payload) {
        OutlineLesson lesson = outlineLessonRepository
                .findByIdAndTenantIdAndCourseId(payload.lessonId(), job.getTenantId(), payload.courseId())
                .orElseThrow(() -> new ResourceNotFoundException("Outline lesson not found with ID: " + payload.lessonId()));
        return new LessonContext(lesson, knowledgeRanking.rankedKnowledge(job.getTenantId()));
    }

    @Override
    protected String buildUserPrompt(LessonContentPayload payload, LessonContext gathered) {
        OutlineLesson lesson = gathered.lesson();
        return promptTemplates().render("lesson-content.txt", Map.of(
                "sectionTitle", lesson.getSectionTitle(),
                "lessonTitle", lesson.getTitle(),
                "lessonSummary", lesson.getSummary() != null ? lesson.getSummary() : "",
                "knowledge", gathered.knowledge().asPromptBlock()));
    }

    @Override
    protected void validateOutput(ContentDraft output) {
        if (output.content() == null || output.content().isBlank()) {
            throw new TransientProviderException("AI returned empty lesson content");
        }
    }

    @Override
    protected String persist(GenerationJob job, LessonContentPayload payload, LessonContext gathered,
                             ContentDraft output) {
        return contentStore.storeLesson(job.getTenantId(), payload.courseId(), payload.lessonId(), output).resultPath();
    }

    record LessonContext(OutlineLesson lesson, RankedKnowledge knowledge) {
    }
}
