package uk.gegc.coursemaker.features.generation.application.handler;

import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.generation.application.ContentGenerationClient;
import uk.gegc.coursemaker.features.generation.application.GeneratedContentStore;
import uk.gegc.coursemaker.features.generation.application.GeneratedOutputParser;
import uk.gegc.coursemaker.features.generation.application.KnowledgeRankingService;
import uk.gegc.coursemaker.features.generation.application.KnowledgeRankingService.RankedKnowledge;
import uk.gegc.coursemaker.features.generation.application.PromptTemplateService;
import uk.gegc.coursemaker.features.generation.application.output.OutlineDraft;
import uk.gegc.coursemaker.features.job.application.GenerationJobPayloadCodec;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.job.domain.model.payload.CourseOutlinePayload;
import uk.gegc.coursemaker.shared.exception.TransientProviderException;

import java.util.Map;

/**
 * Drafts a course outline from the tenant's ranked knowledge. Replaces any previous outline
 * of the course.
 */
@Component
public class CourseOutlineHandler extends CheckpointedJobHandler<CourseOutlinePayload, RankedKnowledge, OutlineDraft> {

    private final KnowledgeRankingService knowledgeRanking;
    private final GeneratedContentStore contentStore;

    public CourseOutlineHandler(GenerationJobPayloadCodec payloadCodec,
                                ContentGenerationClient generationClient,
                                PromptTemplateService promptTemplates,
                                GeneratedOutputParser outputParser,
                                KnowledgeRankingService knowledgeRanking,
                                GeneratedContentStore contentStore) {
        super(payloadCodec, generationClient, promptTemplates, outputParser);
        this.knowledgeRanking = knowledgeRanking;
        this.contentStore = contentStore;
    }

    @Override
    public GenerationJobType handlesType() {
        return GenerationJobType.COURSE_OUTLINE;
    }

    @Override
    protected Class<CourseOutlinePayload> payloadType() {
        return CourseOutlinePayload.class;
    }

    @Override
    protected Class<OutlineDraft> outputType() {
        return OutlineDraft.class;
    }

    @Override
    protected RankedKnowledge gatherContext(GenerationJob job, CourseOutlinePayload payload) {
        return knowledgeRanking.rankedKnowledge(job.getTenantId());
    }

    @Override
    protected String buildUserPrompt(CourseOutlinePayload payload, RankedKnowledge knowledge) {
        return promptTemplates().render("course-outline.txt", Map.of(
                "courseTitle", payload.courseTitle() != null ? payload.courseTitle() : "Untitled course",
                "audienceNotes", payload.audienceNotes() != null ? payload.audienceNotes() : "General audience",
                "knowledge", knowledge.asPromptBlock()));
    }

    @Override
    protected void validateOutput(OutlineDraft output) {
        if (output.lessonCount() == 0) {
            throw new TransientProviderException("AI returned an outline without lessons");
        }
    }

    @Override
    protected String persist(GenerationJob job, CourseOutlinePayload payload, RankedKnowledge knowledge,
                             OutlineDraft output) {
        return contentStore.storeOutline(job.getTenantId(), payload.courseId(), output).resultPath();
    }
}
