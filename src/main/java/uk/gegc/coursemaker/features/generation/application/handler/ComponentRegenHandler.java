package uk.gegc.coursemaker.features.generation.application.handler;

import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.generation.application.ContentGenerationClient;
import uk.gegc.coursemaker.features.generation.application.GeneratedContentStore;
import uk.gegc.coursemaker.features.generation.application.GeneratedOutputParser;
import uk.gegc.coursemaker.features.generation.application.PromptTemplateService;
import uk.gegc.coursemaker.features.generation.application.output.ContentDraft;
import uk.gegc.coursemaker.features.generation.domain.model.ArtifactKind;
import uk.gegc.coursemaker.features.generation.domain.model.GeneratedArtifact;
import uk.gegc.coursemaker.features.generation.domain.repository.GeneratedArtifactRepository;
import uk.gegc.coursemaker.features.job.application.GenerationJobPayloadCodec;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.job.domain.model.payload.ComponentRegenPayload;
import uk.gegc.coursemaker.shared.exception.ResourceNotFoundException;
import uk.gegc.coursemaker.shared.exception.TransientProviderException;

import java.util.Map;

/**
 * Rewrites one component of an already generated lesson, guided by the user's instruction.
 */
@Component
public class ComponentRegenHandler
        extends CheckpointedJobHandler<ComponentRegenPayload, GeneratedArtifact, ContentDraft> {

    static final String DEFAULT_INSTRUCTION = "Improve clarity and accuracy while keeping the same scope.";

    private final GeneratedArtifactRepository artifactRepository;
    private final GeneratedContentStore contentStore;

    public ComponentRegenHandler(GenerationJobPayloadCodec payloadCodec,
                                 ContentGenerationClient generationClient,
                                 PromptTemplateService promptTemplates,
                                 GeneratedOutputParser outputParser,
                                 GeneratedArtifactRepository artifactRepository,
                                 GeneratedContentStore contentStore) {
        super(payloadCodec, generationClient, promptTemplates, outputParser);
        this.artifactRepository = artifactRepository;
        this.contentStore = contentStore;
    }

    @Override
    public GenerationJobType handlesType() {
        return GenerationJobType.COMPONENT_REGEN;
    }

    @Override
    protected Class<ComponentRegenPayload> payloadType() {
        return ComponentRegenPayload.class;
    }

    @Override
    protected Class<ContentDraft> outputType() {
        return ContentDraft.class;
    }

    @Override
    protected GeneratedArtifact gatherContext(GenerationJob job, ComponentRegenPayload payload) {
        return artifactRepository
                .findFirstByTenantIdAndLessonIdAndKindOrderByCreatedAtDesc(job.getTenantId(), payload.lessonId(), ArtifactKind.LESSON)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No generated content found for lesson " + payload.lessonId() + "; generate the lesson first"));
    }

    @Override
    protected String buildUserPrompt(ComponentRegenPayload payload, GeneratedArtifact lessonArtifact) {
        String instruction = payload.modificationPrompt() != null && !payload.modificationPrompt().isBlank()
                ? payload.modificationPrompt()
                : DEFAULT_INSTRUCTION;
        return promptTemplates().render("component-regen.txt", Map.of(
                "componentId", payload.componentId().toString(),
                "lessonContent", lessonArtifact.getContent(),
                "instruction", instruction));
    }

    @Override
    protected void validateOutput(ContentDraft output) {
        if (output.content() == null || output.content().isBlank()) {
            throw new TransientProviderException("AI returned an empty component");
        }
    }

    @Override
    protected String persist(GenerationJob job, ComponentRegenPayload payload, GeneratedArtifact lessonArtifact,
                             ContentDraft output) {
        return contentStore.storeComponent(job.getTenantId(), payload.courseId(), payload.lessonId(),
                payload.componentId(), output).resultPath();
    }
}
