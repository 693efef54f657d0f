package uk.gegc.coursemaker.features.generation.application.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.core.io.DefaultResourceLoader;
import uk.gegc.coursemaker.BaseUnitTest;
import uk.gegc.coursemaker.features.generation.application.AiCompletion;
import uk.gegc.coursemaker.features.generation.application.ContentGenerationClient;
import uk.gegc.coursemaker.features.generation.application.GeneratedContentStore;
import uk.gegc.coursemaker.features.generation.application.GeneratedOutputParser;
import uk.gegc.coursemaker.features.generation.application.KnowledgeRankingService;
import uk.gegc.coursemaker.features.generation.application.KnowledgeRankingService.RankedKnowledge;
import uk.gegc.coursemaker.features.generation.application.impl.PromptTemplateServiceImpl;
import uk.gegc.coursemaker.features.generation.application.output.OutlineDraft;
import uk.gegc.coursemaker.features.generation.domain.model.GeneratedArtifact;
import uk.gegc.coursemaker.features.job.application.GenerationJobPayloadCodec;
import uk.gegc.coursemaker.features.job.domain.exception.JobCancelledException;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.job.domain.model.payload.CourseOutlinePayload;
import uk.gegc.coursemaker.features.worker.application.JobExecutionContext;
import uk.gegc.coursemaker.features.worker.application.JobResult;
import uk.gegc.coursemaker.features.worker.application.WorkflowCheckpoint;
import uk.gegc.coursemaker.shared.exception.TransientProviderException;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("CourseOutlineHandler")
class CourseOutlineHandlerTest extends BaseUnitTest {

    private static final String OUTLINE_JSON = """
            {
              "sections": [
                {"title": "Foundations", "lessons": [
                  {"title": "Ownership", "summary": "Move semantics"},
                  {"title": "Borrowing", "summary": "References and lifetimes"}
                ]},
                {"title": "Concurrency", "lessons": [
                  {"title": "Threads", "summary": "Send and Sync"}
                ]}
              ]
            }
            """;

    @Mock
    private ContentGenerationClient generationClient;

    @Mock
    private KnowledgeRankingService knowledgeRanking;

    @Mock
    private GeneratedContentStore contentStore;

    @Mock
    private JobExecutionContext context;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final UUID tenantId = UUID.randomUUID();
    private final UUID courseId = UUID.randomUUID();

    private CourseOutlineHandler handler;
    private GenerationJob job;

    @BeforeEach
    void setUp() {
        GenerationJobPayloadCodec codec = new GenerationJobPayloadCodec(objectMapper);
        handler = new CourseOutlineHandler(codec, generationClient,
                new PromptTemplateServiceImpl(new DefaultResourceLoader()),
                new GeneratedOutputParser(objectMapper), knowledgeRanking, contentStore);

        job = new GenerationJob();
        job.setId(UUID.randomUUID());
        job.setTenantId(tenantId);
        job.setType(GenerationJobType.COURSE_OUTLINE);
        job.setPayload(codec.write(new CourseOutlinePayload(courseId, "Rust for Java developers", null)));
    }

    @Test
    @DisplayName("builds the prompt from ranked knowledge and stores the parsed outline")
    void execute_storesOutline() {
        // Given
        when(knowledgeRanking.rankedKnowledge(tenantId))
                .thenReturn(new RankedKnowledge(List.of("The borrow checker enforces aliasing rules.")));
        when(generationClient.generate(anyString(), anyString())).thenReturn(new AiCompletion(OUTLINE_JSON, 1500));
        GeneratedArtifact artifact = new GeneratedArtifact();
        artifact.setId(UUID.randomUUID());
        artifact.setTenantId(tenantId);
        when(contentStore.storeOutline(eq(tenantId), eq(courseId), any(OutlineDraft.class))).thenReturn(artifact);

        // When
        JobResult result = handler.execute(job, context);

        // Then
        assertThat(result).isEqualTo(new JobResult(artifact.resultPath(), 1500));

        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        verify(generationClient).generate(anyString(), userPrompt.capture());
        assertThat(userPrompt.getValue())
                .contains("Rust for Java developers")
                .contains("General audience")
                .contains("[1] The borrow checker enforces aliasing rules.");

        ArgumentCaptor<OutlineDraft> draft = ArgumentCaptor.forClass(OutlineDraft.class);
        verify(contentStore).storeOutline(eq(tenantId), eq(courseId), draft.capture());
        assertThat(draft.getValue().lessonCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("an outline without lessons is retried as a transient failure")
    void execute_emptyOutline_transient() {
        when(knowledgeRanking.rankedKnowledge(tenantId)).thenReturn(new RankedKnowledge(List.of()));
        when(generationClient.generate(anyString(), anyString()))
                .thenReturn(new AiCompletion("{\"sections\":[{\"title\":\"Empty\",\"lessons\":[]}]}", 40));

        assertThatThrownBy(() -> handler.execute(job, context))
                .isInstanceOf(TransientProviderException.class);
        verify(contentStore, never()).storeOutline(any(), any(), any());
    }

    @Test
    @DisplayName("cancellation at a checkpoint stops before the AI call")
    void execute_cancelledBeforeGenerate() {
        when(knowledgeRanking.rankedKnowledge(tenantId)).thenReturn(new RankedKnowledge(List.of()));
        doThrow(new JobCancelledException(job.getId())).when(context).checkpoint(WorkflowCheckpoint.GENERATE);

        assertThatThrownBy(() -> handler.execute(job, context)).isInstanceOf(JobCancelledException.class);
        verifyNoInteractions(generationClient, contentStore);
    }

    @Test
    @DisplayName("a provider failure propagates without storing anything")
    void execute_providerFailure_propagates() {
        when(knowledgeRanking.rankedKnowledge(tenantId)).thenReturn(new RankedKnowledge(List.of()));
        when(generationClient.generate(anyString(), anyString()))
                .thenThrow(new TransientProviderException("429 Too Many Requests"));

        assertThatThrownBy(() -> handler.execute(job, context)).isInstanceOf(TransientProviderException.class);
        verifyNoInteractions(contentStore);
    }
}
