package uk.gegc.coursemaker.features.generation.application.handler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.generation.application.ContentGenerationClient;
import uk.gegc.coursemaker.features.generation.application.GeneratedContentStore;
import uk.gegc.coursemaker.features.generation.application.GeneratedOutputParser;
import uk.gegc.coursemaker.features.generation.application.KnowledgeRankingService;
import uk.gegc.coursemaker.features.generation.application.PromptTemplateService;
import uk.gegc.coursemaker.features.generation.application.SubmissionContentReader;
import uk.gegc.coursemaker.features.generation.application.SubmissionContentReader.SubmissionContent;
import uk.gegc.coursemaker.features.generation.application.output.KnowledgeExtraction;
import uk.gegc.coursemaker.features.generation.config.GenerationProperties;
import uk.gegc.coursemaker.features.generation.domain.model.GeneratedArtifact;
import uk.gegc.coursemaker.features.job.application.GenerationJobPayloadCodec;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.job.domain.model.payload.SmeIngestionPayload;
import uk.gegc.coursemaker.shared.exception.TransientProviderException;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.util.Map;

/**
 * Turns an SME submission into ranked knowledge chunks and a summary.
 */
@Slf4j
@Component
public class SmeIngestionHandler extends CheckpointedJobHandler<SmeIngestionPayload, SubmissionContent, KnowledgeExtraction> {

    private final SubmissionContentReader submissionReader;
    private final GeneratedContentStore contentStore;
    private final KnowledgeRankingService knowledgeRanking;
    private final GenerationProperties properties;

    public SmeIngestionHandler(GenerationJobPayloadCodec payloadCodec,
                               ContentGenerationClient generationClient,
                               PromptTemplateService promptTemplates,
                               GeneratedOutputParser outputParser,
                               SubmissionContentReader submissionReader,
                               GeneratedContentStore contentStore,
                               KnowledgeRankingService knowledgeRanking,
                               GenerationProperties properties) {
        super(payloadCodec, generationClient, promptTemplates, outputParser);
        this.submissionReader = submissionReader;
        this.contentStore = contentStore;
        this.knowledgeRanking = knowledgeRanking;
        this.properties = properties;
    }

    @Override
    public GenerationJobType handlesType() {
        return GenerationJobType.SME_INGESTION;
    }

    @Override
    protected Class<SmeIngestionPayload> payloadType() {
        return SmeIngestionPayload.class;
    }

    @Override
    protected Class<KnowledgeExtraction> outputType() {
        return KnowledgeExtraction.class;
    }

    @Override
    protected SubmissionContent gatherContext(GenerationJob job, SmeIngestionPayload payload) {
        SubmissionContent submission = submissionReader.read(job.getTenantId(), payload.submissionId());
        if (!payload.smeTaskId().equals(submission.smeTaskId())) {
            throw new ValidationException("Submission " + payload.submissionId()
                    + " does not belong to SME task " + payload.smeTaskId());
        }
        if (submission.text() == null || submission.text().isBlank()) {
            throw new ValidationException("Submission " + payload.submissionId() + " has no extractable text");
        }
        return submission;
    }

    @Override
    protected String buildUserPrompt(SmeIngestionPayload payload, SubmissionContent submission) {
        String text = submission.text();
        if (text.length() > properties.getMaxSubmissionChars()) {
            log.warn("Submission {} truncated from {} to {} characters",
                    submission.submissionId(), text.length(), properties.getMaxSubmissionChars());
            text = text.substring(0, properties.getMaxSubmissionChars());
        }
        return promptTemplates().render("sme-ingestion.txt", Map.of(
                "fileName", submission.fileName() != null ? submission.fileName() : "submission",
                "content", text));
    }

    @Override
    protected void validateOutput(KnowledgeExtraction output) {
        if (output.chunks() == null || output.chunks().isEmpty()) {
            throw new TransientProviderException("AI extracted no knowledge chunks");
        }
        if (output.summary() == null || output.summary().isBlank()) {
            throw new TransientProviderException("AI returned no knowledge summary");
        }
    }

    @Override
    protected String persist(GenerationJob job, SmeIngestionPayload payload, SubmissionContent submission,
                             KnowledgeExtraction output) {
        GeneratedArtifact summary = contentStore.storeKnowledge(
                job.getTenantId(), payload.smeTaskId(), payload.submissionId(), output);
        knowledgeRanking.invalidate(job.getTenantId());
        return summary.resultPath();
    }
}
