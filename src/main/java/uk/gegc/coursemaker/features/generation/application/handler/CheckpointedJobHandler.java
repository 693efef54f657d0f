package uk.gegc.coursemaker.features.generation.application.handler;

import uk.gegc.coursemaker.features.generation.application.AiCompletion;
import uk.gegc.coursemaker.features.generation.application.ContentGenerationClient;
import uk.gegc.coursemaker.features.generation.application.GeneratedOutputParser;
import uk.gegc.coursemaker.features.generation.application.PromptTemplateService;
import uk.gegc.coursemaker.features.job.application.GenerationJobPayloadCodec;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.payload.GenerationJobPayload;
import uk.gegc.coursemaker.features.worker.application.GenerationJobHandler;
import uk.gegc.coursemaker.features.worker.application.JobExecutionContext;
import uk.gegc.coursemaker.features.worker.application.JobResult;

import static uk.gegc.coursemaker.features.worker.application.WorkflowCheckpoint.GATHER_CONTEXT;
import static uk.gegc.coursemaker.features.worker.application.WorkflowCheckpoint.GENERATE;
import static uk.gegc.coursemaker.features.worker.application.WorkflowCheckpoint.PARSE_OUTPUT;
import static uk.gegc.coursemaker.features.worker.application.WorkflowCheckpoint.PERSIST_RESULTS;
import static uk.gegc.coursemaker.features.worker.application.WorkflowCheckpoint.VALIDATE_INPUTS;

/**
 * Generation workflow as a fixed sequence of checkpoints:
 * <pre>
 * VALIDATE_INPUTS -> GATHER_CONTEXT -> GENERATE -> PARSE_OUTPUT -> PERSIST_RESULTS
 * </pre>
 * Progress is written and cancellation observed only at checkpoint boundaries, never in the
 * middle of a stage.
 *
 * @param <P> job payload
 * @param <C> context gathered before the AI call
 * @param <O> parsed AI output
 */
public abstract class CheckpointedJobHandler<P extends GenerationJobPayload, C, O> implements GenerationJobHandler {

    private final GenerationJobPayloadCodec payloadCodec;
    private final ContentGenerationClient generationClient;
    private final PromptTemplateService promptTemplates;
    private final GeneratedOutputParser outputParser;

    protected CheckpointedJobHandler(GenerationJobPayloadCodec payloadCodec,
                                     ContentGenerationClient generationClient,
                                     PromptTemplateService promptTemplates,
                                     GeneratedOutputParser outputParser) {
        this.payloadCodec = payloadCodec;
        this.generationClient = generationClient;
        this.promptTemplates = promptTemplates;
        this.outputParser = outputParser;
    }

    @Override
    public final JobResult execute(GenerationJob job, JobExecutionContext context) {
        context.checkpoint(VALIDATE_INPUTS);
        P payload = payloadCodec.read(job, payloadType());
        payload.validate();

        context.checkpoint(GATHER_CONTEXT);
        C gathered = gatherContext(job, payload);

        context.checkpoint(GENERATE);
        AiCompletion completion = generationClient.generate(
                promptTemplates.buildSystemPrompt(),
                buildUserPrompt(payload, gathered));

        context.checkpoint(PARSE_OUTPUT);
        O output = outputParser.parse(completion.text(), outputType());
        validateOutput(output);

        context.checkpoint(PERSIST_RESULTS);
        String resultPath = persist(job, payload, gathered, output);
        return new JobResult(resultPath, completion.tokensUsed());
    }

    protected PromptTemplateService promptTemplates() {
        return promptTemplates;
    }

    protected abstract Class<P> payloadType();

    protected abstract Class<O> outputType();

    /**
     * Load everything the prompt needs. Missing inputs should throw
     * {@code ResourceNotFoundException} or {@code ValidationException} so the job fails without retrying.
     */
    protected abstract C gatherContext(GenerationJob job, P payload);

    protected abstract String buildUserPrompt(P payload, C gathered);

    /**
     * Reject structurally valid but unusable output, typically with {@code TransientProviderException}.
     */
    protected abstract void validateOutput(O output);

    /**
     * Store the result and return its location.
     */
    protected abstract String persist(GenerationJob job, P payload, C gathered, O output);
}
