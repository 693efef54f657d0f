package uk.gegc.coursemaker.features.job.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "GenerationJob", description = "Asynchronous content generation job")
public record GenerationJobDto(
        @Schema(description = "Unique job identifier", example = "d290f1ee-6c54-4b01-90e6-d701748f0851")
        UUID id,

        @Schema(description = "Owning tenant")
        UUID tenantId,

        @Schema(description = "Kind of work", example = "LESSON_CONTENT")
        GenerationJobType type,

        @Schema(description = "Lifecycle status", example = "PROCESSING")
        GenerationJobStatus status,

        @Schema(description = "Progress percentage (0-100)", example = "40")
        int progressPercent,

        @Schema(description = "Human-readable progress message", example = "Generating content with AI...")
        String progressMessage,

        @Schema(description = "Location of the generated result (only when completed)")
        String resultPath,

        @Schema(description = "Error message if the last attempt failed", example = "AI provider timed out")
        String errorMessage,

        @Schema(description = "Tokens consumed by the AI provider", example = "1830")
        long tokensUsed,

        @Schema(description = "Retries consumed so far", example = "1")
        int retryCount,

        @Schema(description = "Retry budget", example = "3")
        int maxRetries,

        @Schema(description = "Parent batch job, if this job is part of a fan-out")
        UUID parentJobId,

        UUID courseId,
        UUID lessonId,
        UUID smeTaskId,
        UUID submissionId,

        @Schema(description = "User who requested the job")
        UUID createdByUserId,

        LocalDateTime createdAt,
        LocalDateTime startedAt,
        LocalDateTime completedAt
) {

    public static GenerationJobDto fromEntity(GenerationJob job) {
        return new GenerationJobDto(
                job.getId(),
                job.getTenantId(),
                job.getType(),
                job.getStatus(),
                job.getProgressPercent(),
                job.getProgressMessage(),
                job.getResultPath(),
                job.getErrorMessage(),
                job.getTokensUsed(),
                job.getRetryCount(),
                job.getMaxRetries(),
                job.getParentJobId(),
                job.getCourseId(),
                job.getLessonId(),
                job.getSmeTaskId(),
                job.getSubmissionId(),
                job.getCreatedByUserId(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt()
        );
    }
}
