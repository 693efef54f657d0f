package uk.gegc.coursemaker.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(name = "StartSmeIngestionRequest", description = "Extract knowledge from an SME submission")
public record StartSmeIngestionRequest(
        @Schema(description = "SME task the submission answers", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "smeTaskId must not be null")
        UUID smeTaskId,

        @Schema(description = "Uploaded submission to ingest", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "submissionId must not be null")
        UUID submissionId
) {
}
