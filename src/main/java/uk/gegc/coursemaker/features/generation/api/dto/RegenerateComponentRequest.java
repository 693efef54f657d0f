package uk.gegc.coursemaker.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(name = "RegenerateComponentRequest", description = "Instruction for rewriting a lesson component")
public record RegenerateComponentRequest(
        @Schema(description = "What to change", example = "Make the example relevant to cold-storage sites")
        @Size(max = 2000, message = "modificationPrompt must not exceed 2000 characters")
        String modificationPrompt
) {
}
