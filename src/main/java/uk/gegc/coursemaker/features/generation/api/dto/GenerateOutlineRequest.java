package uk.gegc.coursemaker.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(name = "GenerateOutlineRequest", description = "Optional hints for outline generation")
public record GenerateOutlineRequest(
        @Schema(description = "Working title of the course", example = "Warehouse Safety Essentials")
        @Size(max = 200, message = "courseTitle must not exceed 200 characters")
        String courseTitle,

        @Schema(description = "Who the course is for", example = "New warehouse operatives, no prior training")
        @Size(max = 4000, message = "audienceNotes must not exceed 4000 characters")
        String audienceNotes
) {
}
