package uk.gegc.coursemaker.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

@Schema(name = "GenerateAllLessonsRequest", description = "Lessons to generate after outline approval")
public record GenerateAllLessonsRequest(
        @Schema(description = "Subset of outline lessons; omit to generate the whole outline")
        @Size(max = 200, message = "At most 200 lessons can be generated in one batch")
        List<UUID> lessonIds
) {
}
