package uk.gegc.coursemaker.features.generation.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.coursemaker.features.generation.api.dto.GenerateAllLessonsRequest;
import uk.gegc.coursemaker.features.generation.api.dto.GenerateOutlineRequest;
import uk.gegc.coursemaker.features.generation.api.dto.RegenerateComponentRequest;
import uk.gegc.coursemaker.features.generation.api.dto.StartSmeIngestionRequest;
import uk.gegc.coursemaker.features.generation.application.GenerationOrchestrator;
import uk.gegc.coursemaker.features.job.api.dto.GenerationJobDto;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;

import java.util.UUID;

import static uk.gegc.coursemaker.features.job.api.GenerationJobController.TENANT_HEADER;

@Tag(name = "Content Generation", description = "Start asynchronous AI generation jobs")
@RestController
@RequestMapping("/api/v1/generation")
@RequiredArgsConstructor
public class GenerationController {

    public static final String USER_HEADER = "X-User-Id";

    private final GenerationOrchestrator orchestrator;

    @Operation(
            summary = "Ingest an SME submission",
            description = "Queues extraction of knowledge chunks from an uploaded SME document.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Job accepted",
                            content = @Content(schema = @Schema(implementation = GenerationJobDto.class))),
                    @ApiResponse(responseCode = "400", description = "Missing submission references",
                            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
            }
    )
    @PostMapping("/sme-ingestion")
    public ResponseEntity<GenerationJobDto> startSmeIngestion(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestBody @Valid StartSmeIngestionRequest request
    ) {
        return accepted(orchestrator.startSmeIngestion(tenantId, userId, request.smeTaskId(), request.submissionId()));
    }

    @Operation(summary = "Generate course outline", description = "Queues an outline draft built from the tenant's ranked knowledge.")
    @PostMapping("/courses/{courseId}/outline")
    public ResponseEntity<GenerationJobDto> generateOutline(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID courseId,
            @RequestBody(required = false) @Valid GenerateOutlineRequest request
    ) {
        String title = request != null ? request.courseTitle() : null;
        String audience = request != null ? request.audienceNotes() : null;
        return accepted(orchestrator.generateOutline(tenantId, userId, courseId, title, audience));
    }

    @Operation(summary = "Generate one lesson")
    @PostMapping("/courses/{courseId}/lessons/{lessonId}")
    public ResponseEntity<GenerationJobDto> generateLesson(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID courseId,
            @PathVariable UUID lessonId
    ) {
        return accepted(orchestrator.generateLesson(tenantId, userId, courseId, lessonId));
    }

    @Operation(summary = "Regenerate a lesson component", description = "Rewrites one component of an existing lesson.")
    @PostMapping("/courses/{courseId}/lessons/{lessonId}/components/{componentId}/regenerate")
    public ResponseEntity<GenerationJobDto> regenerateComponent(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID courseId,
            @PathVariable UUID lessonId,
            @PathVariable UUID componentId,
            @RequestBody(required = false) @Valid RegenerateComponentRequest request
    ) {
        String prompt = request != null ? request.modificationPrompt() : null;
        return accepted(orchestrator.regenerateComponent(tenantId, userId, courseId, lessonId, componentId, prompt));
    }

    @Operation(
            summary = "Generate all lessons of an approved outline",
            description = "Creates a FULL_COURSE parent job with one lesson job per outline lesson. "
                    + "Poll the parent for aggregate progress."
    )
    @PostMapping("/courses/{courseId}/lessons:generate-all")
    public ResponseEntity<GenerationJobDto> generateAllLessons(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID courseId,
            @RequestBody(required = false) @Valid GenerateAllLessonsRequest request
    ) {
        return accepted(orchestrator.generateAllLessons(tenantId, userId, courseId,
                request != null ? request.lessonIds() : null));
    }

    private static ResponseEntity<GenerationJobDto> accepted(GenerationJob job) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(GenerationJobDto.fromEntity(job));
    }
}
