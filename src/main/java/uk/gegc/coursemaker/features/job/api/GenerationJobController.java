package uk.gegc.coursemaker.features.job.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.data.web.SortDefault;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.coursemaker.features.job.api.dto.GenerationJobDto;
import uk.gegc.coursemaker.features.job.application.GenerationJobService;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;

import java.util.UUID;

@Tag(name = "Generation Jobs", description = "Status, listing and cancellation of asynchronous generation jobs")
@RestController
@RequestMapping("/api/v1/generation/jobs")
@RequiredArgsConstructor
public class GenerationJobController {

    public static final String TENANT_HEADER = "X-Tenant-Id";

    private final GenerationJobService jobService;

    @Operation(
            summary = "Get generation job",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Job found",
                            content = @Content(schema = @Schema(implementation = GenerationJobDto.class))),
                    @ApiResponse(responseCode = "404", description = "Job not found in this tenant",
                            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
            }
    )
    @GetMapping("/{jobId}")
    public ResponseEntity<GenerationJobDto> getJob(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @Parameter(description = "UUID of the generation job", required = true) @PathVariable UUID jobId
    ) {
        return ResponseEntity.ok(GenerationJobDto.fromEntity(jobService.getJob(tenantId, jobId)));
    }

    @Operation(
            summary = "List generation jobs",
            description = "Tenant-scoped job list, newest first, optionally filtered by type, status and course."
    )
    @GetMapping
    public ResponseEntity<Page<GenerationJobDto>> listJobs(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestParam(required = false) GenerationJobType type,
            @RequestParam(required = false) GenerationJobStatus status,
            @RequestParam(required = false) UUID courseId,
            @ParameterObject
            @PageableDefault(page = 0, size = 20)
            @SortDefault(sort = "createdAt", direction = Sort.Direction.DESC)
            Pageable pageable
    ) {
        Page<GenerationJobDto> jobs = jobService
                .listJobs(tenantId, new GenerationJobService.JobFilter(type, status, courseId), pageable)
                .map(GenerationJobDto::fromEntity);
        return ResponseEntity.ok(jobs);
    }

    @Operation(
            summary = "Cancel generation job",
            description = "Cancels a QUEUED or PROCESSING job. A running job stops at its next checkpoint. "
                    + "Cancelling a finished job returns it unchanged. Cancelling a batch parent cancels its active children."
    )
    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<GenerationJobDto> cancelJob(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable UUID jobId
    ) {
        return ResponseEntity.ok(GenerationJobDto.fromEntity(jobService.cancel(tenantId, jobId)));
    }
}
