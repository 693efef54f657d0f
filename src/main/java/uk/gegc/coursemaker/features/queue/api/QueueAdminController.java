package uk.gegc.coursemaker.features.queue.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.coursemaker.features.queue.api.dto.QueueTaskDto;
import uk.gegc.coursemaker.features.queue.application.TaskQueue;

import java.util.UUID;

@Tag(name = "Queue Administration", description = "Inspection and replay of dead-lettered background tasks")
@RestController
@RequestMapping("/api/v1/admin/queue")
@RequiredArgsConstructor
@Slf4j
public class QueueAdminController {

    private final TaskQueue taskQueue;

    @Operation(summary = "List dead-lettered tasks")
    @GetMapping("/dead-letters")
    public ResponseEntity<Page<QueueTaskDto>> listDeadLetters(
            @ParameterObject
            @PageableDefault(page = 0, size = 20)
            @SortDefault(sort = "deadLetteredAt", direction = Sort.Direction.DESC)
            Pageable pageable
    ) {
        return ResponseEntity.ok(taskQueue.listDeadLetters(pageable).map(QueueTaskDto::fromEntity));
    }

    @Operation(
            summary = "Requeue a dead-lettered task",
            description = "Makes the task visible immediately with a fresh delivery budget.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Task requeued"),
                    @ApiResponse(responseCode = "400", description = "Task is not dead-lettered",
                            content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
                    @ApiResponse(responseCode = "404", description = "Task not found",
                            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
            }
    )
    @PostMapping("/dead-letters/{taskId}/requeue")
    public ResponseEntity<QueueTaskDto> requeue(@PathVariable UUID taskId) {
        log.info("Operator requeue requested for task {}", taskId);
        return ResponseEntity.ok(QueueTaskDto.fromEntity(taskQueue.requeueDeadLetter(taskId)));
    }
}
