package uk.gegc.coursemaker.features.queue.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.coursemaker.features.queue.domain.model.QueueName;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTask;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTaskStatus;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "QueueTask", description = "Background task as stored in the queue")
public record QueueTaskDto(
        UUID id,
        @Schema(description = "Task type", example = "billing:provision")
        String taskType,
        @Schema(description = "Subject the task acts on (job id, checkout session id)")
        String subjectId,
        QueueName queue,
        QueueTaskStatus status,
        @Schema(description = "Deliveries made so far", example = "11")
        int deliveries,
        int maxRetries,
        String lastError,
        LocalDateTime createdAt,
        LocalDateTime deadLetteredAt
) {

    public static QueueTaskDto fromEntity(QueueTask task) {
        return new QueueTaskDto(
                task.getId(),
                task.getTaskType(),
                task.getSubjectId(),
                task.getQueueName(),
                task.getStatus(),
                task.getDeliveries(),
                task.getMaxRetries(),
                task.getLastError(),
                task.getCreatedAt(),
                task.getDeadLetteredAt()
        );
    }
}
