package uk.gegc.coursemaker.features.queue.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.coursemaker.features.queue.application.EnqueueOptions;
import uk.gegc.coursemaker.features.queue.application.TaskQueue;
import uk.gegc.coursemaker.features.queue.config.QueueProperties;
import uk.gegc.coursemaker.features.queue.domain.model.QueueName;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTask;
import uk.gegc.coursemaker.features.queue.domain.repository.QueueTaskRepository;
import uk.gegc.coursemaker.shared.exception.ResourceNotFoundException;
import uk.gegc.coursemaker.shared.exception.ValidationException;
import uk.gegc.coursemaker.shared.util.ExponentialBackoff;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import static uk.gegc.coursemaker.features.queue.domain.model.QueueTaskStatus.DEAD_LETTER;
import static uk.gegc.coursemaker.features.queue.domain.model.QueueTaskStatus.IN_FLIGHT;
import static uk.gegc.coursemaker.features.queue.domain.model.QueueTaskStatus.PENDING;

/**
 * {@link TaskQueue} on the {@code queue_tasks} table. Leases are taken with conditional
 * updates, so any number of consumers in any number of processes can share the table.
 */
@Slf4j
@Service
@Transactional
public class JpaTaskQueue implements TaskQueue {

    static final int MAX_ERROR_LENGTH = 2000;

    private final QueueTaskRepository taskRepository;
    private final QueueProperties properties;
    private final Clock clock;
    private final ExponentialBackoff backoff;
    private final Counter deadLetteredCounter;

    public JpaTaskQueue(QueueTaskRepository taskRepository,
                        QueueProperties properties,
                        MeterRegistry meterRegistry,
                        Clock clock) {
        this.taskRepository = taskRepository;
        this.properties = properties;
        this.clock = clock;
        QueueProperties.Backoff cfg = properties.getBackoff();
        this.backoff = new ExponentialBackoff(
                Duration.ofSeconds(cfg.getBaseSeconds()),
                Duration.ofSeconds(cfg.getMaxSeconds()),
                cfg.getJitterFactor());
        this.deadLetteredCounter = Counter.builder("queue.tasks.dead_lettered")
                .description("Tasks moved to the dead-letter state")
                .register(meterRegistry);
    }

    @Override
    public UUID enqueue(String taskType, String subjectId, EnqueueOptions options) {
        if (taskType == null || taskType.isBlank()) {
            throw new ValidationException("Task type is required");
        }
        if (subjectId == null || subjectId.isBlank()) {
            throw new ValidationException("Task subject is required");
        }
        EnqueueOptions opts = options != null ? options : EnqueueOptions.defaults();
        QueueName queue = opts.queue() != null ? opts.queue() : QueueName.DEFAULT;
        Duration delay = opts.delay() != null && !opts.delay().isNegative() ? opts.delay() : Duration.ZERO;
        LocalDateTime now = now();

        QueueTask task = new QueueTask();
        task.setTaskType(taskType);
        task.setSubjectId(subjectId);
        task.setQueueName(queue);
        task.setPriority(queue.getPriority());
        task.setStatus(PENDING);
        task.setMaxRetries(opts.maxRetries() != null ? opts.maxRetries() : properties.getDefaultMaxRetries());
        task.setAvailableAt(now.plus(delay));
        task.setCreatedAt(now);

        QueueTask saved = taskRepository.save(task);
        log.debug("Enqueued task {} ({}) for subject {} on {} queue, available at {}",
                saved.getId(), taskType, subjectId, queue, saved.getAvailableAt());
        return saved.getId();
    }

    @Override
    public Optional<QueueTask> dequeue(Collection<String> taskTypes, Duration visibilityTimeout, String consumerId) {
        if (taskTypes == null || taskTypes.isEmpty()) {
            return Optional.empty();
        }
        LocalDateTime now = now();
        List<QueueTask> visible = taskRepository.findVisible(taskTypes, PENDING, IN_FLIGHT, now,
                PageRequest.of(0, properties.getDequeueBatchSize()));

        for (QueueTask candidate : visible) {
            if (candidate.getStatus() == IN_FLIGHT && candidate.isFinalDelivery()) {
                String error = "Lease expired on final delivery (held by " + candidate.getLockedBy() + ")";
                if (taskRepository.deadLetterExpired(candidate.getId(), IN_FLIGHT, DEAD_LETTER, error, now) == 1) {
                    deadLetteredCounter.increment();
                    log.error("Task {} ({}) dead-lettered after {} deliveries: {}",
                            candidate.getId(), candidate.getTaskType(), candidate.getDeliveries(), error);
                }
                continue;
            }

            int claimed = taskRepository.claim(candidate.getId(), candidate.getDeliveries(), PENDING, IN_FLIGHT,
                    now, now.plus(visibilityTimeout), consumerId);
            if (claimed == 1) {
                QueueTask task = taskRepository.findById(candidate.getId()).orElseThrow();
                if (candidate.getStatus() == IN_FLIGHT) {
                    log.warn("Redelivering task {} ({}) after lease held by {} expired",
                            task.getId(), task.getTaskType(), candidate.getLockedBy());
                }
                log.debug("Consumer {} leased task {} ({}), delivery {}",
                        consumerId, task.getId(), task.getTaskType(), task.getDeliveries());
                return Optional.of(task);
            }
        }
        return Optional.empty();
    }

    @Override
    public void ack(QueueTask lease) {
        UUID taskId = lease.getId();
        if (taskRepository.deleteLeased(taskId, lease.getLockedBy(), lease.getDeliveries(), IN_FLIGHT) == 0) {
            log.warn("Ack for task {} by {} on delivery {} ignored; lease no longer held",
                    taskId, lease.getLockedBy(), lease.getDeliveries());
        }
    }

    @Override
    public void nack(QueueTask lease, String error) {
        UUID taskId = lease.getId();
        Optional<QueueTask> found = taskRepository.findById(taskId);
        if (found.isEmpty()) {
            log.warn("Nack for unknown task {}; ignoring", taskId);
            return;
        }
        QueueTask task = found.get();
        if (!holdsLease(task, lease)) {
            log.warn("Nack for task {} by {} on delivery {} ignored; task is {} held by {} on delivery {}",
                    taskId, lease.getLockedBy(), lease.getDeliveries(),
                    task.getStatus(), task.getLockedBy(), task.getDeliveries());
            return;
        }

        String truncated = truncate(error);
        LocalDateTime now = now();
        if (!task.isFinalDelivery()) {
            LocalDateTime availableAt = now.plus(backoff.delayFor(task.getDeliveries()));
            if (taskRepository.release(taskId, lease.getLockedBy(), lease.getDeliveries(),
                    IN_FLIGHT, PENDING, availableAt, truncated) == 1) {
                log.warn("Task {} ({}) nacked on delivery {}/{}; redelivery at {}: {}",
                        taskId, task.getTaskType(), task.getDeliveries(), task.getMaxRetries() + 1,
                        availableAt, truncated);
            }
            return;
        }

        if (taskRepository.deadLetter(taskId, lease.getLockedBy(), lease.getDeliveries(),
                IN_FLIGHT, DEAD_LETTER, truncated, now) == 1) {
            deadLetteredCounter.increment();
            log.error("Task {} ({}) dead-lettered after {} deliveries: {}",
                    taskId, task.getTaskType(), task.getDeliveries(), truncated);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Page<QueueTask> listDeadLetters(Pageable pageable) {
        return taskRepository.findByStatus(DEAD_LETTER, pageable);
    }

    @Override
    public QueueTask requeueDeadLetter(UUID taskId) {
        QueueTask task = taskRepository.findById(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Queue task not found with ID: " + taskId));
        if (task.getStatus() != DEAD_LETTER) {
            throw new ValidationException("Only dead-lettered tasks can be requeued; task " + taskId
                    + " is " + task.getStatus());
        }
        taskRepository.requeueDeadLetter(taskId, DEAD_LETTER, PENDING, now());
        log.info("Dead-lettered task {} ({}) requeued by operator", taskId, task.getTaskType());
        return taskRepository.findById(taskId).orElseThrow();
    }

    private static boolean holdsLease(QueueTask current, QueueTask lease) {
        return current.getStatus() == IN_FLIGHT
                && Objects.equals(current.getLockedBy(), lease.getLockedBy())
                && current.getDeliveries() == lease.getDeliveries();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String truncate(String message) {
        if (message == null) {
            return "Unknown error";
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
