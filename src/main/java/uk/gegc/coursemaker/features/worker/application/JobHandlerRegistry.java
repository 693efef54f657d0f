package uk.gegc.coursemaker.features.worker.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit type-to-handler maps built once at startup from the handler beans.
 * Two handlers claiming the same type fail the context on startup.
 */
@Slf4j
@Component
public class JobHandlerRegistry {

    private final Map<GenerationJobType, GenerationJobHandler> jobHandlers;
    private final Map<String, QueueTaskHandler> taskHandlers;

    public JobHandlerRegistry(List<GenerationJobHandler> jobHandlers, List<QueueTaskHandler> taskHandlers) {
        this.jobHandlers = buildJobRegistry(jobHandlers);
        this.taskHandlers = buildTaskRegistry(taskHandlers);
        log.info("Initialized handler registry with {} job handler(s) {} and {} task handler(s) {}",
                this.jobHandlers.size(), this.jobHandlers.keySet(), this.taskHandlers.size(), this.taskHandlers.keySet());
    }

    public Optional<GenerationJobHandler> handlerFor(GenerationJobType type) {
        return Optional.ofNullable(jobHandlers.get(type));
    }

    public Optional<QueueTaskHandler> taskHandlerFor(String taskType) {
        return Optional.ofNullable(taskHandlers.get(taskType));
    }

    /**
     * Job types this process can execute.
     */
    public Set<GenerationJobType> capabilities() {
        return jobHandlers.isEmpty() ? EnumSet.noneOf(GenerationJobType.class) : EnumSet.copyOf(jobHandlers.keySet());
    }

    /**
     * Every queue task type a worker here should dequeue.
     */
    public List<String> taskTypes() {
        List<String> types = new ArrayList<>();
        jobHandlers.keySet().forEach(type -> types.add(type.taskType()));
        types.addAll(taskHandlers.keySet());
        return Collections.unmodifiableList(types);
    }

    private static Map<GenerationJobType, GenerationJobHandler> buildJobRegistry(List<GenerationJobHandler> handlers) {
        Map<GenerationJobType, GenerationJobHandler> registry = new EnumMap<>(GenerationJobType.class);
        for (GenerationJobHandler handler : handlers) {
            GenerationJobType type = handler.handlesType();
            if (type.isBatchParent()) {
                throw new IllegalStateException("Batch parents have no handler: " + handler.getClass().getName());
            }
            GenerationJobHandler existing = registry.putIfAbsent(type, handler);
            if (existing != null) {
                throw new IllegalStateException("Duplicate handlers registered for " + type + ": "
                        + existing.getClass().getName() + " and " + handler.getClass().getName());
            }
        }
        return registry;
    }

    private static Map<String, QueueTaskHandler> buildTaskRegistry(List<QueueTaskHandler> handlers) {
        Map<String, QueueTaskHandler> registry = new HashMap<>();
        for (QueueTaskHandler handler : handlers) {
            String taskType = handler.handlesTaskType();
            if (GenerationJobType.isGenerationTaskType(taskType)) {
                throw new IllegalStateException("Task type " + taskType + " is reserved for generation jobs");
            }
            QueueTaskHandler existing = registry.putIfAbsent(taskType, handler);
            if (existing != null) {
                throw new IllegalStateException("Duplicate handlers registered for task type " + taskType + ": "
                        + existing.getClass().getName() + " and " + handler.getClass().getName());
            }
        }
        return registry;
    }
}
