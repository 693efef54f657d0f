package uk.gegc.coursemaker.features.job.domain.model;

import java.util.Locale;

/**
 * Kind of work a generation job performs.
 */
public enum GenerationJobType {

    SME_INGESTION,
    COURSE_OUTLINE,
    LESSON_CONTENT,
    COMPONENT_REGEN,

    /**
     * Coordinating parent of a lesson fan-out. Does no work of its own.
     */
    FULL_COURSE;

    private static final String TASK_TYPE_PREFIX = "generation:";

    /**
     * Queue task type that delivers jobs of this type, e.g. {@code generation:lesson_content}.
     */
    public String taskType() {
        return TASK_TYPE_PREFIX + name().toLowerCase(Locale.ROOT);
    }

    public boolean isBatchParent() {
        return this == FULL_COURSE;
    }

    public static boolean isGenerationTaskType(String taskType) {
        return taskType != null && taskType.startsWith(TASK_TYPE_PREFIX);
    }

    public static GenerationJobType fromTaskType(String taskType) {
        if (!isGenerationTaskType(taskType)) {
            throw new IllegalArgumentException("Not a generation task type: " + taskType);
        }
        return valueOf(taskType.substring(TASK_TYPE_PREFIX.length()).toUpperCase(Locale.ROOT));
    }
}
