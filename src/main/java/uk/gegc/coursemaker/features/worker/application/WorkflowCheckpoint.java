package uk.gegc.coursemaker.features.worker.application;

/**
 * Named stages of a generation workflow, in execution order. Each carries the progress
 * reported when the stage begins.
 */
public enum WorkflowCheckpoint {

    VALIDATE_INPUTS(5, "Validating inputs..."),
    GATHER_CONTEXT(20, "Gathering context..."),
    GENERATE(40, "Generating content with AI..."),
    PARSE_OUTPUT(70, "Validating generated output..."),
    PERSIST_RESULTS(85, "Storing results...");

    private final int percent;
    private final String message;

    WorkflowCheckpoint(int percent, String message) {
        this.percent = percent;
        this.message = message;
    }

    public int getPercent() {
        return percent;
    }

    public String getMessage() {
        return message;
    }
}
