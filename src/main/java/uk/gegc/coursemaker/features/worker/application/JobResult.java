package uk.gegc.coursemaker.features.worker.application;

/**
 * Outcome of a successful handler run.
 *
 * @param resultPath location of the stored result
 * @param tokensUsed AI tokens consumed by the run
 */
public record JobResult(String resultPath, long tokensUsed) {
}
