package uk.gegc.coursemaker.features.batch.domain;

/**
 * Children of a batch parent counted by status.
 */
public record BatchTally(long total, long completed, long failed, long cancelled, long tokensUsed) {

    public long done() {
        return completed + failed + cancelled;
    }

    public long unsuccessful() {
        return failed + cancelled;
    }

    public boolean isSettled() {
        return total > 0 && done() >= total;
    }

    /**
     * Parent progress: 10% for creating the batch, the rest spread over the children.
     */
    public int progressPercent() {
        if (total == 0) {
            return 10;
        }
        return (int) (10 + 90 * done() / total);
    }

    public String progressMessage() {
        return "Generated " + done() + " of " + total + " lessons...";
    }
}
