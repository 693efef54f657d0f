package uk.gegc.coursemaker.features.batch.domain;

import java.util.Optional;

/**
 * How a batch parent derives its outcome from its children.
 */
public enum ParentAggregationPolicy {

    /**
     * The first failed child fails the parent; remaining siblings are cancelled.
     */
    FAIL_FAST {
        @Override
        public Optional<BatchOutcome> decide(BatchTally tally) {
            if (tally.failed() > 0) {
                return Optional.of(BatchOutcome.failed(tally.failed() + " lesson(s) failed to generate"));
            }
            return WAIT_ALL.decide(tally);
        }
    },

    /**
     * Waits for every child. Any unsuccessful child fails the parent.
     */
    WAIT_ALL {
        @Override
        public Optional<BatchOutcome> decide(BatchTally tally) {
            if (!tally.isSettled()) {
                return Optional.empty();
            }
            if (tally.unsuccessful() == 0) {
                return Optional.of(BatchOutcome.completed("Generated " + tally.total() + " lessons"));
            }
            return Optional.of(BatchOutcome.failed(describeUnsuccessful(tally)));
        }
    },

    /**
     * Waits for every child. Completes with partial results if anything succeeded.
     */
    BEST_EFFORT {
        @Override
        public Optional<BatchOutcome> decide(BatchTally tally) {
            if (!tally.isSettled()) {
                return Optional.empty();
            }
            if (tally.completed() == 0) {
                return Optional.of(BatchOutcome.failed(describeUnsuccessful(tally)));
            }
            if (tally.unsuccessful() == 0) {
                return Optional.of(BatchOutcome.completed("Generated " + tally.total() + " lessons"));
            }
            return Optional.of(BatchOutcome.completed("Generated " + tally.completed() + " of " + tally.total()
                    + " lessons; " + tally.unsuccessful() + " did not complete"));
        }
    };

    /**
     * @return the terminal outcome, or empty while the parent must keep waiting
     */
    public abstract Optional<BatchOutcome> decide(BatchTally tally);

    private static String describeUnsuccessful(BatchTally tally) {
        if (tally.cancelled() == 0) {
            return tally.failed() + " lesson(s) failed to generate";
        }
        return tally.failed() + " lesson(s) failed to generate, " + tally.cancelled() + " cancelled";
    }
}
