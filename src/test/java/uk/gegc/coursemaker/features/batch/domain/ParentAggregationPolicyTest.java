package uk.gegc.coursemaker.features.batch.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Batch parent aggregation")
class ParentAggregationPolicyTest {

    // total, completed, failed, cancelled, tokens
    private static BatchTally tally(long total, long completed, long failed, long cancelled) {
        return new BatchTally(total, completed, failed, cancelled, completed * 1000);
    }

    @Nested
    @DisplayName("progress")
    class Progress {

        @Test
        @DisplayName("reports 10% before any child finishes and 100% once all have")
        void progressPercent_spansTenToHundred() {
            assertThat(tally(5, 0, 0, 0).progressPercent()).isEqualTo(10);
            assertThat(tally(5, 2, 1, 0).progressPercent()).isEqualTo(64);
            assertThat(tally(5, 5, 0, 0).progressPercent()).isEqualTo(100);
            assertThat(tally(0, 0, 0, 0).progressPercent()).isEqualTo(10);
        }

        @Test
        @DisplayName("message counts finished children regardless of outcome")
        void progressMessage_countsDone() {
            assertThat(tally(5, 2, 1, 1).progressMessage()).isEqualTo("Generated 4 of 5 lessons...");
        }

        @Test
        @DisplayName("an empty batch is never settled")
        void isSettled_emptyBatch() {
            assertThat(tally(0, 0, 0, 0).isSettled()).isFalse();
            assertThat(tally(3, 2, 0, 1).isSettled()).isTrue();
        }
    }

    @ParameterizedTest
    @EnumSource(ParentAggregationPolicy.class)
    @DisplayName("every policy completes the parent when all five children complete")
    void allCompleted_completes(ParentAggregationPolicy policy) {
        Optional<BatchOutcome> outcome = policy.decide(tally(5, 5, 0, 0));

        assertThat(outcome).isPresent();
        assertThat(outcome.get().status()).isEqualTo(GenerationJobStatus.COMPLETED);
        assertThat(outcome.get().message()).isEqualTo("Generated 5 lessons");
    }

    @ParameterizedTest
    @EnumSource(ParentAggregationPolicy.class)
    @DisplayName("every policy keeps waiting while children are still running without failures")
    void running_waits(ParentAggregationPolicy policy) {
        assertThat(policy.decide(tally(5, 3, 0, 0))).isEmpty();
    }

    @Nested
    @DisplayName("FAIL_FAST")
    class FailFast {

        @Test
        @DisplayName("fails the parent on the first failed child without waiting for the rest")
        void firstFailure_failsImmediately() {
            Optional<BatchOutcome> outcome = ParentAggregationPolicy.FAIL_FAST.decide(tally(5, 1, 1, 0));

            assertThat(outcome).isPresent();
            assertThat(outcome.get().isFailure()).isTrue();
            assertThat(outcome.get().message()).isEqualTo("1 lesson(s) failed to generate");
        }

        @Test
        @DisplayName("cancelled children alone fail the parent only once the batch settles")
        void cancelledChildren_waitThenFail() {
            assertThat(ParentAggregationPolicy.FAIL_FAST.decide(tally(5, 2, 0, 1))).isEmpty();

            Optional<BatchOutcome> outcome = ParentAggregationPolicy.FAIL_FAST.decide(tally(5, 4, 0, 1));
            assertThat(outcome).isPresent();
            assertThat(outcome.get().isFailure()).isTrue();
            assertThat(outcome.get().message()).isEqualTo("0 lesson(s) failed to generate, 1 cancelled");
        }
    }

    @Nested
    @DisplayName("WAIT_ALL")
    class WaitAll {

        @Test
        @DisplayName("waits for every child even after a failure")
        void failure_waitsForSiblings() {
            assertThat(ParentAggregationPolicy.WAIT_ALL.decide(tally(5, 1, 1, 0))).isEmpty();
        }

        @Test
        @DisplayName("fails a settled batch with any unsuccessful child")
        void settledWithFailure_fails() {
            Optional<BatchOutcome> outcome = ParentAggregationPolicy.WAIT_ALL.decide(tally(5, 4, 1, 0));

            assertThat(outcome).isPresent();
            assertThat(outcome.get().status()).isEqualTo(GenerationJobStatus.FAILED);
        }
    }

    @Nested
    @DisplayName("BEST_EFFORT")
    class BestEffort {

        @Test
        @DisplayName("completes with partial results when some children succeeded")
        void partialSuccess_completes() {
            Optional<BatchOutcome> outcome = ParentAggregationPolicy.BEST_EFFORT.decide(tally(5, 3, 1, 1));

            assertThat(outcome).isPresent();
            assertThat(outcome.get().status()).isEqualTo(GenerationJobStatus.COMPLETED);
            assertThat(outcome.get().message()).isEqualTo("Generated 3 of 5 lessons; 2 did not complete");
        }

        @Test
        @DisplayName("fails when nothing succeeded")
        void noSuccess_fails() {
            Optional<BatchOutcome> outcome = ParentAggregationPolicy.BEST_EFFORT.decide(tally(5, 0, 5, 0));

            assertThat(outcome).isPresent();
            assertThat(outcome.get().isFailure()).isTrue();
        }
    }
}
