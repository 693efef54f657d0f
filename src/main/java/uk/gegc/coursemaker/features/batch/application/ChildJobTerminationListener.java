package uk.gegc.coursemaker.features.batch.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.coursemaker.features.job.domain.event.GenerationJobTerminatedEvent;

/**
 * Feeds terminal child jobs into the batch coordinator once the child's own transition is committed.
 * The coordinator runs in its own transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChildJobTerminationListener {

    private final BatchCoordinator batchCoordinator;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onJobTerminated(GenerationJobTerminatedEvent event) {
        if (!event.isChild()) {
            return;
        }
        try {
            batchCoordinator.onChildTerminal(event);
        } catch (Exception e) {
            log.error("Failed to aggregate child {} into parent {}", event.jobId(), event.parentJobId(), e);
        }
    }
}
