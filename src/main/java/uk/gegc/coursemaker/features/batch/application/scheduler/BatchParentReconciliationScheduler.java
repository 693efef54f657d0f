package uk.gegc.coursemaker.features.batch.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.batch.application.BatchCoordinator;
import uk.gegc.coursemaker.features.job.config.JobProperties;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.job.domain.repository.GenerationJobRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Finishes batch parents whose children are all done but whose aggregation never ran, for
 * example because the process stopped between a child's commit and its termination listener.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchParentReconciliationScheduler {

    private final GenerationJobRepository jobRepository;
    private final BatchCoordinator batchCoordinator;
    private final JobProperties jobProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${coursemaker.jobs.reclaim-fixed-delay-seconds:60}000")
    public void reconcileSettledParents() {
        List<UUID> parents;
        try {
            LocalDateTime cutoff = LocalDateTime.now(clock).minusMinutes(jobProperties.getStaleTimeoutMinutes());
            parents = jobRepository.findSettledParentIds(GenerationJobStatus.PROCESSING,
                    GenerationJobType.FULL_COURSE, GenerationJobStatus.ACTIVE, cutoff);
        } catch (Exception e) {
            log.error("Error looking up batch parents to reconcile", e);
            return;
        }

        int finalized = 0;
        for (UUID parentId : parents) {
            try {
                if (batchCoordinator.reconcileParent(parentId)) {
                    finalized++;
                }
            } catch (Exception e) {
                log.error("Error reconciling batch parent {}", parentId, e);
            }
        }
        if (finalized > 0) {
            log.info("Reconciled {} of {} settled batch parent(s)", finalized, parents.size());
        }
    }
}
