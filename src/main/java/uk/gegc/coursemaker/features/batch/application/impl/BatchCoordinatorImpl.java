package uk.gegc.coursemaker.features.batch.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.coursemaker.features.batch.application.BatchCoordinator;
import uk.gegc.coursemaker.features.batch.config.BatchProperties;
import uk.gegc.coursemaker.features.batch.domain.BatchOutcome;
import uk.gegc.coursemaker.features.batch.domain.BatchTally;
import uk.gegc.coursemaker.features.job.application.GenerationJobService;
import uk.gegc.coursemaker.features.job.domain.event.GenerationJobTerminatedEvent;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.payload.FullCoursePayload;
import uk.gegc.coursemaker.features.job.domain.model.payload.LessonContentPayload;
import uk.gegc.coursemaker.features.job.domain.repository.GenerationJobRepository;
import uk.gegc.coursemaker.features.job.domain.repository.projection.ChildStatusCount;
import uk.gegc.coursemaker.features.notification.application.JobMilestoneNotifier;
import uk.gegc.coursemaker.features.worker.application.GenerationJobDispatcher;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BatchCoordinatorImpl implements BatchCoordinator {

    private final GenerationJobService jobService;
    private final GenerationJobRepository jobRepository;
    private final GenerationJobDispatcher dispatcher;
    private final JobMilestoneNotifier notifier;
    private final BatchProperties batchProperties;
    private final Clock clock;

    @Override
    @Transactional
    public GenerationJob startLessonBatch(UUID tenantId, UUID userId, UUID courseId, List<UUID> lessonIds) {
        if (lessonIds == null || lessonIds.isEmpty()) {
            throw new ValidationException("At least one lesson is required to start a batch");
        }
        List<UUID> distinctLessons = new ArrayList<>(new LinkedHashSet<>(lessonIds));

        GenerationJob parent = jobService.createBatchParent(tenantId, userId, new FullCoursePayload(courseId),
                "Generating " + distinctLessons.size() + " lessons...");

        List<GenerationJob> children = new ArrayList<>(distinctLessons.size());
        for (UUID lessonId : distinctLessons) {
            children.add(jobService.createChildJob(parent, new LessonContentPayload(courseId, lessonId)));
        }

        int dispatched = 0;
        for (GenerationJob child : children) {
            if (dispatcher.dispatch(child)) {
                dispatched++;
            }
        }
        if (dispatched < children.size()) {
            log.warn("Batch {}: {} of {} children could not be enqueued; polling will pick them up",
                    parent.getId(), children.size() - dispatched, children.size());
        }

        notifier.batchStarted(parent, children.size());
        log.info("Started lesson batch {} for course {} with {} children", parent.getId(), courseId, children.size());
        return parent;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onChildTerminal(GenerationJobTerminatedEvent event) {
        if (!event.isChild()) {
            return;
        }
        aggregate(event.parentJobId(), "child " + event.jobId());
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean reconcileParent(UUID parentJobId) {
        boolean finalized = aggregate(parentJobId, "reconciliation");
        if (finalized) {
            log.warn("Batch parent {} was finalized by reconciliation; a child termination event was lost",
                    parentJobId);
        }
        return finalized;
    }

    private boolean aggregate(UUID parentId, String trigger) {
        Optional<GenerationJob> locked = jobRepository.findByIdForUpdate(parentId);
        if (locked.isEmpty()) {
            log.warn("Aggregation for parent {} ({}) found no such job", parentId, trigger);
            return false;
        }
        GenerationJob parent = locked.get();
        if (parent.isTerminal()) {
            log.debug("Parent {} already {}; ignoring {}", parentId, parent.getStatus(), trigger);
            return false;
        }

        BatchTally tally = tally(parentId);
        jobService.updateProgress(parentId, tally.progressPercent(), tally.progressMessage());

        Optional<BatchOutcome> decision = batchProperties.getAggregationPolicy().decide(tally);
        if (decision.isEmpty()) {
            return false;
        }
        BatchOutcome outcome = decision.get();

        int updated = jobRepository.finalizeParent(parentId,
                GenerationJobStatus.PROCESSING,
                outcome.status(),
                outcome.message(),
                outcome.isFailure() ? outcome.message() : null,
                tally.tokensUsed(),
                LocalDateTime.now(clock));
        if (updated == 0) {
            return false;
        }

        log.info("Batch parent {} finished as {}: {}", parentId, outcome.status(), outcome.message());
        if (outcome.isFailure()) {
            int cancelled = jobService.cancelActiveChildren(parentId, "Cancelled: sibling lesson failed");
            if (cancelled > 0) {
                log.info("Cancelled {} remaining child job(s) of failed parent {}", cancelled, parentId);
            }
        }

        GenerationJob finished = jobRepository.findById(parentId).orElse(parent);
        if (outcome.isFailure()) {
            notifier.jobFailed(finished);
        } else {
            notifier.jobCompleted(finished);
        }
        return true;
    }

    private BatchTally tally(UUID parentId) {
        long total = 0;
        long completed = 0;
        long failed = 0;
        long cancelled = 0;
        long tokens = 0;
        for (ChildStatusCount count : jobRepository.countChildrenByStatus(parentId)) {
            total += count.getTotal();
            switch (count.getStatus()) {
                case COMPLETED -> {
                    completed += count.getTotal();
                    tokens += count.getTokens() != null ? count.getTokens() : 0L;
                }
                case FAILED -> failed += count.getTotal();
                case CANCELLED -> cancelled += count.getTotal();
                default -> {
                }
            }
        }
        return new BatchTally(total, completed, failed, cancelled, tokens);
    }
}
