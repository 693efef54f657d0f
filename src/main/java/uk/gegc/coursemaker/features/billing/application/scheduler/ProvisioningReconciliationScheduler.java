package uk.gegc.coursemaker.features.billing.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.billing.application.PendingRegistrationService;
import uk.gegc.coursemaker.features.billing.application.ProvisioningTaskHandler;
import uk.gegc.coursemaker.features.billing.config.ProvisioningProperties;
import uk.gegc.coursemaker.features.billing.domain.model.PendingRegistration;
import uk.gegc.coursemaker.features.queue.application.TaskQueue;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Re-enqueues provisioning for registrations that were paid but never provisioned,
 * e.g. because the enqueue after the webhook failed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProvisioningReconciliationScheduler {

    private final PendingRegistrationService registrationService;
    private final TaskQueue taskQueue;
    private final ProvisioningProperties properties;
    private final Clock clock;

    /**
     * Runs every 15 minutes by default (coursemaker.provisioning.reconcile-fixed-delay-seconds).
     */
    @Scheduled(fixedDelayString = "${coursemaker.provisioning.reconcile-fixed-delay-seconds:900}000")
    public void reconcilePaidRegistrations() {
        log.debug("Running provisioning reconciliation");
        try {
            List<PendingRegistration> stuck = registrationService
                    .findPaidNotUpdatedFor(Duration.ofMinutes(properties.getReenqueueAfterMinutes()));
            LocalDateTime now = LocalDateTime.now(clock);
            for (PendingRegistration registration : stuck) {
                long minutes = Duration.between(registration.getUpdatedAt(), now).toMinutes();
                if (minutes >= properties.getErrorAfterMinutes()) {
                    log.error("Registration for session {} has been PAID without provisioning for {} minutes",
                            registration.getCheckoutSessionId(), minutes);
                } else if (minutes >= properties.getWarnAfterMinutes()) {
                    log.warn("Registration for session {} has been PAID without provisioning for {} minutes",
                            registration.getCheckoutSessionId(), minutes);
                }
                taskQueue.enqueue(ProvisioningTaskHandler.TASK_TYPE, registration.getCheckoutSessionId(),
                        ProvisioningTaskHandler.enqueueOptions(properties));
            }
            if (!stuck.isEmpty()) {
                log.info("Re-enqueued provisioning for {} paid registration(s)", stuck.size());
            }
        } catch (Exception e) {
            log.error("Error during provisioning reconciliation", e);
        }
    }
}
