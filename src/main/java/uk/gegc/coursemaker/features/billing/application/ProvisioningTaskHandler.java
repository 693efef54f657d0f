package uk.gegc.coursemaker.features.billing.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.billing.config.ProvisioningProperties;
import uk.gegc.coursemaker.features.billing.domain.model.PendingRegistration;
import uk.gegc.coursemaker.features.queue.application.EnqueueOptions;
import uk.gegc.coursemaker.features.queue.domain.model.QueueName;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTask;
import uk.gegc.coursemaker.features.worker.application.QueueTaskHandler;

import java.util.Optional;

/**
 * Creates the tenant for a paid registration. The task subject is the checkout session id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProvisioningTaskHandler implements QueueTaskHandler {

    public static final String TASK_TYPE = "billing:provision";

    private final PendingRegistrationService registrationService;

    public static EnqueueOptions enqueueOptions(ProvisioningProperties properties) {
        return EnqueueOptions.on(QueueName.CRITICAL, properties.getTaskMaxRetries());
    }

    @Override
    public String handlesTaskType() {
        return TASK_TYPE;
    }

    @Override
    public void handle(QueueTask task) {
        String sessionId = task.getSubjectId();
        Optional<PendingRegistration> claimed = registrationService.beginProvisioning(sessionId);
        if (claimed.isEmpty()) {
            if (registrationService.isProvisioned(sessionId)) {
                log.debug("Session {} already provisioned; skipping task {}", sessionId, task.getId());
            } else {
                log.info("Registration for session {} is not PAID; skipping task {}", sessionId, task.getId());
            }
            return;
        }

        try {
            registrationService.completeProvisioning(claimed.get());
        } catch (RuntimeException e) {
            boolean finalAttempt = task.isFinalDelivery();
            registrationService.recordProvisioningFailure(sessionId, e.getMessage(), finalAttempt);
            if (finalAttempt) {
                log.error("Provisioning for session {} failed on final delivery {}; registration marked FAILED",
                        sessionId, task.getDeliveries(), e);
            } else {
                log.warn("Provisioning for session {} failed on delivery {}; will retry: {}",
                        sessionId, task.getDeliveries(), e.getMessage());
            }
            throw e;
        }
    }
}
