package uk.gegc.coursemaker.features.billing.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.billing.application.PendingRegistrationService;

@Component
@RequiredArgsConstructor
@Slf4j
public class PendingRegistrationCleanupScheduler {

    private final PendingRegistrationService registrationService;

    @Scheduled(cron = "0 0 * * * *") // Every hour
    public void deleteExpiredRegistrations() {
        try {
            int deleted = registrationService.deleteExpiredPending();
            if (deleted > 0) {
                log.info("Deleted {} expired pending registration(s)", deleted);
            }
        } catch (Exception e) {
            log.error("Error deleting expired pending registrations", e);
        }
    }
}
