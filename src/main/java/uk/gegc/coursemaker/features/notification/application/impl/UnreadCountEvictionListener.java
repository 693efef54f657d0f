package uk.gegc.coursemaker.features.notification.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.coursemaker.features.notification.domain.event.UnreadCountChangedEvent;
import uk.gegc.coursemaker.shared.cache.TenantCache;

/**
 * Drops a cached unread count once the change that invalidated it has committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnreadCountEvictionListener {

    private final TenantCache tenantCache;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onUnreadCountChanged(UnreadCountChangedEvent event) {
        tenantCache.evict(event.tenantId(), NotificationServiceImpl.unreadCountKey(event.userId()));
        log.debug("Evicted unread count for user {} in tenant {}", event.userId(), event.tenantId());
    }
}
