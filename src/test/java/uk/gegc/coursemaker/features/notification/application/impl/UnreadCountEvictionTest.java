package uk.gegc.coursemaker.features.notification.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.coursemaker.features.notification.application.NewNotification;
import uk.gegc.coursemaker.features.notification.application.NotificationService;
import uk.gegc.coursemaker.features.notification.config.NotificationProperties;
import uk.gegc.coursemaker.features.notification.domain.model.NotificationType;
import uk.gegc.coursemaker.shared.cache.TenantCache;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@Import({NotificationServiceImpl.class, UnreadCountEvictionListener.class, NotificationProperties.class,
        UnreadCountEvictionTest.ClockConfig.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@DisplayName("Unread count eviction")
class UnreadCountEvictionTest {

    @TestConfiguration
    static class ClockConfig {

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        }
    }

    @MockitoBean
    private TenantCache tenantCache;

    @Autowired
    private NotificationService notificationService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private final UUID tenantId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();

    private TransactionTemplate transaction;

    @BeforeEach
    void setUp() {
        transaction = new TransactionTemplate(transactionManager);
        notificationService.create(NewNotification.builder()
                .tenantId(tenantId)
                .userId(userId)
                .type(NotificationType.GENERATION_COMPLETE)
                .title("Lesson ready")
                .build());
    }

    @Test
    @DisplayName("creating a notification evicts the count once its row is committed")
    void create_evictsAfterCommit() {
        verify(tenantCache).evict(tenantId, NotificationServiceImpl.unreadCountKey(userId));
    }

    @Test
    @DisplayName("the cached count stays until the read-state change commits")
    void markAllAsRead_evictsOnlyAfterCommit() {
        clearInvocations(tenantCache);

        transaction.executeWithoutResult(status -> {
            assertThat(notificationService.markAllAsRead(tenantId, userId)).isEqualTo(1);
            verify(tenantCache, never()).evict(any(), any());
        });

        verify(tenantCache).evict(tenantId, NotificationServiceImpl.unreadCountKey(userId));
    }

    @Test
    @DisplayName("a rolled-back change leaves the cached count alone")
    void rolledBackChange_doesNotEvict() {
        clearInvocations(tenantCache);

        transaction.executeWithoutResult(status -> {
            notificationService.markAllAsRead(tenantId, userId);
            status.setRollbackOnly();
        });

        verify(tenantCache, never()).evict(any(), any());
        assertThat(notificationService.markAllAsRead(tenantId, userId)).isEqualTo(1);
    }
}
