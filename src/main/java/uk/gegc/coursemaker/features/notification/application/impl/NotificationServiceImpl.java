package uk.gegc.coursemaker.features.notification.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.coursemaker.features.notification.api.dto.NotificationDto;
import uk.gegc.coursemaker.features.notification.api.dto.NotificationPageDto;
import uk.gegc.coursemaker.features.notification.application.NewNotification;
import uk.gegc.coursemaker.features.notification.application.NotificationCursor;
import uk.gegc.coursemaker.features.notification.application.NotificationService;
import uk.gegc.coursemaker.features.notification.config.NotificationProperties;
import uk.gegc.coursemaker.features.notification.domain.event.NotificationCreatedEvent;
import uk.gegc.coursemaker.features.notification.domain.event.UnreadCountChangedEvent;
import uk.gegc.coursemaker.features.notification.domain.model.Notification;
import uk.gegc.coursemaker.features.notification.domain.model.NotificationPriority;
import uk.gegc.coursemaker.features.notification.domain.repository.NotificationRepository;
import uk.gegc.coursemaker.shared.cache.TenantCache;
import uk.gegc.coursemaker.shared.exception.ResourceNotFoundException;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class NotificationServiceImpl implements NotificationService {

    static final String UNREAD_COUNT_KEY_PREFIX = "notifications:unread:";

    private final NotificationRepository notificationRepository;
    private final TenantCache tenantCache;
    private final NotificationProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Runs in its own transaction so a notification problem cannot roll back the caller's work.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public NotificationDto create(NewNotification request) {
        if (request.tenantId() == null || request.userId() == null) {
            throw new ValidationException("Notification owner (tenant and user) is required");
        }
        if (request.type() == null) {
            throw new ValidationException("Notification type is required");
        }
        if (!StringUtils.hasText(request.title())) {
            throw new ValidationException("Notification title is required");
        }

        Notification notification = new Notification();
        notification.setTenantId(request.tenantId());
        notification.setUserId(request.userId());
        notification.setType(request.type());
        notification.setPriority(request.priority() != null ? request.priority() : NotificationPriority.NORMAL);
        notification.setTitle(request.title());
        notification.setMessage(request.message() != null ? request.message() : "");
        notification.setActionUrl(request.actionUrl());
        notification.setJobId(request.jobId());
        notification.setCourseId(request.courseId());
        notification.setTaskId(request.taskId());
        notification.setSmeId(request.smeId());
        notification.setCreatedAt(LocalDateTime.now(clock));

        Notification saved = notificationRepository.save(notification);
        evictUnreadCount(saved.getTenantId(), saved.getUserId());

        NotificationDto dto = NotificationDto.fromEntity(saved);
        eventPublisher.publishEvent(new NotificationCreatedEvent(saved.getTenantId(), saved.getUserId(), dto));
        log.debug("Created {} notification {} for user {}", saved.getType(), saved.getId(), saved.getUserId());
        return dto;
    }

    @Override
    @Transactional(readOnly = true)
    public NotificationPageDto list(UUID tenantId, UUID userId, String cursor, Integer limit, boolean unreadOnly) {
        int size = resolveLimit(limit);
        PageRequest page = PageRequest.of(0, size);

        List<Notification> rows;
        if (StringUtils.hasText(cursor)) {
            NotificationCursor position = NotificationCursor.parse(cursor);
            rows = notificationRepository.findPageAfter(tenantId, userId, unreadOnly,
                    position.createdAt(), position.id(), page);
        } else {
            rows = notificationRepository.findFirstPage(tenantId, userId, unreadOnly, page);
        }

        String nextCursor = rows.size() == size ? NotificationCursor.of(rows.get(rows.size() - 1)).encode() : null;
        return new NotificationPageDto(rows.stream().map(NotificationDto::fromEntity).toList(), nextCursor);
    }

    @Override
    @Transactional(readOnly = true)
    public long unreadCount(UUID tenantId, UUID userId) {
        String key = unreadCountKey(userId);
        return tenantCache.get(tenantId, key, Long.class).orElseGet(() -> {
            long count = notificationRepository.countByTenantIdAndUserIdAndReadFalse(tenantId, userId);
            tenantCache.put(tenantId, key, count, properties.getUnreadCountTtl());
            return count;
        });
    }

    @Override
    public int markAsRead(UUID tenantId, UUID userId, List<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        int updated = notificationRepository.markRead(tenantId, userId, ids, LocalDateTime.now(clock));
        if (updated > 0) {
            evictUnreadCount(tenantId, userId);
        }
        return updated;
    }

    @Override
    public int markAllAsRead(UUID tenantId, UUID userId) {
        int updated = notificationRepository.markAllRead(tenantId, userId, LocalDateTime.now(clock));
        if (updated > 0) {
            evictUnreadCount(tenantId, userId);
        }
        return updated;
    }

    @Override
    public void delete(UUID tenantId, UUID userId, UUID notificationId) {
        Notification notification = notificationRepository.findByIdAndTenantIdAndUserId(notificationId, tenantId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Notification " + notificationId + " not found"));
        notificationRepository.delete(notification);
        evictUnreadCount(tenantId, userId);
    }

    private int resolveLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return properties.getDefaultPageSize();
        }
        return Math.min(limit, properties.getMaxPageSize());
    }

    private void evictUnreadCount(UUID tenantId, UUID userId) {
        eventPublisher.publishEvent(new UnreadCountChangedEvent(tenantId, userId));
    }

    static String unreadCountKey(UUID userId) {
        return UNREAD_COUNT_KEY_PREFIX + userId;
    }
}
