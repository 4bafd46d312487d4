package com.retinaai.service;

import com.retinaai.exception.NotFoundException;
import com.retinaai.exception.ValidationException;
import com.retinaai.model.enums.NotificationType;
import com.retinaai.model.notification.Notification;
import com.retinaai.repository.NotificationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Stores notifications for accounts. Each delivery commits on its own.
 */
@Service
@Slf4j
public class NotificationService implements NotificationSink {

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void notify(Long accountId, NotificationType type, String content) {
        send(accountId, type, content);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Notification send(Long accountId, NotificationType type, String content) {
        if (accountId == null) {
            throw new ValidationException("Account id is required");
        }
        if (type == null) {
            throw new ValidationException("Notification type is required");
        }
        if (content == null || content.isBlank()) {
            throw new ValidationException("Notification content is required");
        }

        Notification saved = notificationRepository.save(Notification.builder()
            .accountId(accountId)
            .type(type)
            .content(content)
            .read(false)
            .createdAt(LocalDateTime.now(clock))
            .build());
        log.debug("Stored {} notification {} for account {}", type.getValue(), saved.getId(), accountId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Notification> findByAccount(Long accountId) {
        return notificationRepository.findByAccountIdOrderByCreatedAtDesc(accountId);
    }

    @Transactional(readOnly = true)
    public List<Notification> findUnread(Long accountId) {
        return notificationRepository.findByAccountIdAndReadFalseOrderByCreatedAtDesc(accountId);
    }

    @Transactional(readOnly = true)
    public long countUnread(Long accountId) {
        return notificationRepository.countByAccountIdAndReadFalse(accountId);
    }

    @Transactional
    public Notification markAsRead(Long notificationId) {
        Notification notification = notificationRepository.findById(notificationId)
            .orElseThrow(() -> new NotFoundException("Notification not found: " + notificationId));
        notification.setRead(true);
        return notificationRepository.save(notification);
    }
}
