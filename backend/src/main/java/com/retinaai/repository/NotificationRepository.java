package com.retinaai.repository;

import com.retinaai.model.notification.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for notifications.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    List<Notification> findByAccountIdOrderByCreatedAtDesc(Long accountId);

    List<Notification> findByAccountIdAndReadFalseOrderByCreatedAtDesc(Long accountId);

    long countByAccountIdAndReadFalse(Long accountId);
}
