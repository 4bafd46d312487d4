package com.retinaai.service;

import com.retinaai.model.enums.NotificationType;

/**
 * Best-effort delivery of a milestone message to an account.
 * Callers do not wait on delivery and never retry.
 */
public interface NotificationSink {

    void notify(Long accountId, NotificationType type, String content);
}
