package com.retinaai.service;

import com.retinaai.PipelineTestSupport;
import com.retinaai.exception.NotFoundException;
import com.retinaai.exception.ValidationException;
import com.retinaai.model.enums.NotificationType;
import com.retinaai.model.notification.Notification;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class NotificationServiceTest extends PipelineTestSupport {

    @Autowired
    private NotificationService notificationService;

    @Test
    void sentNotificationsStartUnread() {
        notificationService.send(PATIENT_ID, NotificationType.AI_RESULT_READY, "first");
        Notification second = notificationService.send(PATIENT_ID, NotificationType.REPORT_READY, "second");
        notificationService.send(999L, NotificationType.REPORT_READY, "other patient");

        assertThat(notificationService.findByAccount(PATIENT_ID)).hasSize(2);
        assertThat(notificationService.countUnread(PATIENT_ID)).isEqualTo(2);

        notificationService.markAsRead(second.getId());

        assertThat(notificationService.countUnread(PATIENT_ID)).isEqualTo(1);
        assertThat(notificationService.findUnread(PATIENT_ID))
            .extracting(Notification::getContent)
            .containsExactly("first");
    }

    @Test
    void incompleteNotificationsAreRejected() {
        assertThatThrownBy(() -> notificationService.send(null, NotificationType.REPORT_READY, "x"))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> notificationService.send(PATIENT_ID, null, "x"))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> notificationService.send(PATIENT_ID, NotificationType.REPORT_READY, " "))
            .isInstanceOf(ValidationException.class);
        assertThat(notificationRepository.count()).isZero();
    }

    @Test
    void markingUnknownNotificationFails() {
        assertThatThrownBy(() -> notificationService.markAsRead(31337L)).isInstanceOf(NotFoundException.class);
    }
}
