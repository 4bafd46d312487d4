package com.retinaai.controller;

import com.retinaai.dto.mapper.PipelineMapper;
import com.retinaai.dto.response.NotificationDto;
import com.retinaai.model.notification.Notification;
import com.retinaai.service.NotificationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for account notifications.
 */
@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationService notificationService;
    private final PipelineMapper mapper;

    public NotificationController(NotificationService notificationService, PipelineMapper mapper) {
        this.notificationService = notificationService;
        this.mapper = mapper;
    }

    @GetMapping
    public ResponseEntity<List<NotificationDto>> list(
            @RequestParam Long accountId,
            @RequestParam(required = false, defaultValue = "false") boolean unreadOnly) {
        List<Notification> notifications = unreadOnly
            ? notificationService.findUnread(accountId)
            : notificationService.findByAccount(accountId);
        return ResponseEntity.ok(notifications.stream().map(mapper::toDto).toList());
    }

    @GetMapping("/unread-count")
    public ResponseEntity<Map<String, Long>> unreadCount(@RequestParam Long accountId) {
        return ResponseEntity.ok(Map.of("count", notificationService.countUnread(accountId)));
    }

    @PostMapping("/{id}/read")
    public ResponseEntity<NotificationDto> markAsRead(@PathVariable Long id) {
        return ResponseEntity.ok(mapper.toDto(notificationService.markAsRead(id)));
    }
}
