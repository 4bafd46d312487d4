package com.retinaai.event;

import com.retinaai.model.enums.NotificationType;
import com.retinaai.service.NotificationSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Turns pipeline milestones into patient notifications.
 *
 * Runs only after the milestone's transaction has committed. Delivery failures
 * are logged and dropped; they cannot undo the milestone.
 */
@Component
@Slf4j
public class PipelineNotificationListener {

    private final NotificationSink notificationSink;

    public PipelineNotificationListener(NotificationSink notificationSink) {
        this.notificationSink = notificationSink;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAnalysisCompleted(AnalysisCompletedEvent event) {
        StringBuilder content = new StringBuilder()
            .append("AI analysis ").append(event.analysisId()).append(" completed. ")
            .append("Overall risk: ").append(event.riskSummary().describe()).append(".\n\n")
            .append(event.advisory());
        for (String warning : event.warnings()) {
            content.append("\n").append(warning);
        }
        deliver(event.patientId(), NotificationType.AI_RESULT_READY, content.toString());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAnalysisFailed(AnalysisFailedEvent event) {
        deliver(event.patientId(), NotificationType.ANALYSIS_FAILED,
            "AI analysis " + event.analysisId() + " of image " + event.imageId()
                + " could not be completed (" + event.reason() + "). Your clinic will arrange a new analysis.");
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onReportGenerated(ReportGeneratedEvent event) {
        deliver(event.patientId(), NotificationType.REPORT_READY,
            "Your medical report for analysis " + event.analysisId() + " is ready: " + event.reportUrl());
    }

    private void deliver(Long accountId, NotificationType type, String content) {
        try {
            notificationSink.notify(accountId, type, content);
        } catch (RuntimeException e) {
            log.warn("Dropped {} notification for account {}: {}", type.getValue(), accountId, e.getMessage());
        }
    }
}
