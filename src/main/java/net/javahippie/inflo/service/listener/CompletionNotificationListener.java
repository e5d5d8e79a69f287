package net.javahippie.inflo.service.listener;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.inflo.event.PeriodCompletedEvent;
import net.javahippie.inflo.model.dto.NotificationResult;
import net.javahippie.inflo.model.entity.Notification;
import net.javahippie.inflo.repository.NotificationRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates the in-app notification telling a user their intervention period is over.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CompletionNotificationListener {

    static final String COMPLETED_TITLE = "Intervention Completed 🎉";
    static final String ENDED_TITLE = "Intervention Period Ended";

    private final NotificationRepository notificationRepository;

    /**
     * Handle a {@value PeriodCompletedEvent#TOPIC} event.
     * Storage failures are downgraded to a warning.
     *
     * @param payload the event payload
     * @return the notification content and whether it was stored
     */
    public NotificationResult onPeriodCompleted(Map<String, Object> payload) {
        PeriodCompletedEvent event = PeriodCompletedEvent.fromPayload(payload);
        String interventionName = event.getInterventionName() != null ? event.getInterventionName() : "intervention";

        String title;
        String body;
        if (event.isAutoCompleted()) {
            title = ENDED_TITLE;
            body = String.format("Your %s period has ended.", interventionName);
        } else {
            title = COMPLETED_TITLE;
            body = String.format("You've completed your %s journey!", interventionName);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("period_id", event.getPeriodId().toString());
        data.put("intervention_name", interventionName);
        data.put("auto_completed", event.isAutoCompleted());

        Notification notification = Notification.builder()
            .userId(event.getUserId())
            .type(Notification.TYPE_INTERVENTION_COMPLETED)
            .title(title)
            .body(body)
            .data(data)
            .build();

        NotificationResult.NotificationResultBuilder result = NotificationResult.builder()
            .title(title)
            .body(body)
            .data(data);

        try {
            Notification saved = notificationRepository.save(notification);
            log.info("Stored '{}' notification for user {}", title, event.getUserId());
            return result.notificationId(saved.getId()).persisted(true).build();
        } catch (DataAccessException e) {
            log.warn("Could not store notification for user {}: {}", event.getUserId(), e.getMessage());
            return result.persisted(false).warning("Notification not stored: " + e.getMessage()).build();
        }
    }
}
