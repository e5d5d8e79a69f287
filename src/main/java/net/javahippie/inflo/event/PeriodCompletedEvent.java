package net.javahippie.inflo.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Payload published on {@value #TOPIC} once an intervention period has transitioned to completed.
 * The selected habits are deliberately not carried; listeners re-read them from the period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodCompletedEvent {

    public static final String TOPIC = "period.completed";

    public static final String PERIOD_ID = "period_id";
    public static final String USER_ID = "user_id";
    public static final String INTERVENTION_NAME = "intervention_name";
    public static final String NOTES = "notes";
    public static final String AUTO_COMPLETED = "auto_completed";
    public static final String COMPLETED_AT = "completed_at";

    private UUID periodId;
    private UUID userId;
    private String interventionName;
    private String notes;
    private boolean autoCompleted;
    private LocalDateTime completedAt;

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PERIOD_ID, periodId);
        payload.put(USER_ID, userId);
        payload.put(INTERVENTION_NAME, interventionName);
        payload.put(NOTES, notes);
        payload.put(AUTO_COMPLETED, autoCompleted);
        payload.put(COMPLETED_AT, completedAt);
        return payload;
    }

    /**
     * Read a payload back into an event. Identifiers may arrive as UUIDs or strings.
     *
     * @throws IllegalArgumentException if the period or user id is missing
     */
    public static PeriodCompletedEvent fromPayload(Map<String, Object> payload) {
        UUID periodId = toUuid(payload.get(PERIOD_ID));
        UUID userId = toUuid(payload.get(USER_ID));
        if (periodId == null || userId == null) {
            throw new IllegalArgumentException("Missing " + PERIOD_ID + " or " + USER_ID + " in event payload");
        }

        Object completedAt = payload.get(COMPLETED_AT);
        return PeriodCompletedEvent.builder()
            .periodId(periodId)
            .userId(userId)
            .interventionName((String) payload.get(INTERVENTION_NAME))
            .notes((String) payload.get(NOTES))
            .autoCompleted(Boolean.TRUE.equals(payload.get(AUTO_COMPLETED)))
            .completedAt(completedAt instanceof LocalDateTime time ? time
                : completedAt != null ? LocalDateTime.parse(completedAt.toString()) : null)
            .build();
    }

    private static UUID toUuid(Object value) {
        if (value == null) {
            return null;
        }
        return value instanceof UUID uuid ? uuid : UUID.fromString(value.toString());
    }
}
