package net.javahippie.inflo.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Outcome of the completion notification listener.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResult {

    private UUID notificationId;
    private String title;
    private String body;
    private Map<String, Object> data;
    private boolean persisted;
    private String warning;
}
