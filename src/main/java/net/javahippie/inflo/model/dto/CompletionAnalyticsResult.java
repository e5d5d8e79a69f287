package net.javahippie.inflo.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Outcome of the completion analytics listener.
 * When the summary could not be stored, {@code summaryId} is null and {@code warning} explains why.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionAnalyticsResult {

    private UUID summaryId;
    private CompletionMetrics metrics;
    private boolean persisted;
    private String warning;
}
