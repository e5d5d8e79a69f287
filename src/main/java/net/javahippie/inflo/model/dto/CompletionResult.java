package net.javahippie.inflo.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.inflo.event.HandlerResult;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of completing an intervention period.
 * {@code success} stays true when listeners fail; inspect {@link #listenerResults} for degraded runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionResult {

    private boolean success;
    private boolean alreadyCompleted;
    private UUID periodId;
    private String message;

    @Builder.Default
    private List<HandlerResult> listenerResults = new ArrayList<>();

    public static CompletionResult alreadyCompleted(UUID periodId) {
        return CompletionResult.builder()
            .success(true)
            .alreadyCompleted(true)
            .periodId(periodId)
            .message("Already completed")
            .build();
    }

    public static CompletionResult completed(UUID periodId, List<HandlerResult> listenerResults) {
        return CompletionResult.builder()
            .success(true)
            .periodId(periodId)
            .message("Intervention period completed")
            .listenerResults(listenerResults)
            .build();
    }

    /**
     * Whether any listener reported a failure.
     */
    public boolean hasListenerFailures() {
        return listenerResults.stream().anyMatch(r -> !r.isSuccess());
    }
}
