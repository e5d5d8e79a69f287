package net.javahippie.inflo.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one handler invocation during a publish.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HandlerResult {

    private String handler;
    private boolean success;

    /**
     * Value returned by the handler; null when it failed.
     */
    private Object result;

    /**
     * Failure message; null when the handler succeeded.
     */
    private String error;

    public static HandlerResult success(String handler, Object result) {
        return HandlerResult.builder()
            .handler(handler)
            .success(true)
            .result(result)
            .build();
    }

    public static HandlerResult failure(String handler, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return HandlerResult.builder()
            .handler(handler)
            .success(false)
            .error(message)
            .build();
    }
}
