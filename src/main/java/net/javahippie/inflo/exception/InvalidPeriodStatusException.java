package net.javahippie.inflo.exception;

import net.javahippie.inflo.model.entity.PeriodStatus;

import java.util.UUID;

/**
 * Exception thrown when strict completion is enabled and a paused or abandoned period is completed.
 */
public class InvalidPeriodStatusException extends PeriodCompletionException {

    public InvalidPeriodStatusException(UUID periodId, PeriodStatus status) {
        super("Intervention period " + periodId + " cannot be completed from status " + status.getValue());
    }
}
