package net.javahippie.inflo.exception;

import java.util.UUID;

/**
 * Exception thrown when a referenced intervention period does not exist.
 */
public class InterventionPeriodNotFoundException extends RuntimeException {

    private final UUID periodId;

    public InterventionPeriodNotFoundException(UUID periodId) {
        super("Intervention period not found: " + periodId);
        this.periodId = periodId;
    }

    public UUID getPeriodId() {
        return periodId;
    }
}
