package net.javahippie.inflo.exception;

/**
 * Exception thrown when the status write that completes a period fails.
 * No completion event is published in that case.
 */
public class PeriodCompletionException extends RuntimeException {

    public PeriodCompletionException(String message) {
        super(message);
    }

    public PeriodCompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
