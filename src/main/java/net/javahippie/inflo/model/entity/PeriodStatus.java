package net.javahippie.inflo.model.entity;

import jakarta.persistence.AttributeConverter;

import java.util.Arrays;

/**
 * Lifecycle states of an intervention period.
 * Only ACTIVE -> COMPLETED is performed by the completion pipeline; PAUSED and ABANDONED are set elsewhere.
 */
public enum PeriodStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    PAUSED("paused"),
    ABANDONED("abandoned");

    private final String value;

    PeriodStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PeriodStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown period status: " + raw));
    }

    /**
     * Stores the lower-case value used by existing rows.
     */
    @jakarta.persistence.Converter
    public static class Converter implements AttributeConverter<PeriodStatus, String> {
        @Override
        public String convertToDatabaseColumn(PeriodStatus status) {
            return status == null ? null : status.getValue();
        }

        @Override
        public PeriodStatus convertToEntityAttribute(String value) {
            return fromValue(value);
        }
    }
}
