package net.javahippie.inflo.model.entity;

import jakarta.persistence.AttributeConverter;

import java.util.Arrays;

/**
 * Status of a tracked user habit.
 */
public enum HabitStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    PAUSED("paused"),
    CANCELLED("cancelled");

    private final String value;

    HabitStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static HabitStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown habit status: " + raw));
    }

    @jakarta.persistence.Converter
    public static class Converter implements AttributeConverter<HabitStatus, String> {
        @Override
        public String convertToDatabaseColumn(HabitStatus status) {
            return status == null ? null : status.getValue();
        }

        @Override
        public HabitStatus convertToEntityAttribute(String value) {
            return fromValue(value);
        }
    }
}
