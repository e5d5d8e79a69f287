package net.javahippie.inflo.model.entity;

import jakarta.persistence.AttributeConverter;

import java.util.Arrays;

/**
 * Coarse comparison of late vs. early mood during a period.
 */
public enum MoodTrend {
    IMPROVED("improved"),
    DECLINED("declined"),
    STABLE("stable");

    private final String value;

    MoodTrend(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MoodTrend fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown mood trend: " + raw));
    }

    @jakarta.persistence.Converter
    public static class Converter implements AttributeConverter<MoodTrend, String> {
        @Override
        public String convertToDatabaseColumn(MoodTrend trend) {
            return trend == null ? null : trend.getValue();
        }

        @Override
        public MoodTrend convertToEntityAttribute(String value) {
            return fromValue(value);
        }
    }
}
