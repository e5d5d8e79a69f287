package net.javahippie.inflo.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.inflo.model.entity.MoodTrend;

import java.util.List;

/**
 * Adherence and mood figures computed for a completed period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionMetrics {

    private long totalDays;
    private int trackedDays;
    private long missedDays;
    private int totalHabits;

    /**
     * Mean completion percentage over tracked days (0-100).
     */
    private double averageCompletion;

    /**
     * Fraction 0..1; untracked days count as zero.
     */
    private double adherenceRate;

    /**
     * Mean mood score, null when no mood was recorded.
     */
    private Double averageMood;

    private MoodTrend moodTrend;
    private int currentStreak;
    private int longestStreak;
    private List<Double> completionPercentages;
    private List<Integer> moodValues;
}
