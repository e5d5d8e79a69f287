package net.javahippie.inflo.service;

import net.javahippie.inflo.model.dto.CompletionMetrics;
import net.javahippie.inflo.model.entity.DailyMoodEntry;
import net.javahippie.inflo.model.entity.DailySummary;
import net.javahippie.inflo.model.entity.MoodTrend;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Computes adherence, mood and streak figures for an intervention period from its daily time series.
 * Pure calculation, no persistence.
 */
@Component
public class CompletionMetricsCalculator {

    /**
     * Minimum difference between second-half and first-half mood means to call a trend.
     */
    static final double MOOD_TREND_THRESHOLD = 0.3;

    /**
     * Fewer mood values than this always yield {@link MoodTrend#STABLE}.
     */
    static final int MIN_MOOD_VALUES_FOR_TREND = 4;

    /**
     * A day counts toward a streak at or above this completion percentage.
     */
    static final double STREAK_COMPLETION_THRESHOLD = 80.0;

    /**
     * Calculate completion metrics for a period.
     *
     * @param startDate first day of the period
     * @param endDate last day of the period (inclusive)
     * @param totalHabits number of habits selected for the period
     * @param summaries daily summaries found for the period, any order
     * @param moods mood entries found for the period, any order
     * @return computed metrics
     */
    public CompletionMetrics calculate(LocalDate startDate,
                                       LocalDate endDate,
                                       int totalHabits,
                                       List<DailySummary> summaries,
                                       List<DailyMoodEntry> moods) {
        long totalDays = ChronoUnit.DAYS.between(startDate, endDate) + 1;
        int trackedDays = summaries.size();

        List<Double> completionPercentages = summaries.stream()
            .sorted(Comparator.comparing(DailySummary::getEntryDate))
            .map(DailySummary::getCompletionPercentage)
            .filter(Objects::nonNull)
            .map(BigDecimal::doubleValue)
            .collect(Collectors.toList());

        double averageCompletion = mean(completionPercentages);
        double adherenceRate = calculateAdherenceRate(trackedDays, totalDays, averageCompletion);

        List<Integer> moodValues = moodSeries(moods);
        Double averageMood = moodValues.isEmpty() ? null : meanOfInts(moodValues);

        int[] streaks = calculateStreaks(summaries);

        return CompletionMetrics.builder()
            .totalDays(totalDays)
            .trackedDays(trackedDays)
            .missedDays(calculateMissedDays(startDate, endDate, summaries))
            .totalHabits(totalHabits)
            .averageCompletion(averageCompletion)
            .adherenceRate(adherenceRate)
            .averageMood(averageMood)
            .moodTrend(calculateMoodTrend(moodValues))
            .currentStreak(streaks[0])
            .longestStreak(streaks[1])
            .completionPercentages(completionPercentages)
            .moodValues(moodValues)
            .build();
    }

    /**
     * Adherence = (tracked days / total days) * (average completion / 100).
     * An untracked day contributes zero, so missed tracking lowers the rate as much as missed habits.
     *
     * @return adherence as a fraction 0..1
     */
    double calculateAdherenceRate(int trackedDays, long totalDays, double averageCompletion) {
        if (trackedDays == 0 || totalDays <= 0) {
            return 0.0;
        }
        return ((double) trackedDays / totalDays) * (averageCompletion / 100.0);
    }

    /**
     * Compare the mean of the second half of the mood series to the first half.
     * With an odd count the extra value falls into the second half.
     *
     * @param moodValues mood scores ordered by date ascending
     * @return the trend
     */
    MoodTrend calculateMoodTrend(List<Integer> moodValues) {
        if (moodValues.size() < MIN_MOOD_VALUES_FOR_TREND) {
            return MoodTrend.STABLE;
        }

        int midPoint = moodValues.size() / 2;
        double firstHalf = meanOfInts(moodValues.subList(0, midPoint));
        double secondHalf = meanOfInts(moodValues.subList(midPoint, moodValues.size()));

        if (secondHalf > firstHalf + MOOD_TREND_THRESHOLD) {
            return MoodTrend.IMPROVED;
        } else if (secondHalf < firstHalf - MOOD_TREND_THRESHOLD) {
            return MoodTrend.DECLINED;
        }
        return MoodTrend.STABLE;
    }

    /**
     * Walk the summaries from the most recent date backwards.
     * A day qualifies at {@value #STREAK_COMPLETION_THRESHOLD}% or more; a day below it, or a calendar date
     * with no summary at all, ends the run.
     *
     * @return {@code [currentStreak, longestStreak]} where the current streak is the run that starts at the
     *         most recent tracked day
     */
    int[] calculateStreaks(List<DailySummary> summaries) {
        List<DailySummary> newestFirst = summaries.stream()
            .sorted(Comparator.comparing(DailySummary::getEntryDate).reversed())
            .toList();

        int currentStreak = 0;
        int longestStreak = 0;
        int run = 0;
        boolean inLeadingRun = true;
        LocalDate previousDate = null;

        for (DailySummary summary : newestFirst) {
            LocalDate date = summary.getEntryDate();
            if (previousDate != null && !date.equals(previousDate.minusDays(1))) {
                run = 0;
                inLeadingRun = false;
            }

            if (qualifiesForStreak(summary)) {
                run++;
                longestStreak = Math.max(longestStreak, run);
                if (inLeadingRun) {
                    currentStreak = run;
                }
            } else {
                run = 0;
                inLeadingRun = false;
            }
            previousDate = date;
        }

        return new int[]{currentStreak, longestStreak};
    }

    /**
     * Calendar days in {@code [startDate, endDate]} without a daily summary.
     */
    long calculateMissedDays(LocalDate startDate, LocalDate endDate, List<DailySummary> summaries) {
        if (endDate.isBefore(startDate)) {
            return 0;
        }
        long trackedInRange = summaries.stream()
            .map(DailySummary::getEntryDate)
            .filter(d -> !d.isBefore(startDate) && !d.isAfter(endDate))
            .distinct()
            .count();
        return ChronoUnit.DAYS.between(startDate, endDate) + 1 - trackedInRange;
    }

    /**
     * One mood value per date, ordered by date ascending. Entries without a score are ignored;
     * if a date occurs twice the later entry wins.
     */
    private List<Integer> moodSeries(List<DailyMoodEntry> moods) {
        Map<LocalDate, Integer> byDate = new TreeMap<>();
        for (DailyMoodEntry entry : moods) {
            if (entry.getMood() != null) {
                byDate.put(entry.getEntryDate(), entry.getMood());
            }
        }
        return new ArrayList<>(byDate.values());
    }

    private boolean qualifiesForStreak(DailySummary summary) {
        BigDecimal percentage = summary.getCompletionPercentage();
        return percentage != null && percentage.doubleValue() >= STREAK_COMPLETION_THRESHOLD;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double meanOfInts(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).average().orElse(0.0);
    }
}
