package net.javahippie.inflo.service.listener;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.inflo.event.PeriodCompletedEvent;
import net.javahippie.inflo.exception.InterventionPeriodNotFoundException;
import net.javahippie.inflo.model.dto.HabitUpdateResult;
import net.javahippie.inflo.model.entity.HabitStatus;
import net.javahippie.inflo.model.entity.InterventionPeriod;
import net.javahippie.inflo.repository.InterventionPeriodRepository;
import net.javahippie.inflo.repository.UserHabitRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Marks the habits selected for a completed period as completed.
 *
 * Habits are matched by name against the user's active habits. The selected names are re-read from the
 * period at dispatch time, which makes the period row the single source of truth.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HabitCompletionListener {

    private final InterventionPeriodRepository periodRepository;
    private final UserHabitRepository userHabitRepository;

    /**
     * Handle a {@value PeriodCompletedEvent#TOPIC} event.
     * Each habit is updated independently; a failing update is logged and the rest are still attempted.
     *
     * @param payload the event payload
     * @return counts of updated and attempted habits
     */
    public HabitUpdateResult onPeriodCompleted(Map<String, Object> payload) {
        PeriodCompletedEvent event = PeriodCompletedEvent.fromPayload(payload);

        InterventionPeriod period = periodRepository.findById(event.getPeriodId())
            .orElseThrow(() -> new InterventionPeriodNotFoundException(event.getPeriodId()));

        List<String> selectedHabits = period.getSelectedHabits() != null ? period.getSelectedHabits() : List.of();
        if (selectedHabits.isEmpty()) {
            log.info("No selected habits for period {}, nothing to update", event.getPeriodId());
            return HabitUpdateResult.builder()
                .message("No habits to update")
                .build();
        }

        int updatedCount = 0;
        List<String> failedHabits = new ArrayList<>();

        for (String habitName : selectedHabits) {
            try {
                int updated = userHabitRepository.updateStatusByUserIdAndHabitName(
                    event.getUserId(), habitName, HabitStatus.ACTIVE, HabitStatus.COMPLETED);
                updatedCount += updated;
                log.debug("Habit '{}' of user {}: {} rows completed", habitName, event.getUserId(), updated);
            } catch (Exception e) {
                log.error("Failed to complete habit '{}' for period {}", habitName, event.getPeriodId(), e);
                failedHabits.add(habitName);
            }
        }

        log.info("Completed {} habits for period {} ({} selected, {} failed)",
            updatedCount, event.getPeriodId(), selectedHabits.size(), failedHabits.size());

        return HabitUpdateResult.builder()
            .updatedHabitsCount(updatedCount)
            .totalHabits(selectedHabits.size())
            .failedHabits(failedHabits)
            .message(String.format("Updated %d of %d habits", updatedCount, selectedHabits.size()))
            .build();
    }
}
