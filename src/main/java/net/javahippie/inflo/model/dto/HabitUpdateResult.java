package net.javahippie.inflo.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of completing the habits selected for a period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HabitUpdateResult {

    private int updatedHabitsCount;
    private int totalHabits;
    private String message;

    /**
     * Habit names whose update failed; the others were still attempted.
     */
    @Builder.Default
    private List<String> failedHabits = new ArrayList<>();
}
