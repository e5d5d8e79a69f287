package net.javahippie.inflo.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one auto-completion sweep over expired intervention periods.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SweepResult {

    private int foundCount;

    @Builder.Default
    private List<SweepItem> completed = new ArrayList<>();

    @Builder.Default
    private List<SweepItem> failed = new ArrayList<>();

    /**
     * Periods claimed by another scheduler instance and left alone.
     */
    @Builder.Default
    private List<SweepItem> skipped = new ArrayList<>();

    public int getCompletedCount() {
        return completed.size();
    }

    public int getFailedCount() {
        return failed.size();
    }

    public int getSkippedCount() {
        return skipped.size();
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class SweepItem {
        private UUID periodId;
        private String interventionName;
        private String error;

        public static SweepItem of(UUID periodId, String interventionName) {
            return new SweepItem(periodId, interventionName, null);
        }
    }
}
