package net.javahippie.inflo.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Entity representing a user's enrollment in one intervention program.
 * Created when a user starts a program; completed only through the completion pipeline.
 *
 * Invariant: {@code actualEndDate} is set if and only if {@code status == COMPLETED}.
 */
@Entity
@Table(name = "intervention_periods", indexes = {
    @Index(name = "idx_intervention_periods_user_id", columnList = "user_id"),
    @Index(name = "idx_intervention_periods_status", columnList = "status, planned_end_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InterventionPeriod {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "intervention_name", nullable = false)
    private String interventionName;

    /**
     * Names of the habits tracked during this period, in selection order.
     * Matched against {@link UserHabit#getHabitName()} by name.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "selected_habits", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> selectedHabits = new ArrayList<>();

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "planned_end_date")
    private LocalDate plannedEndDate;

    @Column(name = "actual_end_date")
    private LocalDateTime actualEndDate;

    @Convert(converter = PeriodStatus.Converter.class)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PeriodStatus status = PeriodStatus.ACTIVE;

    @Column(columnDefinition = "TEXT")
    private String notes;

    /**
     * Scheduler instance currently auto-completing this period, if any.
     */
    @Column(name = "claimed_by", length = 100)
    private String claimedBy;

    @Column(name = "claimed_at")
    private LocalDateTime claimedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isCompleted() {
        return status == PeriodStatus.COMPLETED;
    }

    public boolean isActive() {
        return status == PeriodStatus.ACTIVE;
    }
}
