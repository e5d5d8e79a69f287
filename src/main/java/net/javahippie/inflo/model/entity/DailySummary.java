package net.javahippie.inflo.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Entity representing one user's habit completion for one calendar date.
 */
@Entity
@Table(name = "daily_summaries",
       uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "entry_date"}),
       indexes = @Index(name = "idx_daily_summaries_period_id", columnList = "intervention_period_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailySummary {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column(name = "total_habits")
    @Builder.Default
    private Integer totalHabits = 0;

    @Column(name = "completed_habits")
    @Builder.Default
    private Integer completedHabits = 0;

    /**
     * Share of the day's habits completed, 0-100.
     */
    @Column(name = "completion_percentage", precision = 5, scale = 2)
    private BigDecimal completionPercentage;

    /**
     * Older rows predate period linking and have no value here.
     */
    @Column(name = "intervention_period_id")
    private UUID interventionPeriodId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
