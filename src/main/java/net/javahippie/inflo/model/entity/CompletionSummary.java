package net.javahippie.inflo.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Analytics snapshot written once when an intervention period completes.
 * Never updated afterwards.
 */
@Entity
@Table(name = "completion_summaries", indexes = {
    @Index(name = "idx_completion_summaries_period_id", columnList = "intervention_period_id"),
    @Index(name = "idx_completion_summaries_user_id", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompletionSummary {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "intervention_period_id", nullable = false)
    private UUID interventionPeriodId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    /**
     * Adherence as a percentage (0-100).
     */
    @Column(name = "adherence_rate", nullable = false, precision = 5, scale = 2)
    private BigDecimal adherenceRate;

    @Column(name = "average_mood", precision = 3, scale = 2)
    private BigDecimal averageMood;

    @Convert(converter = MoodTrend.Converter.class)
    @Column(name = "mood_trend", length = 20)
    private MoodTrend moodTrend;

    /**
     * Day counts, streaks and the raw series the rates were computed from.
     * Example: {"total_days": 30, "tracked_days": 24, "current_streak": 5, ...}
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "summary_json", columnDefinition = "jsonb")
    private Map<String, Object> summaryJson;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
