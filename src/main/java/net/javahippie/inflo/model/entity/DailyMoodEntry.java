package net.javahippie.inflo.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Entity representing a user's mood score for one calendar date (1-5 scale).
 */
@Entity
@Table(name = "daily_moods",
       uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "entry_date"}),
       indexes = @Index(name = "idx_daily_moods_period_id", columnList = "intervention_period_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyMoodEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    private Integer mood;

    @Column(name = "intervention_period_id")
    private UUID interventionPeriodId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
