package net.javahippie.inflo.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Entity representing a habit tracked for a user, independent of any single period.
 *
 * Periods reference habits by {@link #habitName}, not by id, so a rename breaks the link.
 */
@Entity
@Table(name = "user_habits", indexes = {
    @Index(name = "idx_user_habits_user_name", columnList = "user_id, habit_name")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserHabit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "habit_name", nullable = false)
    private String habitName;

    @Convert(converter = HabitStatus.Converter.class)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private HabitStatus status = HabitStatus.ACTIVE;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
