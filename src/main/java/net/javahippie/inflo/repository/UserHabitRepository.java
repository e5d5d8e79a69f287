package net.javahippie.inflo.repository;

import net.javahippie.inflo.model.entity.HabitStatus;
import net.javahippie.inflo.model.entity.UserHabit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Repository for UserHabit entities.
 */
@Repository
public interface UserHabitRepository extends JpaRepository<UserHabit, UUID> {

    /**
     * Find all habits of a user with the given name.
     *
     * @param userId the user ID
     * @param habitName the habit name
     * @return list of habits
     */
    List<UserHabit> findByUserIdAndHabitName(UUID userId, String habitName);

    /**
     * Move a user's habits with the given name from one status to another.
     * Runs in its own transaction so a failure affects only this habit.
     *
     * @param userId the user ID
     * @param habitName the habit name to match
     * @param fromStatus only rows currently in this status are changed
     * @param toStatus the new status
     * @return number of habits updated
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserHabit h SET h.status = :toStatus, h.updatedAt = LOCAL DATETIME " +
           "WHERE h.userId = :userId AND h.habitName = :habitName AND h.status = :fromStatus")
    int updateStatusByUserIdAndHabitName(@Param("userId") UUID userId,
                                         @Param("habitName") String habitName,
                                         @Param("fromStatus") HabitStatus fromStatus,
                                         @Param("toStatus") HabitStatus toStatus);
}
