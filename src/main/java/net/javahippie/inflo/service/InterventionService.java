package net.javahippie.inflo.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.inflo.event.EventBus;
import net.javahippie.inflo.event.HandlerResult;
import net.javahippie.inflo.event.PeriodCompletedEvent;
import net.javahippie.inflo.exception.InterventionPeriodNotFoundException;
import net.javahippie.inflo.exception.InvalidPeriodStatusException;
import net.javahippie.inflo.exception.PeriodCompletionException;
import net.javahippie.inflo.model.dto.CompletionResult;
import net.javahippie.inflo.model.entity.CompletionSummary;
import net.javahippie.inflo.model.entity.InterventionPeriod;
import net.javahippie.inflo.model.entity.PeriodStatus;
import net.javahippie.inflo.repository.CompletionSummaryRepository;
import net.javahippie.inflo.repository.InterventionPeriodRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for the intervention period lifecycle.
 *
 * Completing a period is idempotent: the status write only succeeds for a period that is not completed yet,
 * and the {@value PeriodCompletedEvent#TOPIC} event is published exactly once, after that write.
 * The completion is not rolled back when a listener fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InterventionService {

    static final String DEFAULT_AUTO_COMPLETE_NOTES = "Auto-completed: period expired";

    private final InterventionPeriodRepository periodRepository;
    private final CompletionSummaryRepository completionSummaryRepository;
    private final EventBus eventBus;
    private final Clock clock;

    @Value("${inflo.intervention.allow-completion-from-inactive:true}")
    private boolean allowCompletionFromInactive;

    public CompletionResult complete(UUID periodId) {
        return complete(periodId, null, false);
    }

    public CompletionResult complete(UUID periodId, String notes) {
        return complete(periodId, notes, false);
    }

    /**
     * Complete an intervention period and notify the completion listeners.
     *
     * @param periodId the period ID
     * @param notes optional completion notes; blank means none
     * @param autoCompleted whether the scheduler triggered the completion
     * @return the completion result with one entry per listener
     * @throws InterventionPeriodNotFoundException if the period does not exist
     * @throws InvalidPeriodStatusException if strict completion is enabled and the period is not active
     * @throws PeriodCompletionException if the status write fails
     */
    public CompletionResult complete(UUID periodId, String notes, boolean autoCompleted) {
        InterventionPeriod period = periodRepository.findById(periodId)
            .orElseThrow(() -> new InterventionPeriodNotFoundException(periodId));

        if (period.isCompleted()) {
            log.info("Intervention period {} is already completed", periodId);
            return CompletionResult.alreadyCompleted(periodId);
        }

        if (!period.isActive()) {
            if (!allowCompletionFromInactive) {
                throw new InvalidPeriodStatusException(periodId, period.getStatus());
            }
            log.warn("Completing intervention period {} from status {}", periodId, period.getStatus().getValue());
        }

        String completionNotes;
        if (StringUtils.hasText(notes)) {
            completionNotes = notes;
        } else if (autoCompleted) {
            completionNotes = DEFAULT_AUTO_COMPLETE_NOTES;
        } else {
            completionNotes = null;
        }
        String storedNotes = completionNotes != null ? completionNotes : period.getNotes();
        LocalDateTime completedAt = LocalDateTime.now(clock);

        int updated;
        try {
            updated = periodRepository.markCompleted(periodId, completedAt, storedNotes);
        } catch (DataAccessException e) {
            log.error("Failed to update status of intervention period {}", periodId, e);
            throw new PeriodCompletionException("Failed to complete intervention period " + periodId, e);
        }

        if (updated == 0) {
            log.info("Intervention period {} was completed concurrently", periodId);
            return CompletionResult.alreadyCompleted(periodId);
        }

        log.info("Intervention period {} of user {} completed (auto: {})",
            periodId, period.getUserId(), autoCompleted);

        PeriodCompletedEvent event = PeriodCompletedEvent.builder()
            .periodId(periodId)
            .userId(period.getUserId())
            .interventionName(period.getInterventionName() != null ? period.getInterventionName() : "Unknown")
            .notes(completionNotes)
            .autoCompleted(autoCompleted)
            .completedAt(completedAt)
            .build();

        List<HandlerResult> results = eventBus.publish(PeriodCompletedEvent.TOPIC, event.toPayload());
        long failures = results.stream().filter(r -> !r.isSuccess()).count();
        if (failures > 0) {
            log.warn("{} of {} completion listeners failed for period {}", failures, results.size(), periodId);
        }

        return CompletionResult.completed(periodId, results);
    }

    /**
     * Get the user's current active period, if any.
     */
    public Optional<InterventionPeriod> getActivePeriod(UUID userId) {
        return periodRepository.findFirstByUserIdAndStatusOrderByCreatedAtDesc(userId, PeriodStatus.ACTIVE);
    }

    /**
     * Get all periods of a user, newest first.
     */
    public List<InterventionPeriod> getUserPeriods(UUID userId) {
        return periodRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * Get the latest completion summary generated for a period.
     */
    public Optional<CompletionSummary> getCompletionSummary(UUID periodId) {
        return completionSummaryRepository.findFirstByInterventionPeriodIdOrderByCreatedAtDesc(periodId);
    }
}
