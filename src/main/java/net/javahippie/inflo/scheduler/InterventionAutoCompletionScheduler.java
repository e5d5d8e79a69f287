package net.javahippie.inflo.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.inflo.model.dto.CompletionResult;
import net.javahippie.inflo.model.dto.SweepResult;
import net.javahippie.inflo.model.entity.InterventionPeriod;
import net.javahippie.inflo.model.entity.PeriodStatus;
import net.javahippie.inflo.repository.InterventionPeriodRepository;
import net.javahippie.inflo.service.InterventionService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Scheduled task to complete intervention periods whose planned end date has passed.
 * Each period is claimed before completion so that concurrent instances do not process it twice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InterventionAutoCompletionScheduler {

    private final InterventionPeriodRepository periodRepository;
    private final InterventionService interventionService;
    private final Clock clock;

    @Value("${inflo.scheduler.instance-id:}")
    private String instanceId;

    @Value("${inflo.scheduler.auto-complete.claim-ttl-minutes:30}")
    private long claimTtlMinutes;

    /**
     * Sweep expired periods.
     * Runs daily at 2 AM server time unless configured otherwise.
     */
    @Scheduled(cron = "${inflo.scheduler.auto-complete.cron:0 0 2 * * *}")
    public void autoCompleteExpiredPeriods() {
        log.info("Starting auto-completion of expired intervention periods");
        long startTime = System.currentTimeMillis();

        SweepResult result = sweep();

        long duration = System.currentTimeMillis() - startTime;
        log.info("Auto-completion finished in {}ms. Found: {}, Completed: {}, Failed: {}, Skipped: {}",
            duration, result.getFoundCount(), result.getCompletedCount(),
            result.getFailedCount(), result.getSkippedCount());
    }

    /**
     * Complete every active period whose planned end date is today or earlier.
     * A failure on one period is recorded and the sweep moves on.
     *
     * @return per-period outcome of the sweep
     */
    public SweepResult sweep() {
        LocalDate today = LocalDate.now(clock);
        List<InterventionPeriod> expired = periodRepository
            .findByStatusAndPlannedEndDateLessThanEqualOrderByPlannedEndDateAsc(PeriodStatus.ACTIVE, today);
        log.info("Found {} expired intervention periods", expired.size());

        SweepResult result = SweepResult.builder()
            .foundCount(expired.size())
            .build();
        String owner = resolveInstanceId();

        for (InterventionPeriod period : expired) {
            SweepResult.SweepItem item = SweepResult.SweepItem.of(period.getId(), period.getInterventionName());
            try {
                LocalDateTime now = LocalDateTime.now(clock);
                int claimed = periodRepository.claimForAutoCompletion(
                    period.getId(), owner, now, now.minusMinutes(claimTtlMinutes));
                if (claimed == 0) {
                    log.debug("Period {} is claimed by another instance, skipping", period.getId());
                    result.getSkipped().add(item);
                    continue;
                }

                CompletionResult completion = interventionService.complete(period.getId(), null, true);
                if (completion.hasListenerFailures()) {
                    log.warn("Period {} auto-completed with listener failures", period.getId());
                }
                result.getCompleted().add(item);
            } catch (Exception e) {
                log.error("Failed to auto-complete intervention period {}", period.getId(), e);
                item.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                result.getFailed().add(item);
            }
        }

        return result;
    }

    private String resolveInstanceId() {
        if (!StringUtils.hasText(instanceId)) {
            instanceId = UUID.randomUUID().toString();
            log.info("No scheduler instance id configured, using {}", instanceId);
        }
        return instanceId;
    }
}
