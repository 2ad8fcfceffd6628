package tech.yump.ledger.retention;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tech.yump.ledger.audit.AuditHelper;
import tech.yump.ledger.config.LedgerProperties.RetentionProperties.SchedulerProperties;
import tech.yump.ledger.event.Outcome;

import java.util.List;
import java.util.Map;

/**
 * Runs due retention policies on the configured cron (daily at 03:00 by default).
 * Only registered when {@value SchedulerProperties#ENABLED_PROPERTY} is true.
 */
@Component
@ConditionalOnProperty(name = SchedulerProperties.ENABLED_PROPERTY, havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class RetentionJob {

    private final RetentionEngine retentionEngine;
    private final AuditHelper auditHelper;

    @Scheduled(cron = "${ledger.retention.scheduler.cron:" + SchedulerProperties.DEFAULT_CRON + "}")
    public void runDuePolicies() {
        log.info("Scheduled retention run starting");
        try {
            List<RetentionResult> results = retentionEngine.runDuePolicies();
            boolean allSucceeded = results.stream().allMatch(RetentionResult::success);
            auditHelper.logInternalEvent("retention", "scheduled_run", Outcome.of(allSucceeded), Map.of(
                    "results", results.size(),
                    "items_processed", results.stream().mapToInt(RetentionResult::itemsProcessed).sum()));
        } catch (RuntimeException e) {
            // Keep the schedule alive; the next trigger retries every policy that is still due.
            log.error("Scheduled retention run failed: {}", e.getMessage(), e);
            auditHelper.logInternalEvent("retention", "scheduled_run", Outcome.FAILURE, Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
