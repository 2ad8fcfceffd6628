package tech.yump.ledger.retention;

import lombok.extern.slf4j.Slf4j;
import tech.yump.ledger.core.Ledger;
import tech.yump.ledger.event.Actor;
import tech.yump.ledger.event.AppendOptions;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.Outcome;
import tech.yump.ledger.event.Resource;
import tech.yump.ledger.storage.SecureFiles;
import tech.yump.ledger.storage.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies retention policies to their storage locations.
 * <p>
 * A policy run scans every data type of the policy, disposes of the expired items, appends one
 * {@code retention} event to the ledger and only then records the run. A crash before the ledger event
 * leaves the policy due again, so disposal is idempotent: deleting or re-archiving an item twice is harmless.
 */
@Slf4j
public class RetentionEngine {

    static final String ANONYMIZE_UNSUPPORTED = "anonymize is not supported; expired items were left in place";

    private final RetentionPolicyStore policyStore;
    private final RetentionRunStore runStore;
    private final StorageLocationResolver locationResolver;
    private final ExpiredItemScanner scanner;
    private final Ledger ledger;
    private final Path archiveRoot;
    private final Clock clock;

    public RetentionEngine(RetentionPolicyStore policyStore,
                           RetentionRunStore runStore,
                           StorageLocationResolver locationResolver,
                           Ledger ledger,
                           Path archiveRoot,
                           Clock clock) {
        this(policyStore, runStore, locationResolver, new ExpiredItemScanner(), ledger, archiveRoot, clock);
    }

    RetentionEngine(RetentionPolicyStore policyStore,
                    RetentionRunStore runStore,
                    StorageLocationResolver locationResolver,
                    ExpiredItemScanner scanner,
                    Ledger ledger,
                    Path archiveRoot,
                    Clock clock) {
        this.policyStore = policyStore;
        this.runStore = runStore;
        this.locationResolver = locationResolver;
        this.scanner = scanner;
        this.ledger = ledger;
        this.archiveRoot = archiveRoot.toAbsolutePath().normalize();
        this.clock = clock;
    }

    /**
     * Runs every policy whose schedule says it is due.
     */
    public synchronized List<RetentionResult> runDuePolicies() {
        Map<String, Instant> lastRuns = runStore.lastRuns();
        Instant now = clock.instant();
        List<RetentionResult> results = new ArrayList<>();
        int executed = 0;
        for (RetentionPolicy policy : policyStore.list()) {
            if (!RetentionScheduler.isDue(policy.schedule(), lastRuns.get(policy.id()), now)) {
                log.debug("Retention policy '{}' is not due", policy.id());
                continue;
            }
            results.addAll(execute(policy));
            executed++;
        }
        log.info("Retention run finished: {} policies executed, {} items processed, {} bytes freed",
                executed, results.stream().mapToInt(RetentionResult::itemsProcessed).sum(),
                results.stream().mapToLong(RetentionResult::bytesFreed).sum());
        return results;
    }

    /**
     * Runs one policy regardless of its schedule.
     *
     * @return empty when no policy has this id.
     */
    public synchronized Optional<List<RetentionResult>> forceRunPolicy(String policyId) {
        Optional<RetentionPolicy> policy = policyStore.get(policyId);
        if (policy.isEmpty()) {
            return Optional.empty();
        }
        log.info("Forcing retention policy '{}'", policyId);
        return Optional.of(execute(policy.get()));
    }

    /**
     * Policy counts, last runs and the policies ordered by how soon they are due. A policy is active when at
     * least one of its data types resolves to an existing location within the policy's classifications.
     */
    public RetentionStatus getStatus() {
        List<RetentionPolicy> policies = policyStore.list();
        Map<String, Instant> lastRuns = runStore.lastRuns();
        Instant now = clock.instant();
        List<RetentionStatus.NextDue> nextDue = policies.stream()
                .map(p -> new RetentionStatus.NextDue(p.id(), p.name(),
                        RetentionScheduler.dueInDays(p.schedule(), lastRuns.get(p.id()), now)))
                .sorted(Comparator.comparingDouble(RetentionStatus.NextDue::dueInDays)
                        .thenComparing(RetentionStatus.NextDue::policyId))
                .toList();
        int active = (int) policies.stream().filter(this::hasGovernedLocation).count();
        return new RetentionStatus(policies.size(), active, lastRuns, nextDue);
    }

    private boolean hasGovernedLocation(RetentionPolicy policy) {
        return policy.dataTypes().stream()
                .map(locationResolver::resolve)
                .flatMap(Optional::stream)
                .anyMatch(location -> Files.exists(location.path()) && policy.governs(location.classification()));
    }

    private List<RetentionResult> execute(RetentionPolicy policy) {
        Instant executedAt = clock.instant();
        Instant cutoff = executedAt.minus(Duration.ofDays(policy.retentionDays()));
        List<RetentionResult> results = new ArrayList<>();
        for (String dataType : policy.dataTypes()) {
            results.add(apply(policy, dataType, cutoff, executedAt));
        }

        try {
            recordInLedger(policy, results, cutoff);
        } catch (StorageException e) {
            log.error("Retention policy '{}' ran but could not be recorded in the ledger; it stays due", policy.id(), e);
            return results.stream()
                    .map(r -> r.failed(joinErrors(r.error(), "ledger append failed: " + e.getMessage())))
                    .toList();
        }

        try {
            runStore.recordRun(policy.id(), executedAt);
        } catch (StorageException e) {
            log.error("Last run of retention policy '{}' could not be saved; it will run again next time", policy.id(), e);
        }
        return results;
    }

    private RetentionResult apply(RetentionPolicy policy, String dataType, Instant cutoff, Instant executedAt) {
        RetentionResult.RetentionResultBuilder result = RetentionResult.builder()
                .policyId(policy.id())
                .policyName(policy.name())
                .executedAt(executedAt)
                .dataType(dataType)
                .action(policy.action())
                .success(true);

        Optional<StorageLocation> location = locationResolver.resolve(dataType);
        if (location.isEmpty() || !Files.exists(location.get().path())) {
            log.debug("No storage for data type '{}' of policy '{}'", dataType, policy.id());
            return result.build();
        }
        if (!policy.governs(location.get().classification())) {
            log.debug("Location of '{}' is classified {}, outside policy '{}'", dataType, location.get().classification(), policy.id());
            return result.build();
        }

        List<ExpiredItem> expired;
        try {
            expired = scanner.scan(location.get().path(), dataType, cutoff);
        } catch (IOException e) {
            log.warn("Could not scan {} for policy '{}': {}", location.get().path(), policy.id(), e.getMessage());
            return result.success(false).error("scan failed: " + e.getMessage()).build();
        }

        if (policy.action() == RetentionAction.ANONYMIZE) {
            if (!expired.isEmpty()) {
                log.warn("Policy '{}' found {} expired {} item(s) but anonymize is not supported; left in place",
                        policy.id(), expired.size(), dataType);
            }
            return result.success(false).error(ANONYMIZE_UNSUPPORTED).build();
        }

        int processed = 0;
        long freed = 0;
        LocalDate today = LocalDate.ofInstant(executedAt, ZoneOffset.UTC);
        for (ExpiredItem item : expired) {
            try {
                if (policy.action() == RetentionAction.ARCHIVE) {
                    archive(item.path(), dataType, today);
                }
                if (!Files.deleteIfExists(item.path())) {
                    log.debug("{} vanished before it could be disposed of", item.path());
                    continue;
                }
                processed++;
                freed += item.size();
            } catch (NoSuchFileException e) {
                log.debug("{} vanished before it could be disposed of", item.path());
            } catch (IOException e) {
                log.warn("Could not {} {}: {}", policy.action().value(), item.path(), e.getMessage());
            }
        }
        if (processed > 0) {
            log.info("Policy '{}' {}d {} {} item(s), {} bytes", policy.id(), policy.action().value(), processed, dataType, freed);
        }
        return result.itemsProcessed(processed).bytesFreed(freed).build();
    }

    private void archive(Path item, String dataType, LocalDate today) throws IOException {
        Path target = archiveRoot.resolve(dataType).resolve(today.toString()).resolve(item.getFileName().toString());
        SecureFiles.createDirectories(target.getParent());
        Files.copy(item, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
    }

    private void recordInLedger(RetentionPolicy policy, List<RetentionResult> results, Instant cutoff) {
        int items = results.stream().mapToInt(RetentionResult::itemsProcessed).sum();
        long bytes = results.stream().mapToLong(RetentionResult::bytesFreed).sum();
        List<String> failed = results.stream().filter(r -> !r.success()).map(RetentionResult::dataType).toList();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("policy_id", policy.id());
        details.put("policy_name", policy.name());
        details.put("action", policy.action().value());
        details.put("data_types", policy.dataTypes());
        details.put("items_processed", items);
        details.put("bytes_freed", bytes);
        details.put("cutoff", cutoff.toString());
        if (!failed.isEmpty()) {
            details.put("failed_data_types", failed);
        }

        String eventType = policy.action() == RetentionAction.ANONYMIZE ? "retention_cleanup" : "retention_" + policy.action().value();
        ledger.append(EventCategory.RETENTION, eventType, Actor.system(), Outcome.of(failed.isEmpty()),
                AppendOptions.builder()
                        .resource(Resource.of("retention_policy", policy.id()))
                        .details(details)
                        .build());
    }

    private static String joinErrors(String existing, String added) {
        return existing == null ? added : existing + "; " + added;
    }
}
