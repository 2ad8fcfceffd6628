package tech.yump.ledger.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.ledger.chain.HashChainer;
import tech.yump.ledger.core.Ledger;
import tech.yump.ledger.core.LedgerSettings;
import tech.yump.ledger.event.EventSanitizer;
import tech.yump.ledger.event.LedgerJson;
import tech.yump.ledger.retention.ConfiguredStorageLocationResolver;
import tech.yump.ledger.retention.RetentionEngine;
import tech.yump.ledger.retention.RetentionPolicyStore;
import tech.yump.ledger.retention.RetentionRunStore;
import tech.yump.ledger.retention.StorageLocation;
import tech.yump.ledger.retention.StorageLocationResolver;
import tech.yump.ledger.storage.FileSystemSegmentStore;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the compliance ledger and the retention engine from {@link LedgerProperties}.
 * <p>
 * On-disk JSON uses its own mapper from {@link LedgerJson} so that web-layer Jackson settings never
 * change what gets hashed.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LedgerConfiguration {

    private final LedgerProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HashChainer hashChainer() {
        return new HashChainer(LedgerJson.newObjectMapper());
    }

    @Bean
    public EventSanitizer eventSanitizer() {
        return new EventSanitizer(LedgerJson.newObjectMapper(), properties.redaction().maxValueLength());
    }

    @Bean
    public Ledger complianceLedger(HashChainer hashChainer, EventSanitizer eventSanitizer, Clock clock) {
        Path directory = properties.complianceDirectory();
        log.info("Opening compliance ledger at {} (enabled: {}, retention: {} years)",
                directory, properties.enabled(), properties.retentionYears());
        return Ledger.open(
                new LedgerSettings("compliance", properties.enabled(), properties.retentionYears()),
                new FileSystemSegmentStore(directory, properties.compliance().prefix(), LedgerJson.newObjectMapper(), clock),
                hashChainer,
                eventSanitizer,
                LedgerJson.newObjectMapper(),
                clock);
    }

    @Bean
    public RetentionPolicyStore retentionPolicyStore(Clock clock) {
        Path file = properties.retentionConfigDirectory().resolve(RetentionPolicyStore.FILE_NAME);
        RetentionPolicyStore store = new RetentionPolicyStore(file, LedgerJson.newObjectMapper(), clock);
        store.load();
        return store;
    }

    @Bean
    public RetentionRunStore retentionRunStore() {
        Path file = properties.retentionConfigDirectory().resolve(RetentionRunStore.FILE_NAME);
        return new RetentionRunStore(file, LedgerJson.newObjectMapper());
    }

    @Bean
    public StorageLocationResolver storageLocationResolver() {
        Map<String, StorageLocation> configured = new LinkedHashMap<>();
        properties.retention().locations().forEach((dataType, location) -> configured.put(dataType,
                new StorageLocation(Path.of(location.path()).toAbsolutePath().normalize(), location.classification())));
        return new ConfiguredStorageLocationResolver(properties.basePath(), configured);
    }

    @Bean
    public RetentionEngine retentionEngine(RetentionPolicyStore retentionPolicyStore,
                                           RetentionRunStore retentionRunStore,
                                           StorageLocationResolver storageLocationResolver,
                                           Ledger complianceLedger,
                                           Clock clock) {
        return new RetentionEngine(retentionPolicyStore, retentionRunStore, storageLocationResolver,
                complianceLedger, properties.archiveDirectory(), clock);
    }
}
