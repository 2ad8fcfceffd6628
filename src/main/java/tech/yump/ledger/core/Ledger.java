package tech.yump.ledger.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.ledger.chain.HashChainer;
import tech.yump.ledger.event.Actor;
import tech.yump.ledger.event.AppendOptions;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.EventSanitizer;
import tech.yump.ledger.event.LedgerEvent;
import tech.yump.ledger.event.Outcome;
import tech.yump.ledger.event.RetentionPeriod;
import tech.yump.ledger.storage.SegmentLine;
import tech.yump.ledger.storage.SegmentLines;
import tech.yump.ledger.storage.SegmentOrder;
import tech.yump.ledger.storage.SegmentStore;
import tech.yump.ledger.storage.StorageException;
import tech.yump.ledger.verify.IntegrityReport;
import tech.yump.ledger.verify.IntegrityVerifier;

import java.nio.file.Path;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only, hash-chained event log over a {@link SegmentStore}.
 * <p>
 * Each appended event carries the hash of the event appended before it, forming one chain across all
 * monthly segments. The hash of the latest event (the tip) is kept in memory; {@link #initialize()}
 * recovers it from disk and must run before the first append. One writer per store directory.
 */
@Slf4j
public class Ledger {

    private final LedgerSettings settings;
    private final SegmentStore store;
    private final HashChainer chainer;
    private final EventSanitizer sanitizer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final IntegrityVerifier verifier;

    private String tipHash = HashChainer.GENESIS_HASH;
    private boolean initialized;

    public Ledger(LedgerSettings settings,
                  SegmentStore store,
                  HashChainer chainer,
                  EventSanitizer sanitizer,
                  ObjectMapper objectMapper,
                  Clock clock) {
        this.settings = settings;
        this.store = store;
        this.chainer = chainer;
        this.sanitizer = sanitizer;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.verifier = new IntegrityVerifier(store, chainer, clock);
    }

    /**
     * Creates and initializes a ledger.
     */
    public static Ledger open(LedgerSettings settings,
                              SegmentStore store,
                              HashChainer chainer,
                              EventSanitizer sanitizer,
                              ObjectMapper objectMapper,
                              Clock clock) {
        Ledger ledger = new Ledger(settings, store, chainer, sanitizer, objectMapper, clock);
        ledger.initialize();
        return ledger;
    }

    /**
     * Recovers the tip hash: the hash of the last readable event of the current segment or, when the current
     * segment is missing or empty, of the newest earlier segment. Falls back to the genesis hash for an empty
     * ledger. Calling it again re-reads the disk.
     */
    public synchronized void initialize() {
        if (!settings.enabled()) {
            log.info("Ledger '{}' is disabled; events will not be persisted.", settings.name());
            tipHash = HashChainer.GENESIS_HASH;
            initialized = true;
            return;
        }
        tipHash = recoverTip();
        initialized = true;
        log.info("Ledger '{}' initialized at {} with tip {}", settings.name(), store.directory(), abbreviate(tipHash));
    }

    private String recoverTip() {
        Path current = store.currentSegmentPath();
        String currentName = current.getFileName().toString();

        List<Path> candidates = new ArrayList<>();
        candidates.add(current);
        for (Path segment : store.listSegments(SegmentOrder.NEWEST_FIRST)) {
            // Segments named after a later month than the clock's are not part of the chain we extend.
            if (segment.getFileName().toString().compareTo(currentName) < 0) {
                candidates.add(segment);
            }
        }

        for (Path segment : candidates) {
            SegmentLines content = store.readLines(segment);
            List<SegmentLine> lines = content.lines();
            for (int i = lines.size() - 1; i >= 0; i--) {
                JsonNode hash = lines.get(i).node().get("hash");
                if (hash != null && hash.isTextual() && StringUtils.hasText(hash.asText())) {
                    log.debug("Recovered tip from {} line {}", segment, lines.get(i).number());
                    return hash.asText();
                }
            }
        }
        return HashChainer.GENESIS_HASH;
    }

    public LedgerEvent append(EventCategory category, String eventType, Actor actor, Outcome outcome) {
        return append(category, eventType, actor, outcome, AppendOptions.none());
    }

    /**
     * Builds, hashes and durably appends one event.
     * <p>
     * Sensitive details and the actor IP are sanitized before hashing. The returned event is on disk
     * when this method returns, and the tip only moves once the write has succeeded.
     *
     * @throws IllegalStateException if the ledger has not been initialized.
     * @throws StorageException      if the segment cannot be written. The tip is left unchanged.
     */
    public synchronized LedgerEvent append(EventCategory category,
                                           String eventType,
                                           Actor actor,
                                           Outcome outcome,
                                           AppendOptions options) throws StorageException {
        if (!initialized) {
            throw new IllegalStateException("Ledger '" + settings.name() + "' has not been initialized");
        }
        if (category == null || outcome == null) {
            throw new IllegalArgumentException("Event category and outcome are required");
        }
        if (!StringUtils.hasText(eventType)) {
            throw new IllegalArgumentException("Event type cannot be null or empty");
        }
        AppendOptions opts = options == null ? AppendOptions.none() : options;
        RetentionPeriod retention = opts.retention() != null
                ? opts.retention()
                : RetentionPeriod.ofYears(settings.retentionYears());

        LedgerEvent unsigned = LedgerEvent.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                .category(category)
                .eventType(eventType)
                .actor(sanitizer.sanitizeActor(actor))
                .resource(opts.resource())
                .details(sanitizer.sanitizeDetails(opts.details()))
                .legalBasis(opts.legalBasis())
                .dataCategories(opts.dataCategories())
                .retentionDays(retention)
                .outcome(outcome)
                .failureReason(sanitizer.sanitizeText(opts.failureReason()))
                .build();

        String previousHash = tipHash;
        LedgerEvent event = unsigned.toBuilder()
                .previousHash(previousHash)
                .hash(chainer.compute(unsigned, previousHash))
                .build();
        String line = serialize(event);

        if (!settings.enabled()) {
            return event;
        }
        store.append(store.currentSegmentPath(), line);
        tipHash = event.hash();
        log.debug("Ledger '{}' appended {} {}/{} ({})", settings.name(), event.id(), category.value(), eventType, abbreviate(event.hash()));
        return event;
    }

    /**
     * Events matching the query, most recent first: segments newest to oldest, lines within a segment
     * last to first. Unparsable lines are skipped.
     */
    public List<LedgerEvent> read(LedgerQuery query) {
        LedgerQuery q = query == null ? LedgerQuery.builder().build() : query;
        List<LedgerEvent> results = new ArrayList<>();
        if (!settings.enabled()) {
            return results;
        }
        for (Path segment : store.listSegments(SegmentOrder.NEWEST_FIRST)) {
            List<SegmentLine> lines = store.readLines(segment).lines();
            for (int i = lines.size() - 1; i >= 0; i--) {
                LedgerEvent event = toEvent(lines.get(i));
                if (event != null && q.matches(event)) {
                    results.add(event);
                    if (results.size() >= q.limit()) {
                        return results;
                    }
                }
            }
        }
        return results;
    }

    public IntegrityReport verifyIntegrity() {
        if (!settings.enabled()) {
            return IntegrityReport.empty(clock.instant());
        }
        return verifier.verify();
    }

    public LedgerStats stats() {
        LedgerStats.LedgerStatsBuilder stats = LedgerStats.builder()
                .enabled(settings.enabled())
                .retentionYears(settings.retentionYears())
                .directory(store.directory().toString());
        if (!settings.enabled()) {
            return stats.build();
        }
        List<Path> segments = store.listSegments(SegmentOrder.OLDEST_FIRST);
        Map<String, Integer> byCategory = new HashMap<>();
        int total = 0;
        for (Path segment : segments) {
            for (SegmentLine line : store.readLines(segment).lines()) {
                total++;
                JsonNode category = line.node().get("category");
                String key = category != null && category.isTextual() ? category.asText() : "unknown";
                byCategory.merge(key, 1, Integer::sum);
            }
        }
        return stats.segmentCount(segments.size())
                .totalEvents(total)
                .eventsByCategory(byCategory)
                .build();
    }

    public synchronized String tipHash() {
        return tipHash;
    }

    public boolean isEnabled() {
        return settings.enabled();
    }

    public String name() {
        return settings.name();
    }

    public Path directory() {
        return store.directory();
    }

    private String serialize(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event cannot be serialized: " + e.getMessage(), e);
        }
    }

    private LedgerEvent toEvent(SegmentLine line) {
        try {
            return objectMapper.treeToValue(line.node(), LedgerEvent.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Skipping line {} that is not a ledger event: {}", line.number(), e.getMessage());
            return null;
        }
    }

    private static String abbreviate(String hash) {
        return hash == null || hash.length() <= 12 ? hash : hash.substring(0, 12) + "...";
    }
}
