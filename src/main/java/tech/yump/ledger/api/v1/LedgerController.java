package tech.yump.ledger.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.ledger.api.ApiError;
import tech.yump.ledger.audit.AuditHelper;
import tech.yump.ledger.core.Ledger;
import tech.yump.ledger.core.LedgerQuery;
import tech.yump.ledger.core.LedgerStats;
import tech.yump.ledger.event.Actor;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.LedgerEvent;
import tech.yump.ledger.event.Outcome;
import tech.yump.ledger.verify.IntegrityReport;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/ledger")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Compliance Ledger", description = "Append, query and verify the hash-chained compliance ledger")
public class LedgerController {

    static final int MAX_LIMIT = 1000;

    private final Ledger complianceLedger;
    private final AuditHelper auditHelper;

    @PostMapping(value = "/events", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Append event",
            description = "Sanitizes the event, links it to the current chain tip and appends it to the current monthly segment."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Event appended; the stored event is returned.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = LedgerEvent.class))),
            @ApiResponse(responseCode = "400", description = "Missing or invalid fields.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid X-Ledger-Token.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "403", description = "Token lacks LEDGER_WRITE.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "500", description = "The segment could not be written.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<LedgerEvent> appendEvent(@Valid @RequestBody AppendEventRequest body, HttpServletRequest request) {
        Actor actor = body.actor() != null ? body.actor() : CallerActors.current(request);
        LedgerEvent event = complianceLedger.append(body.category(), body.eventType(), actor, body.outcome(), body.toOptions());
        log.info("Appended {} event '{}' as {}", event.category().value(), event.id(), event.eventType());

        auditHelper.logHttpEvent("ledger", "append", Outcome.SUCCESS, HttpStatus.CREATED.value(), null,
                Map.of("event_id", event.id(), "category", event.category().value()));
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    @GetMapping("/events")
    @Operation(
            summary = "Query events",
            description = "Returns matching events, newest first. Time bounds are inclusive ISO-8601 instants."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Matching events, newest first."),
            @ApiResponse(responseCode = "400", description = "Invalid category, time range or limit.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid X-Ledger-Token.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "403", description = "Token lacks LEDGER_READ.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public List<LedgerEvent> queryEvents(
            @Parameter(description = "Event category", example = "consent")
            @RequestParam(required = false) String category,
            @Parameter(description = "Earliest timestamp (inclusive)", example = "2024-01-01T00:00:00Z")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @Parameter(description = "Latest timestamp (inclusive)", example = "2024-12-31T23:59:59Z")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @Parameter(description = "Maximum number of events, 1 to " + MAX_LIMIT)
            @RequestParam(defaultValue = "" + LedgerQuery.DEFAULT_LIMIT) int limit) {

        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        LedgerQuery query = LedgerQuery.builder()
                .category(category == null ? null : EventCategory.fromValue(category))
                .from(from)
                .to(to)
                .limit(limit)
                .build();
        List<LedgerEvent> events = complianceLedger.read(query);

        Map<String, Object> auditData = new LinkedHashMap<>();
        auditData.put("returned", events.size());
        if (category != null) {
            auditData.put("category", category);
        }
        auditHelper.logHttpEvent("ledger", "query", Outcome.SUCCESS, HttpStatus.OK.value(), null, auditData);
        return events;
    }

    @GetMapping("/verify")
    @Operation(
            summary = "Verify integrity",
            description = "Recomputes every hash from the first segment on. A broken chain is reported in the body, not as an error status."
    )
    @ApiResponse(responseCode = "200", description = "Integrity report.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = IntegrityReport.class)))
    public IntegrityReport verify() {
        IntegrityReport report = complianceLedger.verifyIntegrity();
        if (!report.valid()) {
            log.warn("Ledger integrity check failed: {} of {} events valid, first invalid event {}",
                    report.validEvents(), report.totalEvents(), report.firstInvalidEventId());
        }
        auditHelper.logHttpEvent("ledger", "verify", Outcome.of(report.valid()), HttpStatus.OK.value(),
                report.valid() ? null : "ledger integrity check failed",
                Map.of("total_events", report.totalEvents(), "valid_events", report.validEvents()));
        return report;
    }

    @GetMapping("/stats")
    @Operation(summary = "Ledger statistics", description = "Segment count and event counts per category.")
    @ApiResponse(responseCode = "200", description = "Statistics.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = LedgerStats.class)))
    public LedgerStats stats() {
        LedgerStats stats = complianceLedger.stats();
        auditHelper.logHttpEvent("ledger", "stats", Outcome.SUCCESS, HttpStatus.OK.value(), null, null);
        return stats;
    }
}
