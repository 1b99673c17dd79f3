package com.syncrecovery.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.syncrecovery.core.exception.InvalidRequestException;
import com.syncrecovery.core.model.ChangeEvent;
import com.syncrecovery.core.model.ChangeEventType;
import com.syncrecovery.core.model.EventFilter;
import com.syncrecovery.core.model.EventSeverity;
import com.syncrecovery.core.model.EventSource;
import com.syncrecovery.core.model.EventSort;
import com.syncrecovery.engine.changelog.ChangeEventStore;
import com.syncrecovery.engine.changelog.ChangeLogger;
import com.syncrecovery.engine.changelog.EventStatistics;
import com.syncrecovery.engine.changelog.ExportFormat;
import com.syncrecovery.engine.changelog.TimelineBucket;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * REST API for the change log.
 */
@RestController
@RequestMapping("/api/v1/events")
public class ChangeEventController {

    private final ChangeEventStore store;
    private final ChangeLogger changeLogger;

    public ChangeEventController(ChangeEventStore store, ChangeLogger changeLogger) {
        this.store = store;
        this.changeLogger = changeLogger;
    }

    /**
     * Query events, newest first unless a sort is given.
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<ChangeEvent>>> queryEvents(
            @RequestParam(required = false) Set<ChangeEventType> types,
            @RequestParam(required = false) Set<EventSeverity> severities,
            @RequestParam(required = false) Set<EventSource> sources,
            @RequestParam(required = false) Set<String> projectIds,
            @RequestParam(required = false) Set<String> changeIds,
            @RequestParam(required = false) Set<String> correlationIds,
            @RequestParam(required = false) Set<String> userIds,
            @RequestParam(required = false) Set<String> sessionIds,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) EventSort.Field sortBy,
            @RequestParam(required = false) EventSort.Direction direction) {

        EventFilter filter = new EventFilterRequest(types, severities, sources, projectIds, changeIds,
            correlationIds, userIds, sessionIds, from, to, offset, limit, sortBy, direction).toFilter();
        return ResponseEntity.ok(ApiResponse.ok(store.query(filter)));
    }

    @GetMapping("/{eventId}")
    public ResponseEntity<ApiResponse<ChangeEvent>> getEvent(@PathVariable String eventId) {
        return ResponseEntity.ok(ApiResponse.ok(store.getEvent(eventId)));
    }

    /**
     * Case-insensitive text search over event payloads.
     */
    @GetMapping("/search")
    public ResponseEntity<ApiResponse<List<ChangeEvent>>> search(
            @RequestParam("q") String text,
            @RequestParam(required = false) Set<ChangeEventType> types,
            @RequestParam(required = false) Integer limit) {

        EventFilter filter = new EventFilterRequest(types, null, null, null, null, null, null, null,
            null, null, null, limit, null, null).toFilter();
        return ResponseEntity.ok(ApiResponse.ok(store.search(text, filter)));
    }

    @GetMapping("/statistics")
    public ResponseEntity<ApiResponse<EventStatistics>> statistics(
            @RequestParam(required = false) Set<ChangeEventType> types,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        return ResponseEntity.ok(ApiResponse.ok(store.statistics(rangeFilter(types, from, to))));
    }

    /**
     * Hourly event counts.
     */
    @GetMapping("/timeline")
    public ResponseEntity<ApiResponse<List<TimelineBucket>>> timeline(
            @RequestParam(required = false) Set<ChangeEventType> types,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        return ResponseEntity.ok(ApiResponse.ok(store.timeline(rangeFilter(types, from, to))));
    }

    /**
     * Export matching events as a raw JSON, CSV or SQL document.
     */
    @GetMapping("/export")
    public ResponseEntity<String> export(
            @RequestParam(defaultValue = "JSON") String format,
            @RequestParam(required = false) Set<ChangeEventType> types,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        ExportFormat exportFormat = parseFormat(format);
        String body = store.export(rangeFilter(types, from, to), exportFormat);
        MediaType contentType = exportFormat == ExportFormat.JSON ? MediaType.APPLICATION_JSON : MediaType.TEXT_PLAIN;
        return ResponseEntity.ok()
            .contentType(contentType)
            .header("Content-Disposition",
                "attachment; filename=\"change-events." + exportFormat.name().toLowerCase(Locale.ROOT) + "\"")
            .body(body);
    }

    /**
     * Run retention cleanup now.
     */
    @PostMapping("/cleanup")
    public ResponseEntity<ApiResponse<Map<String, Object>>> cleanup() {
        int removed = store.cleanup();
        return ResponseEntity.ok(ApiResponse.ok(Map.of("removed", removed)));
    }

    /**
     * Log an event on behalf of a user or an external system.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<ChangeEvent>> logEvent(@RequestBody LogEventRequest request) {
        if (request.data() == null) {
            throw new InvalidRequestException("Event data is required");
        }
        String eventId = changeLogger.logEvent(
            request.type() != null ? request.type() : ChangeEventType.SYSTEM_EVENT,
            request.severity() != null ? request.severity() : EventSeverity.INFO,
            request.source() != null ? request.source() : EventSource.USER,
            request.data());

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.ok(store.getEvent(eventId)));
    }

    private static EventFilter rangeFilter(Set<ChangeEventType> types, Instant from, Instant to) {
        return new EventFilterRequest(types, null, null, null, null, null, null, null,
            from, to, null, null, null, null).toFilter();
    }

    private static ExportFormat parseFormat(String format) {
        try {
            return ExportFormat.valueOf(format.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unsupported export format: " + format);
        }
    }

    // ========== DTOs ==========

    public record LogEventRequest(
        ChangeEventType type,
        EventSeverity severity,
        EventSource source,
        JsonNode data
    ) {}
}
