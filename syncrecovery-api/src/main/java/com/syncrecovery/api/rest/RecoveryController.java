package com.syncrecovery.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.syncrecovery.core.exception.InvalidRequestException;
import com.syncrecovery.core.model.BackupFilter;
import com.syncrecovery.core.model.BackupInfo;
import com.syncrecovery.core.model.BackupType;
import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.RollbackPoint;
import com.syncrecovery.core.model.SyncDirection;
import com.syncrecovery.core.model.SyncError;
import com.syncrecovery.core.model.SyncOperation;
import com.syncrecovery.core.model.SyncOperationStatus;
import com.syncrecovery.core.spi.BackupManager;
import com.syncrecovery.engine.rollback.RollbackPointService;
import com.syncrecovery.recovery.events.RecoveryEvent;
import com.syncrecovery.recovery.events.RecoveryEventType;
import com.syncrecovery.recovery.manager.RecoveryManager;
import com.syncrecovery.recovery.manager.RecoveryStatistics;
import com.syncrecovery.recovery.manager.RecoveryStatusReport;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for failure reporting, recovery status, rollback points and backups.
 */
@RestController
@RequestMapping("/api/v1/recovery")
public class RecoveryController {

    private final RecoveryManager recoveryManager;
    private final RollbackPointService rollbackPoints;
    private final BackupManager backupManager;
    private final Clock clock;

    public RecoveryController(RecoveryManager recoveryManager, RollbackPointService rollbackPoints,
                              BackupManager backupManager, Clock clock) {
        this.recoveryManager = recoveryManager;
        this.rollbackPoints = rollbackPoints;
        this.backupManager = backupManager;
        this.clock = clock;
    }

    /**
     * Report a failed sync operation. Recovery, when applicable, runs in the background.
     */
    @PostMapping("/failures")
    public ResponseEntity<ApiResponse<FailureClassification>> reportFailure(@RequestBody ReportFailureRequest request) {
        if (request.operationId() == null || request.operationId().isBlank()) {
            throw new InvalidRequestException("Operation id is required");
        }
        if (request.errorMessage() == null) {
            throw new InvalidRequestException("Error message is required");
        }

        Instant now = clock.instant();
        SyncOperation operation = new SyncOperation(
            request.operationId(),
            request.direction() != null ? request.direction() : SyncDirection.LOCAL_TO_REMOTE,
            request.tableName(),
            request.recordId(),
            SyncOperationStatus.FAILED,
            now,
            request.retryCount() != null ? request.retryCount() : 0,
            request.maxRetries() != null ? request.maxRetries() : SyncOperation.DEFAULT_MAX_RETRIES,
            request.data(),
            null
        );
        SyncError error = new SyncError(
            request.errorCode() != null ? request.errorCode() : "SYNC_FAILED",
            request.errorMessage(),
            request.errorDetails(),
            now,
            true
        );

        FailureClassification classification = recoveryManager.handleSyncFailure(operation, error);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.ok(classification));
    }

    @GetMapping("/statistics")
    public ResponseEntity<ApiResponse<RecoveryStatistics>> statistics() {
        return ResponseEntity.ok(ApiResponse.ok(recoveryManager.getStatistics()));
    }

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<RecoveryStatusReport>> status() {
        return ResponseEntity.ok(ApiResponse.ok(recoveryManager.generateStatusReport()));
    }

    @GetMapping("/events")
    public ResponseEntity<ApiResponse<List<RecoveryEvent>>> events(
            @RequestParam(required = false) RecoveryEventType type,
            @RequestParam(required = false) String operationId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        return ResponseEntity.ok(ApiResponse.ok(recoveryManager.getEventHistory(type, operationId, since)));
    }

    // ========== Rollback Points ==========

    @GetMapping("/rollback-points")
    public ResponseEntity<ApiResponse<List<RollbackPoint>>> listRollbackPoints(
            @RequestParam(required = false) String ownerSessionId) {
        return ResponseEntity.ok(ApiResponse.ok(rollbackPoints.list(ownerSessionId)));
    }

    @PostMapping("/rollback-points")
    public ResponseEntity<ApiResponse<RollbackPoint>> createRollbackPoint(
            @RequestBody CreateRollbackPointRequest request) {
        if (request.description() == null || request.description().isBlank()) {
            throw new InvalidRequestException("Rollback point description is required");
        }
        RollbackPoint point = rollbackPoints.create(
            request.description(),
            request.operationIds() != null ? request.operationIds() : List.of(),
            request.backupType() != null ? request.backupType() : BackupType.INCREMENTAL,
            request.tables() != null ? request.tables() : List.of(),
            request.ttl(),
            null
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(point));
    }

    /**
     * Restore a rollback point; expired points answer 410.
     */
    @PostMapping("/rollback-points/{rollbackPointId}/restore")
    public ResponseEntity<ApiResponse<RollbackPoint>> restoreRollbackPoint(@PathVariable String rollbackPointId) {
        return ResponseEntity.ok(ApiResponse.ok(rollbackPoints.restore(rollbackPointId)));
    }

    // ========== Backups ==========

    @GetMapping("/backups")
    public ResponseEntity<ApiResponse<List<BackupInfo>>> listBackups(
            @RequestParam(required = false) BackupType type,
            @RequestParam(required = false) String table,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        return ResponseEntity.ok(ApiResponse.ok(backupManager.listBackups(new BackupFilter(type, table, since))));
    }

    // ========== DTOs ==========

    public record ReportFailureRequest(
        String operationId,
        SyncDirection direction,
        String tableName,
        String recordId,
        Integer retryCount,
        Integer maxRetries,
        JsonNode data,
        String errorCode,
        String errorMessage,
        Map<String, Object> errorDetails
    ) {}

    /**
     * @param ttl ISO-8601 duration, defaults to the configured lifetime
     */
    public record CreateRollbackPointRequest(
        String description,
        List<String> operationIds,
        BackupType backupType,
        List<String> tables,
        Duration ttl
    ) {}
}
