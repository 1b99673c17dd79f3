package com.syncrecovery.api.rest;

import com.syncrecovery.core.model.ReplayEventResult;
import com.syncrecovery.core.model.ReplayMode;
import com.syncrecovery.core.model.ReplayOptions;
import com.syncrecovery.core.model.ReplaySession;
import com.syncrecovery.core.model.ReplayStatus;
import com.syncrecovery.core.model.ReplayStrategy;
import com.syncrecovery.core.model.RollbackPoint;
import com.syncrecovery.engine.replay.ReplayEngine;
import com.syncrecovery.engine.replay.ReplayProgress;
import com.syncrecovery.engine.replay.ReplayValidation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for replay sessions.
 */
@RestController
@RequestMapping("/api/v1/replay/sessions")
public class ReplayController {

    private final ReplayEngine replayEngine;

    public ReplayController(ReplayEngine replayEngine) {
        this.replayEngine = replayEngine;
    }

    /**
     * Create a PENDING session. Filter and options are validated here.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<ReplaySession>> createSession(@RequestBody CreateSessionRequest request) {
        String sessionId = replayEngine.createSession(
            request.name(),
            request.filter() != null ? request.filter().toFilter() : null,
            request.options() != null ? request.options().toOptions() : null,
            request.description()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.ok(replayEngine.getSession(sessionId)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ReplaySession>>> listSessions(
            @RequestParam(required = false) ReplayStatus status) {
        return ResponseEntity.ok(ApiResponse.ok(replayEngine.listSessions(status)));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<ReplaySession>> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.ok(replayEngine.getSession(sessionId)));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> deleteSession(@PathVariable String sessionId) {
        replayEngine.deleteSession(sessionId);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("deleted", sessionId)));
    }

    // ========== Control ==========

    /**
     * Start a session. The run continues in the background.
     */
    @PostMapping("/{sessionId}/start")
    public ResponseEntity<ApiResponse<ReplaySession>> startReplay(@PathVariable String sessionId) {
        replayEngine.startReplay(sessionId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.ok(replayEngine.getSession(sessionId)));
    }

    @PostMapping("/{sessionId}/pause")
    public ResponseEntity<ApiResponse<ReplaySession>> pauseReplay(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.ok(replayEngine.pauseReplay(sessionId)));
    }

    /**
     * Resume a paused session from its last processed event.
     */
    @PostMapping("/{sessionId}/resume")
    public ResponseEntity<ApiResponse<ReplaySession>> resumeReplay(@PathVariable String sessionId) {
        replayEngine.resumeReplay(sessionId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.ok(replayEngine.getSession(sessionId)));
    }

    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<ApiResponse<ReplaySession>> cancelReplay(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.ok(replayEngine.cancelReplay(sessionId)));
    }

    // ========== Progress & Results ==========

    @GetMapping("/{sessionId}/progress")
    public ResponseEntity<ApiResponse<ReplayProgress>> getProgress(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.ok(replayEngine.getReplayProgress(sessionId)));
    }

    @GetMapping("/{sessionId}/results")
    public ResponseEntity<ApiResponse<List<ReplayEventResult>>> getResults(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.ok(replayEngine.getResults(sessionId)));
    }

    @GetMapping("/{sessionId}/validation")
    public ResponseEntity<ApiResponse<ReplayValidation>> validate(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.ok(replayEngine.validateReplay(sessionId)));
    }

    @PostMapping("/{sessionId}/checkpoints/{rollbackPointId}/restore")
    public ResponseEntity<ApiResponse<RollbackPoint>> restoreCheckpoint(
            @PathVariable String sessionId,
            @PathVariable String rollbackPointId) {
        return ResponseEntity.ok(ApiResponse.ok(replayEngine.restoreCheckpoint(sessionId, rollbackPointId)));
    }

    // ========== DTOs ==========

    public record CreateSessionRequest(
        String name,
        String description,
        EventFilterRequest filter,
        ReplayOptionsRequest options
    ) {}

    /**
     * Replay options with every field optional; absent fields take the defaults.
     */
    public record ReplayOptionsRequest(
        ReplayMode mode,
        ReplayStrategy strategy,
        Integer maxConcurrency,
        Boolean stopOnError,
        List<String> skipEvents,
        List<String> includeEvents,
        List<String> selectors,
        Double speedMultiplier,
        Boolean enableValidation,
        Boolean enableRollback,
        Integer checkpointInterval
    ) {
        public ReplayOptions toOptions() {
            ReplayOptions.Builder builder = ReplayOptions.builder();
            if (mode != null) builder.mode(mode);
            if (strategy != null) builder.strategy(strategy);
            if (maxConcurrency != null) builder.maxConcurrency(maxConcurrency);
            if (stopOnError != null) builder.stopOnError(stopOnError);
            if (skipEvents != null) builder.skipEvents(skipEvents);
            if (includeEvents != null) builder.includeEvents(includeEvents);
            if (selectors != null) builder.selectors(selectors);
            if (speedMultiplier != null) builder.speedMultiplier(speedMultiplier);
            if (enableValidation != null) builder.enableValidation(enableValidation);
            if (enableRollback != null) builder.enableRollback(enableRollback);
            if (checkpointInterval != null) builder.checkpointInterval(checkpointInterval);
            return builder.build();
        }
    }
}
