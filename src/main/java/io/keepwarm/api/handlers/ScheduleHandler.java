package io.keepwarm.api.handlers;

import io.keepwarm.ModelNotFoundException;
import io.keepwarm.SchedulerEngine;
import io.keepwarm.api.models.requests.ScheduleRequest;
import io.keepwarm.api.models.responses.ErrorResponse;
import io.keepwarm.api.models.responses.ScheduleResponse;
import io.keepwarm.models.ModelStatus;
import io.keepwarm.models.TickSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API handler for keep-warm schedules.
 *
 * Supported operations:
 * - GET /api/v1/schedules - Status table of every model
 * - GET /api/v1/schedules/{modelId} - One model
 * - PUT /api/v1/schedules/{modelId} - Add or update a schedule
 * - POST /api/v1/schedules/{modelId}/_start - Enable and probe immediately
 * - POST /api/v1/schedules/{modelId}/_stop - Disable
 * - DELETE /api/v1/schedules/{modelId} - Remove
 * - POST /api/v1/schedules/_tick - Run one scheduling pass now
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/schedules")
public class ScheduleHandler {

    private final SchedulerEngine engine;

    public ScheduleHandler(SchedulerEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public ResponseEntity<Object> getAllSchedules() {
        try {
            List<ModelStatus> statuses = engine.getStatus();
            return ResponseEntity.ok(statuses);
        } catch (Exception e) {
            log.error("Error listing schedules: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/{modelId}")
    public ResponseEntity<Object> getSchedule(@PathVariable String modelId) {
        try {
            return ResponseEntity.ok(engine.getModel(modelId));
        } catch (ModelNotFoundException e) {
            log.warn("Model '{}' not found", modelId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.modelNotFound(modelId));
        } catch (Exception e) {
            log.error("Error getting schedule '{}': {}", modelId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Add or update a schedule.
     * PUT /api/v1/schedules/{modelId}
     */
    @PutMapping("/{modelId}")
    public ResponseEntity<Object> putSchedule(
            @PathVariable String modelId,
            @RequestBody ScheduleRequest request) {
        try {
            log.info("Putting schedule for model '{}'", modelId);
            ModelStatus status = engine.addOrUpdate(request.toDefinition(modelId));
            return ResponseEntity.ok(ScheduleResponse.builder()
                .acknowledged(true)
                .modelId(modelId)
                .model(status)
                .build());
        } catch (IllegalArgumentException e) {
            log.error("Invalid schedule for model '{}': {}", modelId, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.invalidSchedule(e.getMessage()));
        } catch (Exception e) {
            log.error("Error putting schedule '{}': {}", modelId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Start a model. Blocks until the immediate probe finished or timed out.
     * POST /api/v1/schedules/{modelId}/_start
     */
    @PostMapping("/{modelId}/_start")
    public ResponseEntity<Object> startSchedule(@PathVariable String modelId) {
        try {
            log.info("Starting model '{}'", modelId);
            engine.start(modelId);
            return ResponseEntity.ok(ScheduleResponse.builder()
                .acknowledged(true)
                .modelId(modelId)
                .model(engine.getModel(modelId))
                .build());
        } catch (ModelNotFoundException e) {
            log.warn("Cannot start unknown model '{}'", modelId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.modelNotFound(modelId));
        } catch (Exception e) {
            log.error("Error starting model '{}': {}", modelId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @PostMapping("/{modelId}/_stop")
    public ResponseEntity<Object> stopSchedule(@PathVariable String modelId) {
        try {
            log.info("Stopping model '{}'", modelId);
            engine.stop(modelId);
            return ResponseEntity.ok(ScheduleResponse.builder()
                .acknowledged(true)
                .modelId(modelId)
                .model(engine.getModel(modelId))
                .build());
        } catch (ModelNotFoundException e) {
            log.warn("Cannot stop unknown model '{}'", modelId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.modelNotFound(modelId));
        } catch (Exception e) {
            log.error("Error stopping model '{}': {}", modelId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @DeleteMapping("/{modelId}")
    public ResponseEntity<Object> deleteSchedule(@PathVariable String modelId) {
        try {
            log.info("Removing model '{}'", modelId);
            engine.remove(modelId);
            return ResponseEntity.ok(ScheduleResponse.builder()
                .acknowledged(true)
                .modelId(modelId)
                .build());
        } catch (ModelNotFoundException e) {
            log.warn("Cannot remove unknown model '{}'", modelId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.modelNotFound(modelId));
        } catch (Exception e) {
            log.error("Error removing model '{}': {}", modelId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Run a tick on demand. Extra ticks are harmless.
     * POST /api/v1/schedules/_tick
     */
    @PostMapping("/_tick")
    public ResponseEntity<Object> tick() {
        try {
            TickSummary summary = engine.tick();
            return ResponseEntity.ok(summary);
        } catch (Exception e) {
            log.error("Error running on-demand tick: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
