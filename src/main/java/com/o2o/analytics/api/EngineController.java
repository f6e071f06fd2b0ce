package com.o2o.analytics.api;

import com.o2o.analytics.domain.model.ConsistencyReport;
import com.o2o.analytics.domain.model.EngineHealth;
import com.o2o.analytics.domain.model.EngineQueryRequest;
import com.o2o.analytics.domain.model.EngineQueryResponse;
import com.o2o.analytics.domain.model.EngineStatus;
import com.o2o.analytics.domain.model.EngineType;
import com.o2o.analytics.domain.model.RepairResult;
import com.o2o.analytics.domain.model.SyncJobKey;
import com.o2o.analytics.domain.model.SyncMode;
import com.o2o.analytics.domain.model.WarmupResult;
import com.o2o.analytics.domain.service.CacheWarmupService;
import com.o2o.analytics.domain.service.EngineQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * REST API of the analytics engine.
 *
 * Endpoints:
 * - GET /api/v1/engine/query/{definitionId} - Query a definition
 * - GET /api/v1/engine/status - Tier, engines, cache, versions, jobs, drift
 * - POST /api/v1/engine/override/{engine} - Force an engine
 * - DELETE /api/v1/engine/override - Back to tier-based routing
 * - POST /api/v1/engine/invalidate/{definitionId} - Drop cached results, optionally rebuild a key
 * - GET /api/v1/engine/consistency/{definitionId} - Consistency report
 * - POST /api/v1/engine/consistency/{definitionId}/repair - Check and repair
 * - POST /api/v1/engine/sync/{definitionId} - Queue a rebuild
 * - POST /api/v1/engine/cache/warmup - Pre-compute the hot windows of every definition
 * - GET /api/v1/engine/health - Engine health
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/engine")
@RequiredArgsConstructor
public class EngineController {

    private static final String START = "start";
    private static final String END = "end";

    private final EngineQueryService engineQueryService;
    private final CacheWarmupService cacheWarmupService;

    /**
     * Query a definition.
     *
     * GET /api/v1/engine/query/store_daily_summary?start=2026-01-01&end=2026-01-07&store_id=S1
     *
     * Query Parameters:
     * - start, end (optional, ISO dates): window, default the last 7 days
     * - any other parameter: equality filter on a group-by field
     */
    @GetMapping("/query/{definitionId}")
    public ResponseEntity<EngineQueryResponse> query(
            @PathVariable String definitionId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam Map<String, String> params) {

        Map<String, String> filters = new TreeMap<>(params);
        filters.remove(START);
        filters.remove(END);

        log.info("Query {}: start={}, end={}, filters={}", definitionId, start, end, filters);

        EngineQueryRequest request = EngineQueryRequest.builder()
                .definitionId(definitionId)
                .filters(filters)
                .start(start)
                .end(end)
                .build();

        return ResponseEntity.ok(engineQueryService.query(request));
    }

    @GetMapping("/status")
    public ResponseEntity<EngineStatus> status() {
        return ResponseEntity.ok(engineQueryService.status());
    }

    @PostMapping("/override/{engine}")
    public ResponseEntity<Map<String, EngineType>> forceEngine(@PathVariable EngineType engine) {
        log.info("Force engine: {}", engine);
        engineQueryService.forceEngine(engine);
        return ResponseEntity.ok(Map.of("forcedEngine", engine));
    }

    @DeleteMapping("/override")
    public ResponseEntity<Void> resetEngineOverride() {
        log.info("Reset engine override");
        engineQueryService.resetEngineOverride();
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/engine/invalidate/store_daily_summary?dimensionKey=S1
     */
    @PostMapping("/invalidate/{definitionId}")
    public ResponseEntity<Map<String, Object>> invalidate(
            @PathVariable String definitionId,
            @RequestParam(required = false) String dimensionKey) {

        log.info("Invalidate {}: dimensionKey={}", definitionId, dimensionKey);
        long version = engineQueryService.invalidate(definitionId, dimensionKey);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("definitionId", definitionId);
        body.put("dimensionKey", dimensionKey);
        body.put("dataVersion", version);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/consistency/{definitionId}")
    public ResponseEntity<ConsistencyReport> checkConsistency(
            @PathVariable String definitionId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {

        return ResponseEntity.ok(engineQueryService.checkConsistency(definitionId, start, end));
    }

    @PostMapping("/consistency/{definitionId}/repair")
    public ResponseEntity<RepairResult> repairConsistency(
            @PathVariable String definitionId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {

        log.info("Repair {}: start={}, end={}", definitionId, start, end);
        return ResponseEntity.ok(engineQueryService.repairConsistency(definitionId, start, end));
    }

    /**
     * Queue a rebuild; answers 202 before the job runs. Progress shows up in /status.
     */
    @PostMapping("/sync/{definitionId}")
    public ResponseEntity<SyncJobKey> triggerSync(
            @PathVariable String definitionId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(defaultValue = "INCREMENTAL") SyncMode mode) {

        log.info("Sync {}: start={}, end={}, mode={}", definitionId, start, end, mode);
        SyncJobKey key = engineQueryService.triggerSync(definitionId, start, end, mode);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(key);
    }

    @PostMapping("/cache/warmup")
    public ResponseEntity<WarmupResult> warmUp() {
        log.info("Cache warm-up requested");
        return ResponseEntity.ok(cacheWarmupService.warmUpAll());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<EngineType, EngineHealth>> health() {
        return ResponseEntity.ok(engineQueryService.engineHealth());
    }
}
