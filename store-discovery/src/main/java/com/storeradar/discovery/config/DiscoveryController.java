package com.storeradar.discovery.config;

import com.storeradar.discovery.error.FatalConfigurationException;
import com.storeradar.discovery.model.Cadence;
import com.storeradar.discovery.model.RunReport;
import com.storeradar.discovery.model.RunStatus;
import com.storeradar.discovery.run.RunCoordinator;
import com.storeradar.discovery.run.TriggerResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/discovery")
@Slf4j
@RequiredArgsConstructor
public class DiscoveryController {

    private final RunCoordinator coordinator;

    // ── Run triggers ──────────────────────────────────────────────────────────

    /**
     * Trigger a run.
     *
     * POST /discovery/runs?cadence=deep
     *
     * Returns 202 with the run id, or the active run id when the request was queued.
     */
    @PostMapping("/runs")
    public ResponseEntity<Map<String, Object>> trigger(@RequestParam(required = false) String cadence) {
        try {
            TriggerResult result = coordinator.trigger(Cadence.parse(cadence));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", result.status().name().toLowerCase());
            body.put("runId", result.runId());
            body.put("cadence", result.cadence().name().toLowerCase());
            return ResponseEntity.accepted().body(body);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (FatalConfigurationException e) {
            log.error("Manual trigger refused: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/runs/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = coordinator.cancel();
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    // ── Status ────────────────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<RunStatus> status() {
        return ResponseEntity.ok(coordinator.status());
    }

    /**
     * Last finished run report; 204 before the first run ends.
     */
    @GetMapping("/runs/last")
    public ResponseEntity<RunReport> lastRun() {
        RunReport last = coordinator.status().getLastReport();
        return last == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(last);
    }
}
