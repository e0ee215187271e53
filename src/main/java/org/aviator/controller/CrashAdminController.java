package org.aviator.controller;

import lombok.extern.slf4j.Slf4j;
import org.aviator.dto.SettingsUpdateRequest;
import org.aviator.service.AuditLogService;
import org.aviator.service.GameSettingsService;
import org.aviator.service.crash.CrashException;
import org.aviator.service.crash.CrashQueryService;
import org.aviator.service.crash.engine.RoundScheduler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/admin/crash")
@PreAuthorize("hasRole('ADMIN')")
public class CrashAdminController {

    @Autowired private RoundScheduler scheduler;
    @Autowired private GameSettingsService settingsService;
    @Autowired private CrashQueryService queryService;
    @Autowired private AuditLogService audit;

    @PostMapping("/start")
    public ResponseEntity<?> start() {
        boolean started = scheduler.start();
        return ResponseEntity.ok(Map.of("running", true, "changed", started));
    }

    @PostMapping("/stop")
    public ResponseEntity<?> stop() {
        boolean stopped = scheduler.stop();
        return ResponseEntity.ok(Map.of("running", false, "changed", stopped));
    }

    @PostMapping("/force-crash")
    public ResponseEntity<?> forceCrash(Authentication auth) {
        try {
            BigDecimal at = scheduler.forceCrash();
            log.warn("Crash forcé demandé par {} vers x{}", auth == null ? "?" : auth.getName(), at);
            return ResponseEntity.ok(Map.of("multiplier", at));
        } catch (CrashException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getReason().name(), "message", e.getMessage()));
        }
    }

    @GetMapping("/settings")
    public ResponseEntity<?> settings() {
        return ResponseEntity.ok(settingsService.current());
    }

    // appliqué au prochain round, jamais au round en cours
    @PutMapping("/settings")
    public ResponseEntity<?> updateSettings(@RequestBody SettingsUpdateRequest req, Authentication auth) {
        try {
            GameSettingsService.Snapshot s = settingsService.update(req);
            audit.record(AuditLogService.SETTINGS_UPDATE, null,
                    (auth == null ? "?" : auth.getName()) + " -> " + s);
            return ResponseEntity.ok(s);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "INVALID_SETTINGS", "message", e.getMessage()));
        }
    }

    @GetMapping("/rounds/{roundNumber}/statistics")
    public ResponseEntity<?> roundStatistics(@PathVariable Long roundNumber) {
        return ResponseEntity.ok(queryService.roundStatistics(roundNumber));
    }

    @GetMapping("/audit")
    public ResponseEntity<?> audit(@RequestParam(required = false) String type,
                                   @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(audit.recent(type, limit));
    }
}
