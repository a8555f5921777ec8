package com.platform.netconfig.api;

import com.platform.netconfig.backup.SnapshotHandle;
import com.platform.netconfig.controller.ControllerStatus;
import com.platform.netconfig.error.RunStateException;
import com.platform.netconfig.model.HardwareProfile;
import com.platform.netconfig.reconciliation.ReconciliationService;
import com.platform.netconfig.reconciliation.RunMode;
import com.platform.netconfig.reconciliation.RunReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for validating, planning and applying the desired network state.
 *
 * <p>Runs that finish without success still return their report, with a
 * non-2xx status matching the outcome.
 */
@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {
    
    private final ReconciliationService reconciliationService;
    
    public ReconciliationController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }
    
    @PostMapping("/validate")
    public ResponseEntity<RunReport> validate() {
        return respond(reconciliationService.run(RunMode.VALIDATE_ONLY));
    }
    
    @PostMapping("/plan")
    public ResponseEntity<RunReport> plan() {
        return respond(reconciliationService.run(RunMode.DRY_RUN));
    }
    
    @PostMapping("/apply")
    public ResponseEntity<RunReport> apply() {
        return respond(reconciliationService.run(RunMode.APPLY));
    }
    
    @PostMapping("/cancel")
    public ResponseEntity<Map<String, String>> cancel() {
        String runId = reconciliationService.cancel();
        return ResponseEntity.accepted().body(Map.of("runId", runId, "status", "CANCELLING"));
    }
    
    @GetMapping("/runs")
    public List<RunReport> getRuns() {
        return reconciliationService.getRunHistory();
    }
    
    @GetMapping("/runs/{runId}")
    public RunReport getRun(@PathVariable String runId) {
        return reconciliationService.findRun(runId)
            .orElseThrow(() -> RunStateException.notFound(runId));
    }
    
    @GetMapping("/hardware-profiles")
    public List<HardwareProfile> getHardwareProfiles() {
        return reconciliationService.hardwareProfiles();
    }
    
    @GetMapping("/controller/status")
    public ControllerStatus getControllerStatus() {
        return reconciliationService.controllerStatus();
    }
    
    @PostMapping("/backup")
    public ResponseEntity<SnapshotHandle> backup() {
        return ResponseEntity.status(HttpStatus.CREATED).body(reconciliationService.backup());
    }
    
    private ResponseEntity<RunReport> respond(RunReport report) {
        HttpStatus status = switch (report.getStatus()) {
            case SUCCESS -> HttpStatus.OK;
            case VALIDATION_FAILED -> report.exitCode() == 1 ? HttpStatus.NOT_FOUND : HttpStatus.UNPROCESSABLE_ENTITY;
            case PLANNING_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case PARTIAL_FAILURE -> HttpStatus.MULTI_STATUS;
            case FAILED -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(report);
    }
}
