package com.platform.netconfig.reconciliation;

import com.platform.netconfig.apply.Applier;
import com.platform.netconfig.apply.ApplyReport;
import com.platform.netconfig.apply.CancellationToken;
import com.platform.netconfig.backup.SnapshotHandle;
import com.platform.netconfig.backup.SnapshotProvider;
import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.controller.ControllerClient;
import com.platform.netconfig.controller.ControllerStatus;
import com.platform.netconfig.controller.LiveStateFetcher;
import com.platform.netconfig.diff.DiffEngine;
import com.platform.netconfig.diff.Operation;
import com.platform.netconfig.error.ErrorCode;
import com.platform.netconfig.error.NetConfigException;
import com.platform.netconfig.error.PlanningException;
import com.platform.netconfig.error.RunStateException;
import com.platform.netconfig.error.ValidationException;
import com.platform.netconfig.model.HardwareProfile;
import com.platform.netconfig.model.NetworkState;
import com.platform.netconfig.observability.LoggingConfig;
import com.platform.netconfig.observability.ReconciliationMetrics;
import com.platform.netconfig.plan.Planner;
import com.platform.netconfig.plan.ReconciliationPlan;
import com.platform.netconfig.validation.ConfigValidator;
import com.platform.netconfig.validation.HardwareProfileCatalog;
import com.platform.netconfig.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the reconciliation pipeline: load, validate, fetch, diff, plan,
 * snapshot and apply, stopping as early as the run mode allows.
 *
 * <p>At most one run is active per process; a second request fails with
 * {@link ErrorCode#RUN_IN_PROGRESS} instead of queueing.
 */
@Slf4j
@Service
public class ReconciliationService {
    
    private final NetConfigProperties properties;
    private final DesiredStateLoader loader;
    private final HardwareProfileCatalog hardwareProfiles;
    private final ConfigValidator validator;
    private final LiveStateFetcher liveStateFetcher;
    private final DiffEngine diffEngine;
    private final Planner planner;
    private final Applier applier;
    private final SnapshotProvider snapshotProvider;
    private final ControllerClient controllerClient;
    private final ReconciliationMetrics metrics;
    
    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicReference<ActiveRun> activeRun = new AtomicReference<>();
    private final List<RunReport> runHistory = new ArrayList<>();
    
    public ReconciliationService(
            NetConfigProperties properties,
            DesiredStateLoader loader,
            HardwareProfileCatalog hardwareProfiles,
            ConfigValidator validator,
            LiveStateFetcher liveStateFetcher,
            DiffEngine diffEngine,
            Planner planner,
            Applier applier,
            SnapshotProvider snapshotProvider,
            ControllerClient controllerClient,
            ReconciliationMetrics metrics) {
        this.properties = properties;
        this.loader = loader;
        this.hardwareProfiles = hardwareProfiles;
        this.validator = validator;
        this.liveStateFetcher = liveStateFetcher;
        this.diffEngine = diffEngine;
        this.planner = planner;
        this.applier = applier;
        this.snapshotProvider = snapshotProvider;
        this.controllerClient = controllerClient;
        this.metrics = metrics;
    }
    
    /**
     * Run the pipeline in the given mode.
     *
     * @throws RunStateException if another run is in progress
     */
    public RunReport run(RunMode mode) {
        if (!runLock.tryLock()) {
            ActiveRun active = activeRun.get();
            throw RunStateException.alreadyRunning(active != null ? active.runId() : "unknown");
        }
        
        String runId = UUID.randomUUID().toString().substring(0, 8);
        CancellationToken cancellation = new CancellationToken();
        Instant startedAt = Instant.now();
        activeRun.set(new ActiveRun(runId, mode, cancellation));
        metrics.setRunActive(true);
        LoggingConfig.setRunContext(runId, mode.name());
        
        RunReport.RunReportBuilder report = RunReport.builder()
            .runId(runId)
            .mode(mode)
            .startedAt(startedAt)
            .hardwareProfile(properties.getHardware().getProfile());
        
        try {
            log.info("Starting {} run", mode);
            RunStatus status = execute(mode, cancellation, report);
            
            Instant finishedAt = Instant.now();
            long durationMs = Duration.between(startedAt, finishedAt).toMillis();
            RunReport finished = report.status(status).finishedAt(finishedAt).durationMs(durationMs).build();
            
            addToRunHistory(finished);
            metrics.recordRun(mode.name(), status.name(), durationMs);
            if (status == RunStatus.SUCCESS) {
                log.info("{} run finished: {} in {}ms", mode, status, durationMs);
            } else {
                log.warn("{} run finished: {} in {}ms{}", mode, status, durationMs,
                    finished.getError() != null ? " (" + finished.getError() + ")" : "");
            }
            return finished;
            
        } finally {
            LoggingConfig.clearRunContext();
            metrics.setRunActive(false);
            activeRun.set(null);
            runLock.unlock();
        }
    }
    
    private RunStatus execute(RunMode mode, CancellationToken cancellation, RunReport.RunReportBuilder report) {
        try {
            NetworkState desired = loader.load(Paths.get(properties.getDesiredStatePath()));
            HardwareProfile profile = hardwareProfiles.resolve(properties.getHardware().getProfile());
            
            ValidationResult validation = validator.validate(desired, profile);
            if (!validation.isValid()) {
                metrics.recordValidationViolations(validation.failedClass().name(), validation.violations().size());
                validation.violations().forEach(v -> log.warn("Validation failed: {}", v));
                report.violations(validation.violations())
                    .errorCode(ErrorCode.VALIDATION_ERROR.getCode())
                    .error(String.format("%d %s violation(s)",
                        validation.violations().size(), validation.failedClass().name().toLowerCase()));
                return RunStatus.VALIDATION_FAILED;
            }
            if (mode == RunMode.VALIDATE_ONLY) {
                log.info("Desired state is valid for {}", profile.displayName());
                return RunStatus.SUCCESS;
            }
            
            NetworkState live = liveStateFetcher.fetch();
            List<Operation> operations = diffEngine.diff(desired, live);
            ReconciliationPlan plan = planner.plan(operations);
            metrics.recordPlanSize(plan.size());
            report.plan(plan);
            
            if (mode == RunMode.DRY_RUN) {
                report.apply(applier.apply(plan, true, cancellation));
                return RunStatus.SUCCESS;
            }
            
            if (plan.isEmpty()) {
                log.info("Live state already matches desired state, nothing to apply");
                report.apply(applier.apply(plan, false, cancellation));
                return RunStatus.SUCCESS;
            }
            
            SnapshotHandle snapshot = snapshotProvider.snapshot();
            report.snapshot(snapshot);
            
            ApplyReport applied = applier.apply(plan, false, cancellation);
            report.apply(applied);
            return statusOf(applied, report);
            
        } catch (ValidationException e) {
            log.warn("Desired state rejected: {}", e.getMessage());
            report.violations(e.getViolations())
                .errorCode(e.getErrorCode().getCode())
                .error(e.getMessage());
            return RunStatus.VALIDATION_FAILED;
            
        } catch (PlanningException e) {
            log.error("Planning failed: {}", e.getMessage());
            metrics.recordPlanningFailure(e.getErrorCode().getCode());
            report.errorCode(e.getErrorCode().getCode())
                .error(e.getMessage())
                .offendingOperations(e.getOffendingOperations());
            return RunStatus.PLANNING_FAILED;
            
        } catch (NetConfigException e) {
            log.error("Run failed [{}]: {}", e.getErrorCode().getCode(), e.getMessage());
            metrics.recordError(e.getErrorCode().getCode());
            report.errorCode(e.getErrorCode().getCode()).error(e.getMessage());
            return RunStatus.FAILED;
            
        } catch (RuntimeException e) {
            log.error("Run failed with unexpected error", e);
            metrics.recordError(ErrorCode.INTERNAL_ERROR.getCode());
            report.errorCode(ErrorCode.INTERNAL_ERROR.getCode()).error(e.getMessage());
            return RunStatus.FAILED;
        }
    }
    
    private RunStatus statusOf(ApplyReport applied, RunReport.RunReportBuilder report) {
        if (applied.isComplete()) {
            return RunStatus.SUCCESS;
        }
        if (applied.isHalted()) {
            report.errorCode(applied.failed().isEmpty() ? ErrorCode.INTERNAL_ERROR.getCode()
                    : applied.failed().get(applied.failed().size() - 1).errorCode())
                .error("Run halted: " + applied.haltReason());
            return RunStatus.FAILED;
        }
        if (applied.cancelled()) {
            report.error("Run cancelled after " + applied.succeeded().size() + " operation(s)");
        } else {
            report.error(String.format("%d operation(s) failed, %d skipped",
                applied.failed().size(), applied.skipped().size()));
        }
        return RunStatus.PARTIAL_FAILURE;
    }
    
    /**
     * Request cancellation of the active run.
     *
     * @return id of the run being cancelled
     * @throws RunStateException if no run is active
     */
    public String cancel() {
        ActiveRun active = activeRun.get();
        if (active == null) {
            throw RunStateException.nothingToCancel();
        }
        active.cancellation().cancel();
        log.info("Cancellation requested for {} run {}", active.mode(), active.runId());
        return active.runId();
    }
    
    public Optional<String> getActiveRunId() {
        return Optional.ofNullable(activeRun.get()).map(ActiveRun::runId);
    }
    
    /**
     * Take a controller backup outside of a run.
     */
    public SnapshotHandle backup() {
        return snapshotProvider.snapshot();
    }
    
    public ControllerStatus controllerStatus() {
        return controllerClient.status();
    }
    
    public List<HardwareProfile> hardwareProfiles() {
        return List.copyOf(hardwareProfiles.all());
    }
    
    private synchronized void addToRunHistory(RunReport report) {
        runHistory.add(report);
        
        if (runHistory.size() > Math.max(properties.getRunHistorySize(), 1)) {
            runHistory.remove(0);
        }
    }
    
    /**
     * Finished runs, newest first.
     */
    public synchronized List<RunReport> getRunHistory() {
        List<RunReport> runs = new ArrayList<>(runHistory);
        Collections.reverse(runs);
        return runs;
    }
    
    public synchronized Optional<RunReport> findRun(String runId) {
        return runHistory.stream().filter(r -> r.getRunId().equals(runId)).findFirst();
    }
    
    private record ActiveRun(String runId, RunMode mode, CancellationToken cancellation) {
    }
}
