package com.platform.netconfig.cli;

import com.platform.netconfig.apply.ApplyReport;
import com.platform.netconfig.apply.OperationOutcome;
import com.platform.netconfig.backup.SnapshotHandle;
import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.controller.ControllerStatus;
import com.platform.netconfig.error.NetConfigException;
import com.platform.netconfig.reconciliation.ReconciliationService;
import com.platform.netconfig.reconciliation.RunMode;
import com.platform.netconfig.reconciliation.RunReport;
import com.platform.netconfig.reconciliation.RunStatus;
import com.platform.netconfig.validation.Violation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;

/**
 * One-shot command line entry point, active when {@code netconfig.command} is set.
 *
 * <p>Commands: {@code validate}, {@code plan} (or {@code apply --dry-run}),
 * {@code apply}, {@code backup} and {@code status}. The process exit code is
 * the run's exit code: 0 success, 1 document not found, 2 validation failure,
 * 3 planning failure, 4 partial failure, 5 fatal failure.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "netconfig", name = "command")
public class ReconciliationCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    
    static final int EXIT_USAGE = 2;
    
    private final ReconciliationService reconciliationService;
    private final NetConfigProperties properties;
    private final PrintStream out;
    
    private int exitCode = 0;
    
    @Autowired
    public ReconciliationCommandRunner(ReconciliationService reconciliationService, NetConfigProperties properties) {
        this(reconciliationService, properties, System.out);
    }
    
    ReconciliationCommandRunner(ReconciliationService reconciliationService, NetConfigProperties properties,
                                PrintStream out) {
        this.reconciliationService = reconciliationService;
        this.properties = properties;
        this.out = out;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        String command = properties.getCommand().trim().toLowerCase(Locale.ROOT);
        boolean dryRun = args.containsOption("dry-run");
        log.info("Running command '{}'{}", command, dryRun ? " (dry run)" : "");
        
        try {
            exitCode = switch (command) {
                case "validate" -> printRun(reconciliationService.run(RunMode.VALIDATE_ONLY));
                case "plan" -> printRun(reconciliationService.run(RunMode.DRY_RUN));
                case "apply" -> printRun(reconciliationService.run(dryRun ? RunMode.DRY_RUN : RunMode.APPLY));
                case "backup" -> printBackup(reconciliationService.backup());
                case "status" -> printStatus(reconciliationService.controllerStatus());
                default -> {
                    out.println("Unknown command '" + command + "'. Expected one of: validate, plan, apply, backup, status");
                    yield EXIT_USAGE;
                }
            };
        } catch (NetConfigException e) {
            log.error("Command '{}' failed [{}]: {}", command, e.getErrorCode().getCode(), e.getMessage());
            out.println("ERROR " + e.getErrorCode().getCode() + ": " + e.getMessage());
            exitCode = RunStatus.FAILED.getExitCode();
        }
    }
    
    @Override
    public int getExitCode() {
        return exitCode;
    }
    
    private int printRun(RunReport report) {
        out.printf("Run %s (%s, profile %s): %s%n",
            report.getRunId(), report.getMode(), report.getHardwareProfile(), report.getStatus());
        
        for (Violation violation : report.getViolations()) {
            out.println("  invalid: " + violation);
        }
        if (report.getPlan() != null) {
            for (Map.Entry<String, String> filtered : report.getPlan().filtered().entrySet()) {
                out.printf("  filtered: %s (%s)%n", filtered.getKey(), filtered.getValue());
            }
        }
        
        ApplyReport apply = report.getApply();
        if (apply != null) {
            if (apply.dryRun()) {
                apply.actions().forEach(action -> out.println("  would " + action));
                if (apply.actions().isEmpty()) {
                    out.println("  no changes");
                }
            } else {
                for (OperationOutcome outcome : apply.outcomes()) {
                    out.printf("  %-13s %s%s%n", outcome.status(), outcome.action(),
                        outcome.reason() != null ? " (" + outcome.reason() + ")" : "");
                }
            }
        }
        if (report.getSnapshot() != null) {
            out.println("  backup: " + report.getSnapshot().location());
        }
        if (report.getError() != null) {
            out.println("  error " + (report.getErrorCode() != null ? report.getErrorCode() + ": " : "") + report.getError());
        }
        if (report.getOffendingOperations() != null) {
            report.getOffendingOperations().forEach(op -> out.println("  offending: " + op));
        }
        return report.exitCode();
    }
    
    private int printBackup(SnapshotHandle snapshot) {
        out.printf("Backup %s saved to %s (%d bytes)%n", snapshot.id(), snapshot.location(), snapshot.sizeBytes());
        return RunStatus.SUCCESS.getExitCode();
    }
    
    private int printStatus(ControllerStatus status) {
        out.printf("Controller %s (site %s): version %s, host %s%n",
            status.url(), status.site(), status.version(), status.hostname());
        out.printf("  %d segments, %d firewall rules%n", status.segments(), status.firewallRules());
        return RunStatus.SUCCESS.getExitCode();
    }
}
