package com.platform.netconfig.cli;

import com.platform.netconfig.apply.ApplyReport;
import com.platform.netconfig.apply.OperationOutcome;
import com.platform.netconfig.backup.SnapshotHandle;
import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.controller.ControllerStatus;
import com.platform.netconfig.error.FatalApiException;
import com.platform.netconfig.plan.ReconciliationPlan;
import com.platform.netconfig.reconciliation.ReconciliationService;
import com.platform.netconfig.reconciliation.RunMode;
import com.platform.netconfig.reconciliation.RunReport;
import com.platform.netconfig.reconciliation.RunStatus;
import com.platform.netconfig.validation.Violation;
import com.platform.netconfig.validation.ViolationClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationCommandRunnerTest {

    @Mock
    private ReconciliationService reconciliationService;

    private NetConfigProperties properties;
    private ByteArrayOutputStream output;
    private ReconciliationCommandRunner runner;

    @BeforeEach
    void setUp() {
        properties = new NetConfigProperties();
        output = new ByteArrayOutputStream();
        runner = new ReconciliationCommandRunner(reconciliationService, properties,
            new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private static RunReport.RunReportBuilder report(RunMode mode, RunStatus status) {
        return RunReport.builder().runId("a1b2c3d4").mode(mode).status(status).hardwareProfile("usg3p");
    }

    @Test
    void validateFailurePrintsViolationsAndExitsWithTwo() {
        properties.setCommand("validate");
        when(reconciliationService.run(RunMode.VALIDATE_ONLY)).thenReturn(report(RunMode.VALIDATE_ONLY,
            RunStatus.VALIDATION_FAILED)
            .violations(List.of(new Violation(ViolationClass.UNIQUENESS, "segments[1].subnet", "10.0.10.0/25",
                "subnet-overlap", "overlaps segments[0] (10.0.10.0/24)")))
            .build());

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(2);
        assertThat(printed())
            .contains("Run a1b2c3d4 (VALIDATE_ONLY, profile usg3p): VALIDATION_FAILED")
            .contains("invalid: segments[1].subnet = '10.0.10.0/25' violates subnet-overlap");
    }

    @Test
    void planPrintsWouldBeActions() {
        properties.setCommand("plan");
        when(reconciliationService.run(RunMode.DRY_RUN)).thenReturn(report(RunMode.DRY_RUN, RunStatus.SUCCESS)
            .plan(new ReconciliationPlan(List.of(), List.of(), Map.of("delete:segment/1", "VLAN 1 is protected")))
            .apply(ApplyReport.dryRun(List.of("create segment 30 'IoT' (10.0.30.0/24, gateway 10.0.30.1)")))
            .build());

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
        assertThat(printed())
            .contains("filtered: delete:segment/1 (VLAN 1 is protected)")
            .contains("would create segment 30 'IoT'");
    }

    @Test
    void applyWithDryRunOptionDoesNotApply() {
        properties.setCommand("apply");
        when(reconciliationService.run(RunMode.DRY_RUN)).thenReturn(report(RunMode.DRY_RUN, RunStatus.SUCCESS)
            .apply(ApplyReport.dryRun(List.of())).build());

        runner.run(new DefaultApplicationArguments("--dry-run"));

        assertThat(printed()).contains("no changes");
        verify(reconciliationService, never()).run(RunMode.APPLY);
    }

    @Test
    void partialApplyPrintsOutcomesAndExitsWithFour() {
        properties.setCommand("APPLY");
        ApplyReport applied = new ApplyReport(false,
            List.of("create segment 30 'IoT'", "create rule LAN_IN#2001 'iot'"),
            List.of(OperationOutcome.failed("create:segment/30", "create segment 30 'IoT'", "VLAN in use", "NC-304"),
                OperationOutcome.skipped("create:rule/LAN_IN#2001", "create rule LAN_IN#2001 'iot'",
                    "create:segment/30")),
            null, false);
        when(reconciliationService.run(RunMode.APPLY)).thenReturn(report(RunMode.APPLY, RunStatus.PARTIAL_FAILURE)
            .apply(applied)
            .snapshot(new SnapshotHandle("controller-backup-x", "/backups/controller-backup-x.unf", 10, Instant.now()))
            .errorCode("NC-304")
            .error("1 operation(s) failed, 1 skipped")
            .build());

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(4);
        assertThat(printed())
            .contains("FAILED        create segment 30 'IoT' (VLAN in use)")
            .contains("SKIPPED       create rule LAN_IN#2001 'iot' (dependency create:segment/30 did not succeed)")
            .contains("backup: /backups/controller-backup-x.unf")
            .contains("error NC-304: 1 operation(s) failed, 1 skipped");
    }

    @Test
    void planningFailureListsOffendingOperations() {
        properties.setCommand("plan");
        when(reconciliationService.run(RunMode.DRY_RUN)).thenReturn(report(RunMode.DRY_RUN, RunStatus.PLANNING_FAILED)
            .offendingOperations(List.of("create:segment/10", "create:segment/20"))
            .build());

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(3);
        assertThat(printed()).contains("offending: create:segment/10", "offending: create:segment/20");
    }

    @Test
    void unknownCommandIsAUsageError() {
        properties.setCommand("destroy");

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(2);
        assertThat(printed()).contains("Unknown command 'destroy'");
        verifyNoInteractions(reconciliationService);
    }

    @Test
    void backupAndStatusPrintControllerDetails() {
        properties.setCommand("backup");
        when(reconciliationService.backup()).thenReturn(
            new SnapshotHandle("controller-backup-1", "/b/controller-backup-1.unf", 512, Instant.now()));

        runner.run(new DefaultApplicationArguments());

        assertThat(printed()).contains("Backup controller-backup-1 saved to /b/controller-backup-1.unf (512 bytes)");

        properties.setCommand("status");
        when(reconciliationService.controllerStatus()).thenReturn(
            new ControllerStatus("https://unifi:8443", "default", "8.1.113", "unifi", 3, 7));

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
        assertThat(printed())
            .contains("Controller https://unifi:8443 (site default): version 8.1.113, host unifi")
            .contains("3 segments, 7 firewall rules");
    }

    @Test
    void controllerFailureExitsWithFive() {
        properties.setCommand("status");
        when(reconciliationService.controllerStatus()).thenThrow(FatalApiException.authFailure("bad credentials"));

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(5);
        assertThat(printed()).contains("ERROR NC-300: bad credentials");
    }
}
