package com.platform.netconfig.reconciliation;

import com.platform.netconfig.apply.Applier;
import com.platform.netconfig.apply.OperationRenderer;
import com.platform.netconfig.backup.ControllerBackupSnapshotProvider;
import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.controller.LiveStateFetcher;
import com.platform.netconfig.diff.DiffEngine;
import com.platform.netconfig.error.ControllerApiException;
import com.platform.netconfig.error.ErrorCode;
import com.platform.netconfig.error.FatalApiException;
import com.platform.netconfig.error.PlanningException;
import com.platform.netconfig.error.RunStateException;
import com.platform.netconfig.model.NetworkSegment;
import com.platform.netconfig.observability.ReconciliationMetrics;
import com.platform.netconfig.plan.Planner;
import com.platform.netconfig.plan.ProtectedSegmentFilter;
import com.platform.netconfig.support.InMemoryControllerClient;
import com.platform.netconfig.validation.ConfigValidator;
import com.platform.netconfig.validation.HardwareProfileCatalog;
import com.platform.netconfig.validation.ViolationClass;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.platform.netconfig.support.NetworkFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReconciliationServiceTest {

    private static final String DOCUMENT = """
        segments:
          - vlan_id: 10
            name: Trusted
            subnet: 10.0.10.0/24
            gateway: 10.0.10.1
          - vlan_id: 30
            name: IoT
            subnet: 10.0.30.0/24
            gateway: 10.0.30.1
        firewall_rules:
          - chain: LAN_IN
            priority: 2001
            name: block-iot-to-trusted
            action: deny
            source: {segment: 30}
            destination: {segment: 10}
        """;

    /** Segment 10 exactly as the document declares it. */
    private static final NetworkSegment TRUSTED = new NetworkSegment(10, "Trusted", null, "10.0.10.0/24", "10.0.10.1",
        null, null, null);

    @TempDir
    Path workDir;

    private NetConfigProperties properties;
    private InMemoryControllerClient controller;

    @BeforeEach
    void setUp() throws IOException {
        properties = new NetConfigProperties();
        properties.setDesiredStatePath(workDir.resolve("network.yaml").toString());
        properties.getBackup().setDirectory(workDir.resolve("backups").toString());
        properties.getHardware().setProfile("usg3p");
        properties.getApply().setMaxConcurrency(2);
        Files.writeString(workDir.resolve("network.yaml"), DOCUMENT);

        NetworkSegment management = new NetworkSegment(1, "Default", null, "192.168.1.0/24", "192.168.1.1",
            null, null, null);
        controller = new InMemoryControllerClient(state(management, TRUSTED));
    }

    private ReconciliationService service() {
        return service(new Planner(List.of(new ProtectedSegmentFilter(properties))));
    }

    private ReconciliationService service(Planner planner) {
        ReconciliationMetrics metrics = new ReconciliationMetrics(new SimpleMeterRegistry());
        return new ReconciliationService(
            properties,
            new DesiredStateLoader(),
            new HardwareProfileCatalog(properties),
            new ConfigValidator(properties),
            new LiveStateFetcher(controller),
            new DiffEngine(properties),
            planner,
            new Applier(controller, new OperationRenderer(), metrics, properties),
            new ControllerBackupSnapshotProvider(controller, properties, metrics),
            controller,
            metrics);
    }

    @Test
    void validateOnlyNeverContactsTheController() {
        RunReport report = service().run(RunMode.VALIDATE_ONLY);

        assertThat(report.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(report.exitCode()).isZero();
        assertThat(report.getPlan()).isNull();
        assertThat(controller.calls()).isEmpty();
    }

    @Test
    void invalidDocumentStopsBeforeFetching() throws IOException {
        Files.writeString(workDir.resolve("network.yaml"), DOCUMENT.replace("10.0.30.0/24", "10.0.10.0/25"));

        RunReport report = service().run(RunMode.APPLY);

        assertThat(report.getStatus()).isEqualTo(RunStatus.VALIDATION_FAILED);
        assertThat(report.exitCode()).isEqualTo(2);
        assertThat(report.getViolations()).isNotEmpty()
            .allSatisfy(v -> assertThat(v.violationClass()).isEqualTo(ViolationClass.STRUCTURAL));
        assertThat(controller.calls()).isEmpty();
    }

    @Test
    void missingDocumentExitsWithOne() throws IOException {
        Files.delete(workDir.resolve("network.yaml"));

        RunReport report = service().run(RunMode.VALIDATE_ONLY);

        assertThat(report.getStatus()).isEqualTo(RunStatus.VALIDATION_FAILED);
        assertThat(report.getErrorCode()).isEqualTo(ErrorCode.DESIRED_STATE_NOT_FOUND.getCode());
        assertThat(report.exitCode()).isEqualTo(1);
    }

    @Test
    void dryRunPlansWithoutMutating() {
        RunReport report = service().run(RunMode.DRY_RUN);

        assertThat(report.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(report.getApply().dryRun()).isTrue();
        assertThat(report.getApply().actions()).hasSize(2);
        assertThat(report.getSnapshot()).isNull();
        assertThat(controller.calls()).isEmpty();
    }

    @Test
    void applyTakesBackupFirstAndConverges() {
        ReconciliationService service = service();

        RunReport first = service.run(RunMode.APPLY);

        assertThat(first.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(first.getSnapshot()).isNotNull();
        assertThat(Path.of(first.getSnapshot().location())).exists();
        assertThat(workDir.resolve("backups").resolve("controller-backup.unf")).exists();
        assertThat(controller.calls()).containsExactly(
            "exportBackup", "createSegment:30", "createFirewallRule:LAN_IN#2001");

        RunReport second = service.run(RunMode.APPLY);

        assertThat(second.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(second.getPlan().isEmpty()).isTrue();
        assertThat(second.getSnapshot()).isNull();
        assertThat(controller.calls()).hasSize(3);
    }

    @Test
    void failedSnapshotAbortsBeforeAnyMutation() {
        controller.setBackup(new byte[0]);

        RunReport report = service().run(RunMode.APPLY);

        assertThat(report.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(report.getErrorCode()).isEqualTo(ErrorCode.SNAPSHOT_FAILED.getCode());
        assertThat(report.getApply()).isNull();
        assertThat(controller.calls()).containsExactly("exportBackup");
    }

    @Test
    void failedOperationGivesPartialFailure() {
        controller.failOn("createFirewallRule:LAN_IN#2001", ControllerApiException.conflict("rejected"));

        RunReport report = service().run(RunMode.APPLY);

        assertThat(report.getStatus()).isEqualTo(RunStatus.PARTIAL_FAILURE);
        assertThat(report.exitCode()).isEqualTo(4);
        assertThat(report.getApply().failed()).hasSize(1);
    }

    @Test
    void fatalControllerErrorFailsTheRun() {
        controller.failOn("createSegment:30", FatalApiException.authFailure("session revoked"));

        RunReport report = service().run(RunMode.APPLY);

        assertThat(report.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(report.exitCode()).isEqualTo(5);
        assertThat(report.getErrorCode()).isEqualTo(ErrorCode.CONTROLLER_AUTH_FAILED.getCode());
        assertThat(report.getApply().notAttempted()).hasSize(1);
    }

    @Test
    void unreachableControllerDuringFetchFailsTheRun() {
        controller.failOn("fetchSegments", FatalApiException.unexpected(500, "boom"));

        RunReport report = service().run(RunMode.DRY_RUN);

        assertThat(report.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(report.getErrorCode()).isEqualTo(ErrorCode.CONTROLLER_UNEXPECTED.getCode());
    }

    @Test
    void planningFailureNamesOffendingOperations() {
        Planner planner = mock(Planner.class);
        when(planner.plan(any())).thenThrow(PlanningException.cycle(List.of("create:segment/30", "create:segment/40")));

        RunReport report = service(planner).run(RunMode.DRY_RUN);

        assertThat(report.getStatus()).isEqualTo(RunStatus.PLANNING_FAILED);
        assertThat(report.exitCode()).isEqualTo(3);
        assertThat(report.getOffendingOperations()).containsExactly("create:segment/30", "create:segment/40");
    }

    @Test
    void unknownHardwareProfileIsAValidationFailure() {
        properties.getHardware().setProfile("edgerouter");

        RunReport report = service().run(RunMode.VALIDATE_ONLY);

        assertThat(report.getStatus()).isEqualTo(RunStatus.VALIDATION_FAILED);
        assertThat(report.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_HARDWARE_PROFILE.getCode());
    }

    @Test
    void secondRunIsRejectedWhileOneIsActiveAndCancelStopsTheFirst() throws Exception {
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        controller = new InMemoryControllerClient(state(TRUSTED)) {
            @Override
            public List<NetworkSegment> fetchSegments() {
                fetching.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.fetchSegments();
            }
        };
        ReconciliationService service = service();

        CompletableFuture<RunReport> first = CompletableFuture.supplyAsync(() -> service.run(RunMode.APPLY));
        assertThat(fetching.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> service.run(RunMode.DRY_RUN))
            .isInstanceOf(RunStateException.class)
            .satisfies(e -> assertThat(((RunStateException) e).getErrorCode()).isEqualTo(ErrorCode.RUN_IN_PROGRESS));
        String cancelled = service.cancel();
        assertThat(service.getActiveRunId()).contains(cancelled);

        release.countDown();
        RunReport report = first.get(10, TimeUnit.SECONDS);

        assertThat(report.getRunId()).isEqualTo(cancelled);
        assertThat(report.getStatus()).isEqualTo(RunStatus.PARTIAL_FAILURE);
        assertThat(report.getApply().cancelled()).isTrue();
        assertThat(controller.calls()).containsExactly("exportBackup");
        assertThat(service.getActiveRunId()).isEmpty();
    }

    @Test
    void cancelWithoutActiveRunFails() {
        assertThatThrownBy(() -> service().cancel())
            .isInstanceOf(RunStateException.class)
            .satisfies(e -> assertThat(((RunStateException) e).getErrorCode()).isEqualTo(ErrorCode.NO_RUN_IN_PROGRESS));
    }

    @Test
    void historyIsNewestFirstAndBounded() {
        properties.setRunHistorySize(2);
        ReconciliationService service = service();

        RunReport first = service.run(RunMode.VALIDATE_ONLY);
        RunReport second = service.run(RunMode.DRY_RUN);
        RunReport third = service.run(RunMode.VALIDATE_ONLY);

        assertThat(service.getRunHistory()).extracting(RunReport::getRunId)
            .containsExactly(third.getRunId(), second.getRunId());
        assertThat(service.findRun(first.getRunId())).isEmpty();
        assertThat(service.findRun(second.getRunId())).contains(second);
    }

    @Test
    void statusAndBackupOutsideARun() {
        ReconciliationService service = service();

        assertThat(service.controllerStatus().segments()).isEqualTo(2);
        assertThat(service.backup().sizeBytes()).isPositive();
        assertThat(service.hardwareProfiles()).extracting(p -> p.id()).contains("usg3p", "udm-pro");
    }
}
