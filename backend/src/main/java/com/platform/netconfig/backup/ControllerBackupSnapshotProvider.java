package com.platform.netconfig.backup;

import com.platform.netconfig.config.NetConfigProperties;
import com.platform.netconfig.controller.ControllerClient;
import com.platform.netconfig.error.SnapshotException;
import com.platform.netconfig.observability.ReconciliationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Downloads a controller backup archive and stores it in the backup directory.
 *
 * <p>Each snapshot gets a timestamped file; {@code controller-backup.unf}
 * always points at the latest one so restores have a fixed name.
 */
@Slf4j
@Component
public class ControllerBackupSnapshotProvider implements SnapshotProvider {
    
    static final String LATEST_FILE = "controller-backup.unf";
    
    private static final DateTimeFormatter STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);
    
    private final ControllerClient controllerClient;
    private final NetConfigProperties properties;
    private final ReconciliationMetrics metrics;
    
    public ControllerBackupSnapshotProvider(ControllerClient controllerClient,
                                            NetConfigProperties properties,
                                            ReconciliationMetrics metrics) {
        this.controllerClient = controllerClient;
        this.properties = properties;
        this.metrics = metrics;
    }
    
    @Override
    public SnapshotHandle snapshot() {
        Instant now = Instant.now();
        String id = "controller-backup-" + STAMP.format(now);
        Path directory = Paths.get(properties.getBackup().getDirectory());
        
        try {
            byte[] archive = controllerClient.exportBackup();
            if (archive == null || archive.length == 0) {
                throw new SnapshotException("Controller returned an empty backup", null);
            }
            
            Files.createDirectories(directory);
            Path target = directory.resolve(id + ".unf");
            Files.write(target, archive);
            Files.copy(target, directory.resolve(LATEST_FILE), StandardCopyOption.REPLACE_EXISTING);
            
            metrics.recordSnapshot(true);
            log.info("Saved controller backup {} ({} bytes)", target, archive.length);
            return new SnapshotHandle(id, target.toAbsolutePath().toString(), archive.length, now);
            
        } catch (SnapshotException e) {
            metrics.recordSnapshot(false);
            throw e;
        } catch (IOException e) {
            metrics.recordSnapshot(false);
            throw new SnapshotException("Cannot write backup to " + directory + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            metrics.recordSnapshot(false);
            throw new SnapshotException("Controller backup failed: " + e.getMessage(), e);
        }
    }
}
