package com.flagship.contractor_ledger.persistence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Keeps a snapshot file in step with the database.
 *
 * When {@code ledger.persistence.snapshot-file} is set, the file is loaded once the application is
 * ready and rewritten before every mutating commit. The write goes to a temporary file that is then
 * moved over the target. A failed write aborts the commit, so the file never holds state the
 * database rejected.
 */
@Component
@Slf4j
public class SnapshotFilePersister implements CommitListener {

    private final SnapshotService snapshotService;
    private final Path snapshotFile;

    public SnapshotFilePersister(SnapshotService snapshotService,
                                 @Value("${ledger.persistence.snapshot-file:}") String snapshotFile) {
        this.snapshotService = snapshotService;
        this.snapshotFile = snapshotFile == null || snapshotFile.isBlank() ? null : Paths.get(snapshotFile);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadExisting() {
        if (snapshotFile == null) {
            log.info("No snapshot file configured; ledger is kept in memory only");
            return;
        }
        if (!Files.exists(snapshotFile)) {
            log.info("Snapshot file {} does not exist yet; starting with an empty ledger", snapshotFile);
            return;
        }
        try {
            snapshotService.loadFromSnapshot(Files.readAllBytes(snapshotFile));
            log.info("Loaded ledger from {}", snapshotFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot file " + snapshotFile, e);
        }
    }

    @Override
    public void beforeCommit() {
        if (snapshotFile == null) {
            return;
        }
        byte[] bytes = snapshotService.exportSnapshotInTransaction();
        try {
            Path parent = snapshotFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = snapshotFile.resolveSibling(snapshotFile.getFileName() + ".tmp");
            Files.write(temp, bytes);
            Files.move(temp, snapshotFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote snapshot ({} bytes) to {}", bytes.length, snapshotFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot file " + snapshotFile, e);
        }
    }

    public boolean isEnabled() {
        return snapshotFile != null;
    }
}
