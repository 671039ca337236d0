package com.flagship.contractor_ledger.backup;

import com.flagship.contractor_ledger.exception.NotFoundException;
import com.flagship.contractor_ledger.persistence.SnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * On-demand backup and restore through the configured transport.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BackupService {

    private final SnapshotService snapshotService;
    private final BackupTransport backupTransport;

    public int backupNow() {
        byte[] snapshot = snapshotService.exportSnapshot();
        try {
            backupTransport.store(snapshot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store backup", e);
        }
        log.info("Manual backup stored ({} bytes)", snapshot.length);
        return snapshot.length;
    }

    /**
     * Replaces the ledger with the latest stored backup.
     *
     * @throws NotFoundException if no backup was stored yet
     */
    public void restoreLatest() {
        byte[] snapshot;
        try {
            snapshot = backupTransport.fetchLatest()
                .orElseThrow(() -> new NotFoundException("No backup available to restore"));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read backup", e);
        }
        snapshotService.loadFromSnapshot(snapshot);
        log.info("Ledger restored from latest backup ({} bytes)", snapshot.length);
    }
}
