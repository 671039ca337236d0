package com.flagship.contractor_ledger.backup;

import java.io.IOException;
import java.util.Optional;

/**
 * Where snapshot backups go. The ledger only hands over bytes; the transport decides whether they
 * end up on local disk or a remote store.
 */
public interface BackupTransport {

    void store(byte[] snapshot) throws IOException;

    /**
     * @return the most recently stored snapshot, or empty if nothing was stored yet
     */
    Optional<byte[]> fetchLatest() throws IOException;
}
