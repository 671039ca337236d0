package com.flagship.contractor_ledger.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the latest backup in a local directory as {@code latest_backup.json}, next to a
 * {@code backup_meta.json} that records when it was taken and how large it is.
 */
@Component
@Slf4j
public class LocalDirectoryBackupTransport implements BackupTransport {

    static final String BACKUP_FILE = "latest_backup.json";
    static final String META_FILE = "backup_meta.json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public LocalDirectoryBackupTransport(@Value("${ledger.backup.directory:backups}") String directory,
                                         ObjectMapper objectMapper) {
        this.directory = Paths.get(directory);
        this.objectMapper = objectMapper;
    }

    @Override
    public void store(byte[] snapshot) throws IOException {
        Files.createDirectories(directory);

        Path temp = directory.resolve(BACKUP_FILE + ".tmp");
        Files.write(temp, snapshot);
        Files.move(temp, directory.resolve(BACKUP_FILE), StandardCopyOption.REPLACE_EXISTING);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("timestamp", Instant.now().toString());
        meta.put("size", snapshot.length);
        Files.write(directory.resolve(META_FILE), objectMapper.writeValueAsBytes(meta));

        log.debug("Stored backup of {} bytes in {}", snapshot.length, directory);
    }

    @Override
    public Optional<byte[]> fetchLatest() throws IOException {
        Path backup = directory.resolve(BACKUP_FILE);
        if (!Files.exists(backup)) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(backup));
    }

    public Path getDirectory() {
        return directory;
    }
}
