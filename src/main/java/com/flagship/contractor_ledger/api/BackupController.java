package com.flagship.contractor_ledger.api;

import com.flagship.contractor_ledger.backup.BackupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/backup")
@RequiredArgsConstructor
public class BackupController {

    private final BackupService backupService;

    @PostMapping
    public Map<String, Integer> backupNow() {
        return Map.of("bytes", backupService.backupNow());
    }

    @PostMapping("/restore")
    public ResponseEntity<Void> restoreLatest() {
        backupService.restoreLatest();
        return ResponseEntity.noContent().build();
    }
}
