package com.flagship.contractor_ledger.api;

import com.flagship.contractor_ledger.ledger.LedgerService;
import com.flagship.contractor_ledger.trash.TrashBundle;
import com.flagship.contractor_ledger.trash.TrashEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/trash")
@RequiredArgsConstructor
public class TrashController {

    private final LedgerService ledgerService;

    @GetMapping
    public List<TrashEntry> listTrash() {
        return ledgerService.listTrash();
    }

    @PostMapping("/{id}/restore")
    public TrashBundle restore(@PathVariable UUID id) {
        return ledgerService.restoreFromTrash(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> purge(@PathVariable UUID id) {
        ledgerService.purgeFromTrash(id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public Map<String, Integer> empty() {
        return Map.of("purged", ledgerService.emptyTrash());
    }
}
