package com.flagship.contractor_ledger.api;

import com.flagship.contractor_ledger.allocation.AllocationRequest;
import com.flagship.contractor_ledger.allocation.EntityKind;
import com.flagship.contractor_ledger.allocation.OpenInvoice;
import com.flagship.contractor_ledger.ledger.LedgerService;
import com.flagship.contractor_ledger.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Open invoices of a company or project, and FIFO previews over them.
 */
@RestController
@RequestMapping("/api/open-invoices")
@RequiredArgsConstructor
public class AllocationController {

    private final LedgerService ledgerService;

    @GetMapping
    public List<OpenInvoice> openInvoices(@RequestParam("entity_id") UUID entityId,
                                          @RequestParam("entity_kind") String entityKind,
                                          @RequestParam("invoice_type") String invoiceType) {
        return ledgerService.getOpenInvoices(entityId, EntityKind.fromCode(entityKind),
            TransactionType.fromCode(invoiceType));
    }

    @GetMapping("/preview")
    public List<AllocationRequest> previewAutoAllocation(@RequestParam("entity_id") UUID entityId,
                                                         @RequestParam("entity_kind") String entityKind,
                                                         @RequestParam("invoice_type") String invoiceType,
                                                         @RequestParam("amount") BigDecimal amount) {
        return ledgerService.previewAutoAllocation(entityId, EntityKind.fromCode(entityKind),
            TransactionType.fromCode(invoiceType), amount);
    }
}
