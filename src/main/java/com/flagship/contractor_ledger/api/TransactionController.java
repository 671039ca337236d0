package com.flagship.contractor_ledger.api;

import com.flagship.contractor_ledger.allocation.AllocationDetails;
import com.flagship.contractor_ledger.allocation.AllocationRequest;
import com.flagship.contractor_ledger.allocation.PaymentAllocation;
import com.flagship.contractor_ledger.api.dto.CreateTransactionRequest;
import com.flagship.contractor_ledger.api.dto.SetAllocationsRequest;
import com.flagship.contractor_ledger.api.dto.TransactionResponse;
import com.flagship.contractor_ledger.api.dto.UpdateTransactionRequest;
import com.flagship.contractor_ledger.balance.LedgerSummaryService;
import com.flagship.contractor_ledger.balance.TransactionTotals;
import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.ledger.LedgerService;
import com.flagship.contractor_ledger.transaction.TransactionDetails;
import com.flagship.contractor_ledger.transaction.TransactionFilter;
import com.flagship.contractor_ledger.transaction.TransactionScope;
import com.flagship.contractor_ledger.transaction.TransactionType;
import com.flagship.contractor_ledger.trash.TrashEntry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for invoices, payments and their allocations.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final LedgerService ledgerService;
    private final LedgerSummaryService summaryService;

    /**
     * Records a transaction. Payments may be allocated in the same call, either explicitly or
     * oldest invoice first with {@code auto_allocate}; a rejected allocation rejects the payment.
     */
    @PostMapping
    public ResponseEntity<TransactionResponse> createTransaction(
            @Valid @RequestBody CreateTransactionRequest request) {

        log.info("Received transaction request: type={}, scope={}, amount={}",
            request.getType().code(), request.getScope().code(), request.getAmount());

        if (request.isAutoAllocate() && request.hasAllocations()) {
            throw new ValidationException("auto_allocate cannot be combined with explicit allocations");
        }

        TransactionDetails created;
        if (request.isAutoAllocate()) {
            created = ledgerService.createPaymentWithAutoAllocation(request.toDomain());
        } else if (request.hasAllocations()) {
            created = ledgerService.createPayment(request.toDomain(), request.toAllocationRequests());
        } else {
            created = ledgerService.createTransaction(request.toDomain());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(created));
    }

    @GetMapping("/{id}")
    public TransactionResponse getTransaction(@PathVariable UUID id) {
        return TransactionResponse.from(ledgerService.getTransaction(id));
    }

    @GetMapping
    public List<TransactionResponse> listTransactions(
            @RequestParam(name = "scope", required = false) String scope,
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "company_id", required = false) UUID companyId,
            @RequestParam(name = "project_id", required = false) UUID projectId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "limit", required = false) Integer limit) {

        TransactionFilter filter = filter(scope, type, companyId, projectId, startDate, endDate, search, limit);
        return ledgerService.listTransactions(filter).stream()
            .map(TransactionResponse::from)
            .collect(Collectors.toList());
    }

    /**
     * Per-type totals over the same filter the listing accepts.
     */
    @GetMapping("/totals")
    public TransactionTotals transactionTotals(
            @RequestParam(name = "scope", required = false) String scope,
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "company_id", required = false) UUID companyId,
            @RequestParam(name = "project_id", required = false) UUID projectId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "search", required = false) String search) {

        return summaryService.transactionTotals(
            filter(scope, type, companyId, projectId, startDate, endDate, search, null));
    }

    @PatchMapping("/{id}")
    public TransactionResponse updateTransaction(@PathVariable UUID id,
                                                 @Valid @RequestBody UpdateTransactionRequest request) {
        return TransactionResponse.from(ledgerService.updateTransaction(id, request.toDomain()));
    }

    @DeleteMapping("/{id}")
    public TrashEntry deleteTransaction(@PathVariable UUID id) {
        return ledgerService.deleteTransaction(id);
    }

    /**
     * Allocations touching the transaction: what a payment settles, or what settles an invoice.
     */
    @GetMapping("/{id}/allocations")
    public List<AllocationDetails> getAllocations(@PathVariable UUID id) {
        TransactionDetails details = ledgerService.getTransaction(id);
        if (details.getType().isPayment()) {
            return ledgerService.getAllocationsForPayment(id);
        }
        return ledgerService.getAllocationsForInvoice(id);
    }

    @PutMapping("/{id}/allocations")
    public List<PaymentAllocation> setAllocations(@PathVariable UUID id,
                                                  @Valid @RequestBody SetAllocationsRequest request) {
        return ledgerService.setAllocationsForPayment(id, request.toRequests());
    }

    @GetMapping("/{id}/allocation-suggestions")
    public List<AllocationRequest> suggestAllocations(@PathVariable UUID id) {
        return ledgerService.suggestAllocations(id);
    }

    private static TransactionFilter filter(String scope, String type, UUID companyId, UUID projectId,
                                            LocalDate startDate, LocalDate endDate, String search,
                                            Integer limit) {
        return TransactionFilter.builder()
            .scope(scope != null ? TransactionScope.fromCode(scope) : null)
            .type(type != null ? TransactionType.fromCode(type) : null)
            .companyId(companyId)
            .projectId(projectId)
            .startDate(startDate)
            .endDate(endDate)
            .search(search)
            .limit(limit)
            .build();
    }
}
