package com.flagship.contractor_ledger.allocation;

import com.flagship.contractor_ledger.exception.ValidationException;
import com.flagship.contractor_ledger.transaction.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AutoAllocateFifoTest {

    private static OpenInvoice invoice(LocalDate date, long sequence, String remaining) {
        return OpenInvoice.builder()
            .invoiceId(UUID.randomUUID())
            .type(TransactionType.INVOICE_IN)
            .date(date)
            .sequenceNumber(sequence)
            .remaining(new BigDecimal(remaining))
            .build();
    }

    @Test
    @DisplayName("Unordered input is walked oldest first")
    void sortsBeforeAllocating() {
        OpenInvoice late = invoice(LocalDate.of(2024, 5, 1), 1, "100");
        OpenInvoice early = invoice(LocalDate.of(2024, 1, 1), 2, "100");

        List<AllocationRequest> result = AllocationEngine.autoAllocateFifo(List.of(late, early), new BigDecimal("150"));

        assertEquals(2, result.size());
        assertEquals(early.getInvoiceId(), result.get(0).getInvoiceId());
        assertEquals(0, result.get(0).getAmount().compareTo(new BigDecimal("100.00")));
        assertEquals(late.getInvoiceId(), result.get(1).getInvoiceId());
        assertEquals(0, result.get(1).getAmount().compareTo(new BigDecimal("50.00")));
    }

    @Test
    @DisplayName("Sequence number breaks ties within a day")
    void sequenceBreaksTies() {
        LocalDate day = LocalDate.of(2024, 1, 1);
        OpenInvoice second = invoice(day, 9, "100");
        OpenInvoice first = invoice(day, 3, "100");

        List<AllocationRequest> result = AllocationEngine.autoAllocateFifo(List.of(second, first), new BigDecimal("100"));

        assertEquals(1, result.size());
        assertEquals(first.getInvoiceId(), result.get(0).getInvoiceId());
    }

    @Test
    @DisplayName("A payment larger than all open invoices leaves the excess unallocated")
    void excessStaysUnallocated() {
        List<OpenInvoice> open = List.of(invoice(LocalDate.of(2024, 1, 1), 1, "40"),
            invoice(LocalDate.of(2024, 1, 2), 2, "60"));

        List<AllocationRequest> result = AllocationEngine.autoAllocateFifo(open, new BigDecimal("500"));

        BigDecimal total = result.stream().map(AllocationRequest::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, total.compareTo(new BigDecimal("100.00")));
    }

    @Test
    @DisplayName("No open invoices yields no allocations")
    void emptyInput() {
        assertTrue(AllocationEngine.autoAllocateFifo(List.of(), new BigDecimal("10")).isEmpty());
    }

    @Test
    @DisplayName("A non-positive payment amount is rejected")
    void rejectsNonPositiveAmount() {
        assertThrows(ValidationException.class, () -> AllocationEngine.autoAllocateFifo(List.of(), BigDecimal.ZERO));
        assertThrows(ValidationException.class, () -> AllocationEngine.autoAllocateFifo(List.of(), null));
    }
}
