package com.flagship.contractor_ledger.balance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Running account of one counterparty. Any payment reduces the balance immediately,
 * allocated or not.
 */
@Value
@Builder
public class CompanyLedger {
    BigDecimal totalInvoiceOut;
    BigDecimal totalPaymentIn;
    BigDecimal totalInvoiceIn;
    BigDecimal totalPaymentOut;
    /** What the counterparty owes the firm; negative when the firm was overpaid */
    BigDecimal receivable;
    /** What the firm owes the counterparty; negative when the firm overpaid */
    BigDecimal payable;
    BigDecimal balance;
}
