package com.flagship.contractor_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.contractor_ledger.category.CategoryType;
import com.flagship.contractor_ledger.common.CodedEnum;

/**
 * The four transaction types and everything derived from them: document kind, cash flow
 * direction, category group and the counterpart type for allocation.
 *
 * All type-dependent behavior reads this table rather than switching on the type.
 */
public enum TransactionType implements CodedEnum {
    /** Sales invoice issued by the firm; creates a receivable */
    INVOICE_OUT("invoice_out", Kind.INVOICE, Flow.INCOME, CategoryType.INVOICE_OUT),
    /** Collection received from a counterparty; settles sales invoices */
    PAYMENT_IN("payment_in", Kind.PAYMENT, Flow.INCOME, CategoryType.PAYMENT),
    /** Purchase invoice received by the firm; creates a payable */
    INVOICE_IN("invoice_in", Kind.INVOICE, Flow.EXPENSE, CategoryType.INVOICE_IN),
    /** Payment made by the firm; settles purchase invoices */
    PAYMENT_OUT("payment_out", Kind.PAYMENT, Flow.EXPENSE, CategoryType.PAYMENT);

    public enum Kind { INVOICE, PAYMENT }

    public enum Flow { INCOME, EXPENSE }

    private final String code;
    private final Kind kind;
    private final Flow flow;
    private final CategoryType categoryGroup;

    TransactionType(String code, Kind kind, Flow flow, CategoryType categoryGroup) {
        this.code = code;
        this.kind = kind;
        this.flow = flow;
        this.categoryGroup = categoryGroup;
    }

    @Override
    @JsonValue
    public String code() {
        return code;
    }

    public Kind kind() {
        return kind;
    }

    public Flow flow() {
        return flow;
    }

    public CategoryType categoryGroup() {
        return categoryGroup;
    }

    public boolean isInvoice() {
        return kind == Kind.INVOICE;
    }

    public boolean isPayment() {
        return kind == Kind.PAYMENT;
    }

    /**
     * +1 for income-side types, -1 for expense-side types.
     */
    public int sign() {
        return flow == Flow.INCOME ? 1 : -1;
    }

    /**
     * Only payments carry allocations; invoices are allocation targets.
     */
    public boolean allowsAllocation() {
        return isPayment();
    }

    /**
     * The invoice type a payment of this type settles.
     *
     * @throws IllegalStateException if this type is not a payment
     */
    public TransactionType settledInvoiceType() {
        if (!isPayment()) {
            throw new IllegalStateException(code + " does not settle invoices");
        }
        return flow == Flow.INCOME ? INVOICE_OUT : INVOICE_IN;
    }

    /**
     * The payment type that settles an invoice of this type.
     *
     * @throws IllegalStateException if this type is not an invoice
     */
    public TransactionType settlingPaymentType() {
        if (!isInvoice()) {
            throw new IllegalStateException(code + " is not settled by payments");
        }
        return flow == Flow.INCOME ? PAYMENT_IN : PAYMENT_OUT;
    }

    @JsonCreator
    public static TransactionType fromCode(String code) {
        return CodedEnum.fromCode(TransactionType.class, code);
    }
}
