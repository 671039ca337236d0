package com.flagship.contractor_ledger.transaction;

/**
 * Supported currencies. Balances are always computed in the base currency.
 */
public enum CurrencyCode {
    /** Turkish Lira, the base currency */
    TRY,
    USD,
    EUR;

    public static final CurrencyCode BASE = TRY;

    public boolean isBase() {
        return this == BASE;
    }
}
