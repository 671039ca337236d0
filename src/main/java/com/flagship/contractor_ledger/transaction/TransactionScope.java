package com.flagship.contractor_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.contractor_ledger.common.CodedEnum;

/**
 * Which view a transaction primarily belongs to.
 */
public enum TransactionScope implements CodedEnum {
    /** Running account of one company; requires a company */
    CARI("cari"),
    /** Project cost or revenue; requires a project, the company is optional */
    PROJECT("project"),
    /** Firm overhead; never tied to a project */
    COMPANY("company");

    private final String code;

    TransactionScope(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static TransactionScope fromCode(String code) {
        return CodedEnum.fromCode(TransactionScope.class, code);
    }
}
