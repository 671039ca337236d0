package com.flagship.contractor_ledger.company;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.contractor_ledger.common.CodedEnum;

/**
 * Relationship of a counterparty to the firm.
 */
public enum CompanyRole implements CodedEnum {
    CUSTOMER("customer"),
    SUPPLIER("supplier"),
    SUBCONTRACTOR("subcontractor"),
    INVESTOR("investor");

    private final String code;

    CompanyRole(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static CompanyRole fromCode(String code) {
        return CodedEnum.fromCode(CompanyRole.class, code);
    }
}
