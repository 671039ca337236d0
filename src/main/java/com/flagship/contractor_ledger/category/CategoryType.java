package com.flagship.contractor_ledger.category;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.contractor_ledger.common.CodedEnum;

/**
 * Category group. Incoming and outgoing payments share the {@link #PAYMENT} group.
 */
public enum CategoryType implements CodedEnum {
    INVOICE_OUT("invoice_out"),
    INVOICE_IN("invoice_in"),
    PAYMENT("payment");

    private final String code;

    CategoryType(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static CategoryType fromCode(String code) {
        return CodedEnum.fromCode(CategoryType.class, code);
    }
}
