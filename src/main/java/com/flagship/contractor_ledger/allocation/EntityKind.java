package com.flagship.contractor_ledger.allocation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.contractor_ledger.common.CodedEnum;

/**
 * Whose open invoices to look up: a company's running account or a project.
 */
public enum EntityKind implements CodedEnum {
    COMPANY("company"),
    PROJECT("project");

    private final String code;

    EntityKind(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static EntityKind fromCode(String code) {
        return CodedEnum.fromCode(EntityKind.class, code);
    }
}
