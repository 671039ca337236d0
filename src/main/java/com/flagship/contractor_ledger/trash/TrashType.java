package com.flagship.contractor_ledger.trash;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.contractor_ledger.common.CodedEnum;

/**
 * What was deleted: the root entity of the bundle.
 */
public enum TrashType implements CodedEnum {
    COMPANY("company"),
    PROJECT("project"),
    TRANSACTION("transaction");

    private final String code;

    TrashType(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static TrashType fromCode(String code) {
        return CodedEnum.fromCode(TrashType.class, code);
    }
}
