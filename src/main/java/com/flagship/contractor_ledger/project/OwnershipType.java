package com.flagship.contractor_ledger.project;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.contractor_ledger.common.CodedEnum;

public enum OwnershipType implements CodedEnum {
    /** The firm builds for itself: no client, profitability is income minus cost */
    OWN("own"),
    /** Contract work for a client company, which must be set on the project */
    CLIENT("client");

    private final String code;

    OwnershipType(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static OwnershipType fromCode(String code) {
        return CodedEnum.fromCode(OwnershipType.class, code);
    }
}
