package com.flagship.contractor_ledger.company;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.contractor_ledger.common.CodedEnum;

public enum CompanyKind implements CodedEnum {
    /** Individual, identified by national id */
    PERSON("person"),
    /** Legal entity, identified by tax office and tax number */
    ORGANIZATION("organization");

    private final String code;

    CompanyKind(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static CompanyKind fromCode(String code) {
        return CodedEnum.fromCode(CompanyKind.class, code);
    }
}
