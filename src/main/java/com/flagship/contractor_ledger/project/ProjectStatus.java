package com.flagship.contractor_ledger.project;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.contractor_ledger.common.CodedEnum;

public enum ProjectStatus implements CodedEnum {
    PLANNED("planned"),
    ACTIVE("active"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String code;

    ProjectStatus(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ProjectStatus fromCode(String code) {
        return CodedEnum.fromCode(ProjectStatus.class, code);
    }
}
