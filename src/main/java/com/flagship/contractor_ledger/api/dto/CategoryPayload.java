package com.flagship.contractor_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contractor_ledger.category.CategoryType;
import lombok.Value;

@Value
public class CategoryPayload {

    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    CategoryType type;

    @JsonProperty("color")
    String color;
}
