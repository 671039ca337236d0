package com.flagship.contractor_ledger.category;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Category {
    UUID id;
    String name;
    CategoryType type;
    String color;
    boolean defaultCategory;
    Instant createdAt;
}
