package com.flagship.contractor_ledger.trash;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * A deleted entity and everything its deletion cascaded to, serialized as one
 * {@link TrashBundle} in {@code data}.
 */
@Value
@Builder
@Jacksonized
public class TrashEntry {
    UUID id;
    TrashType type;
    String label;
    String data;
    Instant deletedAt;
}
