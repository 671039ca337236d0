package com.flagship.contractor_ledger.persistence;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One entry of the applied-migrations log, carried in every snapshot.
 */
@Value
@Builder
@Jacksonized
public class AppliedMigration {
    int version;
    String name;
    Instant appliedAt;
}
