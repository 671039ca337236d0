package com.flagship.contractor_ledger.exception;

import java.util.UUID;

public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String entity, UUID id) {
        return new NotFoundException(String.format("%s not found: %s", entity, id));
    }
}
