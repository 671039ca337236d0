package com.flagship.contractor_ledger.company;

import lombok.Builder;
import lombok.Value;

/**
 * Partial company update. A null field leaves the stored value unchanged.
 */
@Value
@Builder
public class CompanyUpdate {
    CompanyKind kind;
    CompanyRole role;
    String name;
    String nationalId;
    String taxOffice;
    String taxNumber;
    String contactPerson;
    String phone;
    String email;
    String address;
    String bankName;
    String iban;
    String notes;
    Boolean active;
}
