package com.flagship.contractor_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contractor_ledger.company.CompanyKind;
import com.flagship.contractor_ledger.company.CompanyRequest;
import com.flagship.contractor_ledger.company.CompanyRole;
import com.flagship.contractor_ledger.company.CompanyUpdate;
import jakarta.validation.constraints.Email;
import lombok.Value;

/**
 * Company body for both create and update. On update, absent fields keep their stored values.
 */
@Value
public class CompanyPayload {

    @JsonProperty("kind")
    CompanyKind kind;

    @JsonProperty("role")
    CompanyRole role;

    @JsonProperty("name")
    String name;

    @JsonProperty("national_id")
    String nationalId;

    @JsonProperty("tax_office")
    String taxOffice;

    @JsonProperty("tax_number")
    String taxNumber;

    @JsonProperty("contact_person")
    String contactPerson;

    @JsonProperty("phone")
    String phone;

    @Email(message = "Email must be a valid address")
    @JsonProperty("email")
    String email;

    @JsonProperty("address")
    String address;

    @JsonProperty("bank_name")
    String bankName;

    @JsonProperty("iban")
    String iban;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("active")
    Boolean active;

    public CompanyRequest toRequest() {
        return CompanyRequest.builder()
            .kind(kind)
            .role(role)
            .name(name)
            .nationalId(nationalId)
            .taxOffice(taxOffice)
            .taxNumber(taxNumber)
            .contactPerson(contactPerson)
            .phone(phone)
            .email(email)
            .address(address)
            .bankName(bankName)
            .iban(iban)
            .notes(notes)
            .build();
    }

    public CompanyUpdate toUpdate() {
        return CompanyUpdate.builder()
            .kind(kind)
            .role(role)
            .name(name)
            .nationalId(nationalId)
            .taxOffice(taxOffice)
            .taxNumber(taxNumber)
            .contactPerson(contactPerson)
            .phone(phone)
            .email(email)
            .address(address)
            .bankName(bankName)
            .iban(iban)
            .notes(notes)
            .active(active)
            .build();
    }
}
