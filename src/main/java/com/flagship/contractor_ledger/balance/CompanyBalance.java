package com.flagship.contractor_ledger.balance;

import com.flagship.contractor_ledger.company.Company;
import lombok.Value;

@Value
public class CompanyBalance {
    Company company;
    CompanyLedger ledger;
}
