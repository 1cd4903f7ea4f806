package com.ardesk.collections.service;

import com.ardesk.collections.engine.CustomerLedger;
import lombok.Value;

import java.util.List;

/**
 * A tenant's ledger rows, read together and grouped per customer.
 */
@Value
public class TenantLedger {
    String tenantId;
    List<CustomerLedger> customers;

    public boolean isEmpty() {
        return customers.isEmpty();
    }
}
